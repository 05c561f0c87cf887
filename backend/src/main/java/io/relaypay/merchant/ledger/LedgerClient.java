package io.relaypay.merchant.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Read-only port to the remote ledger. Implementations decode raw contract output into the typed
 * records of this package; nothing above this interface sees positional data.
 *
 * <p>Every method may throw {@link LedgerException}. Failures caused by timeouts or an unreachable
 * node are reported as {@link TransientLedgerException} or carry the network exception as cause.
 */
public interface LedgerClient {

  long getBlockNumber();

  Optional<ReceiptInfo> getTransactionReceipt(String transactionHash);

  /** Registry entry for a listener. Unregistered addresses come back as an inactive zero record. */
  ListenerRecord getListener(String listenerAddress);

  /** Payment database entry. Unknown ids come back with {@link PaymentRecord#exists()} false. */
  PaymentRecord getPayment(String paymentId);

  List<PaymentCompletedEvent> findPaymentCompletedEvents(
      String paymentId, String merchant, long fromBlock, long toBlock);
}
