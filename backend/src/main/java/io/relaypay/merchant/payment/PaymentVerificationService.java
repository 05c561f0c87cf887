package io.relaypay.merchant.payment;

import io.relaypay.merchant.config.LedgerProperties;
import io.relaypay.merchant.config.PaymentSource;
import io.relaypay.merchant.config.VerificationMode;
import io.relaypay.merchant.config.VerificationProperties;
import io.relaypay.merchant.ledger.LedgerClient;
import io.relaypay.merchant.ledger.LedgerFailures;
import io.relaypay.merchant.ledger.OnChainPaymentStatus;
import io.relaypay.merchant.ledger.PaymentCompletedEvent;
import io.relaypay.merchant.ledger.PaymentRecord;
import io.relaypay.merchant.ledger.ReceiptInfo;
import io.relaypay.merchant.ledger.RetryingLedgerClient;
import io.relaypay.merchant.signature.Signatures;
import io.relaypay.merchant.verification.VerificationResult;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.utils.Convert;

/**
 * Confirms that a claimed payment exists on chain and matches the claim, and reports how deeply
 * its transaction is buried.
 */
@Service
public class PaymentVerificationService {

  private static final Logger log = LoggerFactory.getLogger(PaymentVerificationService.class);

  private static final Pattern BYTES32 = Pattern.compile("^0x[0-9a-fA-F]{64}$");

  private final RetryingLedgerClient ledger;
  private final VerificationMode mode;
  private final PaymentSource source;
  private final int minConfirmations;
  private final long eventLookbackBlocks;

  public PaymentVerificationService(
      RetryingLedgerClient ledger,
      VerificationProperties verification,
      LedgerProperties ledgerProperties) {
    this.ledger = ledger;
    this.mode = verification.paymentMode();
    this.source = verification.paymentSource();
    this.minConfirmations = verification.minConfirmations();
    this.eventLookbackBlocks = ledgerProperties.eventLookbackBlocks();
    if (mode == VerificationMode.VERIFICATION_DISABLED) {
      log.warn(
          "!!! On-chain payment verification is DISABLED. Every claimed payment will be accepted."
              + " Never run this configuration against a production network !!!");
    }
  }

  public VerificationResult verifyPayment(
      String paymentId, String merchant, String customer, String amount) {
    if (mode == VerificationMode.VERIFICATION_DISABLED) {
      log.warn(
          "Payment {} accepted WITHOUT on-chain verification (verification disabled)",
          paymentId);
      var data = new LinkedHashMap<String, Object>();
      data.put("paymentId", paymentId);
      data.put("merchant", merchant);
      data.put("customer", customer);
      data.put("amount", amount);
      parseEther(amount).ifPresent(wei -> data.put("amountWei", wei.toString()));
      data.put("status", OnChainPaymentStatus.COMPLETED.name());
      data.put("verification", "skipped");
      return VerificationResult.ok(data);
    }

    if (paymentId == null || !BYTES32.matcher(paymentId).matches()) {
      return VerificationResult.failure("Invalid payment id: expected 0x-prefixed 32-byte hex");
    }

    log.info("Verifying payment {} for merchant {} via {}", paymentId, merchant, source);
    try {
      return switch (source) {
        case PAYMENT_DATABASE -> verifyAgainstDatabase(paymentId, merchant, customer, amount);
        case PAYMENT_EVENTS -> verifyAgainstEvents(paymentId, merchant);
      };
    } catch (RuntimeException e) {
      log.error("Payment verification for {} failed: {}", paymentId, LedgerFailures.describe(e));
      return VerificationResult.failure("Blockchain query failed: " + LedgerFailures.describe(e));
    }
  }

  public VerificationResult verifyReceipt(String transactionHash) {
    log.info("Verifying transaction receipt {}", transactionHash);
    try {
      Optional<ReceiptInfo> receipt =
          ledger.read(
              "getTransactionReceipt", client -> client.getTransactionReceipt(transactionHash));
      if (receipt.isEmpty()) {
        return VerificationResult.failure("Transaction not found on blockchain");
      }
      if (!receipt.get().successful()) {
        return VerificationResult.failure("Transaction failed (status 0)");
      }

      long blockNumber = receipt.get().blockNumber();
      long currentBlock = ledger.read("getBlockNumber", LedgerClient::getBlockNumber);
      long confirmations = currentBlock - blockNumber;
      log.debug(
          "Transaction {} in block {} has {} confirmations",
          transactionHash,
          blockNumber,
          confirmations);

      Map<String, Object> data = Map.of("confirmations", confirmations, "blockNumber", blockNumber);
      if (confirmations < minConfirmations) {
        return VerificationResult.failure(
            String.format(
                "Insufficient confirmations: %d (minimum: %d)", confirmations, minConfirmations),
            data);
      }
      return VerificationResult.ok(data);
    } catch (RuntimeException e) {
      log.error("Receipt lookup for {} failed: {}", transactionHash, LedgerFailures.describe(e));
      return VerificationResult.failure("Transaction query failed: " + LedgerFailures.describe(e));
    }
  }

  /**
   * Current confirmation count of a transaction, 0 while it has no receipt. Ledger failures
   * propagate to the caller.
   */
  public long currentConfirmations(String transactionHash) {
    Optional<ReceiptInfo> receipt =
        ledger.read(
            "getTransactionReceipt", client -> client.getTransactionReceipt(transactionHash));
    if (receipt.isEmpty()) {
      return 0;
    }
    long current = ledger.read("getBlockNumber", LedgerClient::getBlockNumber);
    return Math.max(0, current - receipt.get().blockNumber());
  }

  private VerificationResult verifyAgainstDatabase(
      String paymentId, String merchant, String customer, String amount) {
    PaymentRecord payment = ledger.read("getPayment", client -> client.getPayment(paymentId));

    if (!payment.exists()) {
      return VerificationResult.failure("Payment not found in blockchain database");
    }
    if (!Signatures.sameAddress(payment.merchant(), merchant)) {
      return VerificationResult.failure(
          String.format(
              "Merchant address mismatch. Expected: %s, Got: %s", merchant, payment.merchant()));
    }
    if (!Signatures.sameAddress(payment.customer(), customer)) {
      return VerificationResult.failure(
          String.format(
              "Customer address mismatch. Expected: %s, Got: %s", customer, payment.customer()));
    }
    if (payment.status() != OnChainPaymentStatus.COMPLETED) {
      return VerificationResult.failure(
          "Payment status is " + payment.status() + ", not COMPLETED");
    }
    Optional<BigInteger> claimedWei = parseEther(amount);
    if (claimedWei.isEmpty()) {
      return VerificationResult.failure("Claimed amount is not a decimal ETH value: " + amount);
    }
    if (!claimedWei.get().equals(payment.amount())) {
      return VerificationResult.failure(
          String.format(
              "Amount mismatch. Expected: %s ETH, Got: %s ETH",
              amount, toEth(payment.amount()).toPlainString()));
    }

    log.info("Payment {} verified against payment database", paymentId);
    var data = new LinkedHashMap<String, Object>();
    data.put("paymentId", payment.paymentId());
    data.put("merchant", payment.merchant());
    data.put("customer", payment.customer());
    data.put("amount", toEth(payment.amount()).toPlainString());
    data.put("amountWei", payment.amount().toString());
    data.put("timestamp", Instant.ofEpochSecond(payment.timestamp().longValue()).toString());
    data.put("status", payment.status().name());
    data.put("orderId", payment.orderId());
    data.put("nonce", payment.nonce().toString());
    return VerificationResult.ok(data);
  }

  private VerificationResult verifyAgainstEvents(String paymentId, String merchant) {
    long currentBlock = ledger.read("getBlockNumber", LedgerClient::getBlockNumber);
    long fromBlock = Math.max(0, currentBlock - eventLookbackBlocks);
    log.debug(
        "Searching PaymentCompleted for {} in blocks {}..{}", paymentId, fromBlock, currentBlock);

    List<PaymentCompletedEvent> events =
        ledger.read(
            "findPaymentCompletedEvents",
            client ->
                client.findPaymentCompletedEvents(paymentId, merchant, fromBlock, currentBlock));
    if (events.isEmpty()) {
      log.warn(
          "No PaymentCompleted event for {} in blocks {}..{}", paymentId, fromBlock, currentBlock);
      return VerificationResult.failure("Payment event not found in blockchain logs");
    }

    PaymentCompletedEvent event = events.get(0);
    if (!Signatures.sameAddress(event.merchant(), merchant)) {
      return VerificationResult.failure(
          String.format(
              "Merchant address mismatch. Expected: %s, Got: %s", merchant, event.merchant()));
    }

    long confirmations = currentBlock - event.blockNumber();
    if (confirmations < minConfirmations) {
      return VerificationResult.failure(
          String.format("Insufficient confirmations: %d/%d", confirmations, minConfirmations));
    }

    log.info(
        "Payment {} verified via PaymentCompleted event ({} confirmations)",
        paymentId,
        confirmations);
    var data = new LinkedHashMap<String, Object>();
    data.put("paymentId", event.paymentId());
    data.put("merchant", event.merchant());
    data.put("merchantAmount", toEth(event.merchantAmount()).toPlainString());
    data.put("platformFee", toEth(event.platformFee()).toPlainString());
    data.put("listenerFee", toEth(event.listenerFee()).toPlainString());
    data.put("amount", toEth(event.totalAmount()).toPlainString());
    data.put("blockNumber", event.blockNumber());
    data.put("confirmations", confirmations);
    data.put("transactionHash", event.transactionHash());
    return VerificationResult.ok(data);
  }

  static Optional<BigInteger> parseEther(String amount) {
    if (amount == null || amount.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          Convert.toWei(new BigDecimal(amount.trim()), Convert.Unit.ETHER).toBigIntegerExact());
    } catch (NumberFormatException | ArithmeticException e) {
      return Optional.empty();
    }
  }

  private static BigDecimal toEth(BigInteger wei) {
    return Convert.fromWei(new BigDecimal(wei), Convert.Unit.ETHER).stripTrailingZeros();
  }
}
