package io.relaypay.merchant.payment;

import static io.relaypay.merchant.ledger.LedgerFixtures.completedPayment;
import static io.relaypay.merchant.ledger.LedgerFixtures.eth;
import static io.relaypay.merchant.ledger.LedgerFixtures.fastRetryProperties;
import static io.relaypay.merchant.ledger.LedgerFixtures.retrying;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.relaypay.merchant.config.PaymentSource;
import io.relaypay.merchant.config.VerificationMode;
import io.relaypay.merchant.config.VerificationProperties;
import io.relaypay.merchant.ledger.LedgerClient;
import io.relaypay.merchant.ledger.LedgerException;
import io.relaypay.merchant.ledger.OnChainPaymentStatus;
import io.relaypay.merchant.ledger.PaymentCompletedEvent;
import io.relaypay.merchant.ledger.PaymentRecord;
import io.relaypay.merchant.ledger.ReceiptInfo;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PaymentVerificationServiceTest {

  private static final String PAYMENT_ID = "0x" + "ab".repeat(32);
  private static final String TX_HASH = "0x" + "cd".repeat(32);
  private static final String MERCHANT = "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266";
  private static final String CUSTOMER = "0x3C44CdDdB6a900fa2b585dd299e03d12FA4293BC";

  private final LedgerClient ledger = mock(LedgerClient.class);

  @Test
  void verifyPayment_acceptsMatchingCompletedPayment() {
    when(ledger.getPayment(PAYMENT_ID))
        .thenReturn(completedPayment(PAYMENT_ID, MERCHANT.toLowerCase(), CUSTOMER, "0.5"));

    var result = database().verifyPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.50");

    assertThat(result.valid()).isTrue();
    assertThat(result.data()).containsEntry("amount", "0.5").containsEntry("status", "COMPLETED");
  }

  @Test
  void verifyPayment_rejectsUnknownPayment() {
    when(ledger.getPayment(PAYMENT_ID))
        .thenReturn(
            new PaymentRecord(
                "0x" + "00".repeat(32),
                "0x0000000000000000000000000000000000000000",
                "0x0000000000000000000000000000000000000000",
                BigInteger.ZERO,
                BigInteger.ZERO,
                0,
                OnChainPaymentStatus.PENDING,
                "0x" + "00".repeat(32),
                BigInteger.ZERO));

    var result = database().verifyPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.5");

    assertThat(result.valid()).isFalse();
    assertThat(result.reason()).isEqualTo("Payment not found in blockchain database");
  }

  @Test
  void verifyPayment_rejectsMerchantMismatch() {
    when(ledger.getPayment(PAYMENT_ID))
        .thenReturn(completedPayment(PAYMENT_ID, CUSTOMER, CUSTOMER, "0.5"));

    var result = database().verifyPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.5");

    assertThat(result.valid()).isFalse();
    assertThat(result.reason()).startsWith("Merchant address mismatch");
  }

  @Test
  void verifyPayment_rejectsAmountMismatch() {
    when(ledger.getPayment(PAYMENT_ID))
        .thenReturn(completedPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.4"));

    var result = database().verifyPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.5");

    assertThat(result.valid()).isFalse();
    assertThat(result.reason()).isEqualTo("Amount mismatch. Expected: 0.5 ETH, Got: 0.4 ETH");
  }

  @Test
  void verifyPayment_rejectsMalformedPaymentIdWithoutQueryingLedger() {
    var result = database().verifyPayment("0x1234", MERCHANT, CUSTOMER, "0.5");

    assertThat(result.valid()).isFalse();
    assertThat(result.reason()).contains("32-byte hex");
    verifyNoInteractions(ledger);
  }

  @Test
  void verifyPayment_reportsLedgerFailureAsFailedCheck() {
    when(ledger.getPayment(PAYMENT_ID)).thenThrow(new LedgerException("getPayment reverted"));

    var result = database().verifyPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.5");

    assertThat(result.valid()).isFalse();
    assertThat(result.reason()).isEqualTo("Blockchain query failed: getPayment reverted");
  }

  @Test
  void verifyPayment_acceptsEverythingWhenVerificationDisabled() {
    var properties =
        new VerificationProperties(
            null, null, null, null, VerificationMode.VERIFICATION_DISABLED, null, false);
    var service =
        new PaymentVerificationService(retrying(ledger), properties, fastRetryProperties());

    var result = service.verifyPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.5");

    assertThat(result.valid()).isTrue();
    assertThat(result.data()).containsEntry("verification", "skipped");
    verifyNoInteractions(ledger);
  }

  @Test
  void verifyPayment_fromEventsAcceptsSufficientlyConfirmedEvent() {
    when(ledger.getBlockNumber()).thenReturn(1_000L);
    when(ledger.findPaymentCompletedEvents(anyString(), anyString(), anyLong(), anyLong()))
        .thenReturn(List.of(event(990L)));

    var result = events().verifyPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.5");

    assertThat(result.valid()).isTrue();
    assertThat(result.data())
        .containsEntry("confirmations", 10L)
        .containsEntry("merchantAmount", "0.49")
        .containsEntry("amount", "0.5");
  }

  @Test
  void verifyPayment_fromEventsRejectsShallowEvent() {
    when(ledger.getBlockNumber()).thenReturn(1_000L);
    when(ledger.findPaymentCompletedEvents(anyString(), anyString(), anyLong(), anyLong()))
        .thenReturn(List.of(event(999L)));

    var result = events().verifyPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.5");

    assertThat(result.valid()).isFalse();
    assertThat(result.reason()).isEqualTo("Insufficient confirmations: 1/3");
  }

  @Test
  void verifyPayment_fromEventsRejectsMissingEvent() {
    when(ledger.getBlockNumber()).thenReturn(1_000L);
    when(ledger.findPaymentCompletedEvents(anyString(), anyString(), anyLong(), anyLong()))
        .thenReturn(List.of());

    var result = events().verifyPayment(PAYMENT_ID, MERCHANT, CUSTOMER, "0.5");

    assertThat(result.valid()).isFalse();
    assertThat(result.reason()).isEqualTo("Payment event not found in blockchain logs");
  }

  @Test
  void verifyReceipt_reportsConfirmationDepth() {
    when(ledger.getTransactionReceipt(TX_HASH))
        .thenReturn(Optional.of(new ReceiptInfo(TX_HASH, 100L, true, MERCHANT)));
    when(ledger.getBlockNumber()).thenReturn(110L);

    var result = database().verifyReceipt(TX_HASH);

    assertThat(result.valid()).isTrue();
    assertThat(result.data())
        .containsEntry("confirmations", 10L)
        .containsEntry("blockNumber", 100L);
  }

  @Test
  void verifyReceipt_failsForMissingOrRevertedOrShallowTransactions() {
    var service = database();
    when(ledger.getBlockNumber()).thenReturn(101L);

    when(ledger.getTransactionReceipt(TX_HASH)).thenReturn(Optional.empty());
    assertThat(service.verifyReceipt(TX_HASH).reason())
        .isEqualTo("Transaction not found on blockchain");

    when(ledger.getTransactionReceipt(TX_HASH))
        .thenReturn(Optional.of(new ReceiptInfo(TX_HASH, 50L, false, MERCHANT)));
    assertThat(service.verifyReceipt(TX_HASH).valid()).isFalse();

    when(ledger.getTransactionReceipt(TX_HASH))
        .thenReturn(Optional.of(new ReceiptInfo(TX_HASH, 100L, true, MERCHANT)));
    var shallow = service.verifyReceipt(TX_HASH);
    assertThat(shallow.valid()).isFalse();
    assertThat(shallow.data()).containsEntry("confirmations", 1L);
  }

  @Test
  void currentConfirmations_isZeroWithoutReceipt() {
    when(ledger.getTransactionReceipt(TX_HASH)).thenReturn(Optional.empty());

    assertThat(database().currentConfirmations(TX_HASH)).isZero();
  }

  @Test
  void parseEther_convertsDecimalEthToWei() {
    assertThat(PaymentVerificationService.parseEther("1.5")).contains(eth("1.5"));
    assertThat(PaymentVerificationService.parseEther("abc")).isEmpty();
    assertThat(PaymentVerificationService.parseEther("0.0000000000000000001")).isEmpty();
  }

  private PaymentVerificationService database() {
    return service(PaymentSource.PAYMENT_DATABASE);
  }

  private PaymentVerificationService events() {
    return service(PaymentSource.PAYMENT_EVENTS);
  }

  private PaymentVerificationService service(PaymentSource source) {
    var properties = new VerificationProperties(null, null, null, null, null, source, false);
    return new PaymentVerificationService(retrying(ledger), properties, fastRetryProperties());
  }

  private static PaymentCompletedEvent event(long blockNumber) {
    return new PaymentCompletedEvent(
        PAYMENT_ID, MERCHANT, eth("0.49"), eth("0.005"), eth("0.005"), blockNumber, TX_HASH);
  }
}
