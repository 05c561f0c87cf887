package io.relaypay.merchant.webhook;

import io.relaypay.merchant.config.VerificationProperties;
import io.relaypay.merchant.dedup.DuplicateTracker;
import io.relaypay.merchant.dedup.ProcessedPayment;
import io.relaypay.merchant.exception.InvalidRequestException;
import io.relaypay.merchant.exception.ListenerNotAuthorizedException;
import io.relaypay.merchant.exception.PaymentVerificationException;
import io.relaypay.merchant.exception.WebhookSignatureException;
import io.relaypay.merchant.listener.ListenerRegistryService;
import io.relaypay.merchant.monitor.ConfirmationMonitor;
import io.relaypay.merchant.notification.EmailKind;
import io.relaypay.merchant.notification.EmailNotifier;
import io.relaypay.merchant.notification.RealtimeEvents;
import io.relaypay.merchant.notification.RealtimePublisher;
import io.relaypay.merchant.order.OrderSnapshot;
import io.relaypay.merchant.order.OrderStatus;
import io.relaypay.merchant.order.OrderStore;
import io.relaypay.merchant.order.OrderUpdate;
import io.relaypay.merchant.payment.PaymentVerificationService;
import io.relaypay.merchant.proof.MerchantProof;
import io.relaypay.merchant.proof.MerchantProofService;
import io.relaypay.merchant.proof.ProofGenerationException;
import io.relaypay.merchant.proof.ProofRequest;
import io.relaypay.merchant.signature.CanonicalMessage;
import io.relaypay.merchant.signature.ListenerSignatureVerifier;
import io.relaypay.merchant.verification.VerificationResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs an inbound payment webhook through the full verification pipeline and, when it passes,
 * issues the merchant proof the listener redeems for its reward.
 *
 * <p>Order of checks: structure, replay, listener signature, listener registration, on-chain
 * payment. Any failing check ends processing with an {@code ErrorResponseException}; nothing is
 * marked processed in that case, so a legitimate listener can still deliver the same payment.
 * Order bookkeeping, email and realtime pushes are best effort and never fail a request.
 */
@Service
public class WebhookProcessingService {

  private static final Logger log = LoggerFactory.getLogger(WebhookProcessingService.class);

  private final Validator validator;
  private final DuplicateTracker duplicates;
  private final ListenerSignatureVerifier signatureVerifier;
  private final ListenerRegistryService listenerRegistry;
  private final PaymentVerificationService paymentVerification;
  private final OrderStore orderStore;
  private final EmailNotifier emailNotifier;
  private final RealtimePublisher publisher;
  private final ConfirmationMonitor monitor;
  private final MerchantProofService proofService;
  private final boolean requireSignedWebhooks;
  private final Clock clock;

  @Autowired
  public WebhookProcessingService(
      Validator validator,
      DuplicateTracker duplicates,
      ListenerSignatureVerifier signatureVerifier,
      ListenerRegistryService listenerRegistry,
      PaymentVerificationService paymentVerification,
      OrderStore orderStore,
      EmailNotifier emailNotifier,
      RealtimePublisher publisher,
      ConfirmationMonitor monitor,
      MerchantProofService proofService,
      VerificationProperties verificationProperties) {
    this(
        validator,
        duplicates,
        signatureVerifier,
        listenerRegistry,
        paymentVerification,
        orderStore,
        emailNotifier,
        publisher,
        monitor,
        proofService,
        verificationProperties,
        Clock.systemUTC());
  }

  WebhookProcessingService(
      Validator validator,
      DuplicateTracker duplicates,
      ListenerSignatureVerifier signatureVerifier,
      ListenerRegistryService listenerRegistry,
      PaymentVerificationService paymentVerification,
      OrderStore orderStore,
      EmailNotifier emailNotifier,
      RealtimePublisher publisher,
      ConfirmationMonitor monitor,
      MerchantProofService proofService,
      VerificationProperties verificationProperties,
      Clock clock) {
    this.validator = validator;
    this.duplicates = duplicates;
    this.signatureVerifier = signatureVerifier;
    this.listenerRegistry = listenerRegistry;
    this.paymentVerification = paymentVerification;
    this.orderStore = orderStore;
    this.emailNotifier = emailNotifier;
    this.publisher = publisher;
    this.monitor = monitor;
    this.proofService = proofService;
    this.requireSignedWebhooks = verificationProperties.requireSignedWebhooks();
    this.clock = clock;
  }

  public WebhookResponse process(WebhookClaim claim, ListenerCredentials credentials) {
    long startedAt = clock.millis();
    validate(claim);

    String paymentId = claim.paymentId();
    log.info(
        "Processing payment {} for merchant {} from listener {} (amount {})",
        paymentId,
        claim.merchant(),
        credentials.address(),
        claim.amount());

    if (duplicates.isProcessed(paymentId)) {
      return replay(paymentId);
    }

    authenticate(claim, credentials);
    authorize(paymentId, credentials);

    VerificationResult payment =
        paymentVerification.verifyPayment(
            paymentId, claim.merchant(), claim.customer(), claim.amount());
    if (!payment.valid()) {
      log.error("Payment verification failed for {}: {}", paymentId, payment.reason());
      throw new PaymentVerificationException(payment.reason());
    }
    log.info("Payment {} verified on chain", paymentId);

    VerificationResult receipt = paymentVerification.verifyReceipt(claim.transactionHash());
    if (!receipt.valid()) {
      log.warn(
          "Transaction {} receipt check did not pass, continuing: {}",
          claim.transactionHash(),
          receipt.reason());
    }
    long confirmations = confirmationsOf(receipt);

    Optional<OrderSnapshot> order = recordOrder(claim, confirmations);
    if (claim.claimType().startsMonitoring()) {
      order.ifPresent(o -> startMonitoring(claim, o.orderId()));
    }

    MerchantProof proof = credentials.hasAddress() ? issueProof(claim, credentials, order) : null;

    String proofSignature = proof != null ? proof.signature() : "";
    if (!duplicates.markProcessed(paymentId, credentials.address(), proofSignature)) {
      log.warn("Payment {} was processed concurrently by another delivery", paymentId);
      return replay(paymentId);
    }

    publishReceived(claim, confirmations, proof != null);

    long elapsed = clock.millis() - startedAt;
    log.info(
        "Webhook for payment {} processed in {}ms (proof generated: {})",
        paymentId,
        elapsed,
        proof != null);
    ProofView proofView =
        proof == null ? null : ProofView.of(paymentId, credentials.address(), proof);
    OrderView orderView =
        order.map(o -> new OrderView(o.orderId(), o.status(), clock.millis())).orElse(null);
    return ProcessedWebhookResponse.success(proofView, orderView, elapsed);
  }

  public WebhookStats stats() {
    return new WebhookStats(duplicates.stats(), monitor.activeOrderKeys());
  }

  private void validate(WebhookClaim claim) {
    Set<ConstraintViolation<WebhookClaim>> violations = validator.validate(claim);
    if (!violations.isEmpty()) {
      var details =
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .toList();
      log.warn("Rejected structurally invalid webhook: {}", details);
      throw new InvalidRequestException("Invalid webhook payload", details);
    }
  }

  private ReplayedWebhookResponse replay(String paymentId) {
    Optional<ProcessedPayment> original = duplicates.getOriginal(paymentId);
    log.warn(
        "Payment {} already processed by {}",
        paymentId,
        original.map(ProcessedPayment::listenerAddress).orElse("unknown"));
    return ReplayedWebhookResponse.of(
        original.map(ProcessedPayment::listenerAddress).orElse(null),
        original.map(p -> p.firstSeenAt().toEpochMilli()).orElse(null));
  }

  private void authenticate(WebhookClaim claim, ListenerCredentials credentials) {
    if (credentials.hasSignature() && credentials.hasAddress()) {
      boolean valid =
          signatureVerifier.verify(
              CanonicalMessage.of(claim), credentials.signature(), credentials.address());
      if (!valid) {
        log.error(
            "Invalid listener signature for payment {} from {}",
            claim.paymentId(),
            credentials.address());
        throw new WebhookSignatureException("Webhook signature verification failed");
      }
      log.info("Listener signature valid for {}", credentials.address());
    } else if (requireSignedWebhooks) {
      throw new WebhookSignatureException(
          "x-webhook-signature and x-node-address headers are required");
    } else {
      log.warn("Accepting unsigned webhook for payment {}", claim.paymentId());
    }
  }

  private void authorize(String paymentId, ListenerCredentials credentials) {
    if (!credentials.hasAddress()) {
      log.warn("No listener address supplied for payment {}", paymentId);
      return;
    }
    VerificationResult check = listenerRegistry.checkListener(credentials.address());
    if (!check.valid()) {
      log.error(
          "Listener {} rejected for payment {}: {}",
          credentials.address(),
          paymentId,
          check.reason());
      throw new ListenerNotAuthorizedException(check.reason());
    }
    if (check.degraded()) {
      log.warn(
          "Listener {} admitted without registry check for payment {}",
          credentials.address(),
          paymentId);
    }
  }

  private Optional<OrderSnapshot> recordOrder(WebhookClaim claim, long confirmations) {
    try {
      Optional<OrderSnapshot> found =
          orderStore
              .findOrder(claim.paymentId())
              .or(() -> orderStore.findOrder(claim.transactionHash()));
      if (found.isEmpty()) {
        log.warn("No order found for payment {}", claim.paymentId());
        return Optional.empty();
      }

      boolean completed = claim.claimType() == ClaimType.COMPLETED;
      var update =
          new OrderUpdate(
              completed ? OrderStatus.PAYMENT_CONFIRMED : OrderStatus.PAYMENT_PENDING,
              claim.transactionHash(),
              claim.blockNumber(),
              confirmations,
              "Chain " + claim.chainId(),
              claim.merchant(),
              claim.customer(),
              completed ? Instant.ofEpochMilli(claim.timestampMillis()) : null);
      OrderSnapshot updated = orderStore.updateOrder(found.get().orderId(), update);
      log.info("Order {} updated to {}", updated.orderId(), updated.status());

      notifyCustomer(updated, claim, confirmations);
      return Optional.of(updated);
    } catch (RuntimeException e) {
      log.warn(
          "Order bookkeeping skipped for payment {}: {}", claim.paymentId(), e.getMessage());
      return Optional.empty();
    }
  }

  private void notifyCustomer(OrderSnapshot order, WebhookClaim claim, long confirmations) {
    if (order.customerEmail() != null) {
      var fields = new LinkedHashMap<String, String>();
      fields.put("orderId", claim.paymentId());
      fields.put("amount", claim.amount());
      fields.put("txHash", claim.transactionHash());
      try {
        emailNotifier.send(EmailKind.PAYMENT_RECEIVED, order.customerEmail(), fields);
      } catch (RuntimeException e) {
        log.error("Failed to send payment received email for order {}", order.orderId(), e);
      }
    }

    var payload = new LinkedHashMap<String, Object>();
    payload.put("orderId", order.orderId());
    payload.put("status", order.status());
    payload.put("transactionHash", claim.transactionHash());
    payload.put("confirmations", confirmations);
    safePublish(order.orderId(), payload);
  }

  private void startMonitoring(WebhookClaim claim, String orderKey) {
    try {
      monitor.startMonitoring(
          orderKey, claim.transactionHash(), String.valueOf(claim.chainId()));
    } catch (RuntimeException e) {
      log.error("Failed to start confirmation monitoring for {}", orderKey, e);
    }
  }

  private MerchantProof issueProof(
      WebhookClaim claim, ListenerCredentials credentials, Optional<OrderSnapshot> order) {
    var request =
        new ProofRequest(
            claim.paymentId(),
            credentials.address(),
            clock.instant(),
            order.map(OrderSnapshot::orderId).orElse(null),
            claim.amount());
    try {
      MerchantProof proof = proofService.generateProof(request);
      log.info(
          "Merchant proof generated for payment {} and listener {}",
          claim.paymentId(),
          credentials.address());
      return proof;
    } catch (ProofGenerationException e) {
      log.error(
          "Merchant proof refused for payment {} ({}): {}",
          claim.paymentId(),
          e.getReason(),
          e.getMessage());
    } catch (RuntimeException e) {
      log.error("Failed to generate merchant proof for payment {}", claim.paymentId(), e);
    }
    return null;
  }

  private void publishReceived(WebhookClaim claim, long confirmations, boolean proofGenerated) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("orderId", claim.paymentId());
    payload.put("status", OrderStatus.PAYMENT_CONFIRMED);
    payload.put("transactionHash", claim.transactionHash());
    payload.put("confirmations", confirmations);
    payload.put("proofGenerated", proofGenerated);
    safePublish(claim.paymentId(), payload);
    safePublish(claim.transactionHash(), payload);
  }

  private void safePublish(String room, Map<String, Object> payload) {
    try {
      publisher.publish(room, RealtimeEvents.PAYMENT_RECEIVED, payload);
    } catch (RuntimeException e) {
      log.error("Failed to publish {} to room {}", RealtimeEvents.PAYMENT_RECEIVED, room, e);
    }
  }

  private static long confirmationsOf(VerificationResult receipt) {
    Object value = receipt.data().get("confirmations");
    long confirmations = value instanceof Number n ? n.longValue() : 0;
    return confirmations > 0 ? confirmations : 1;
  }
}
