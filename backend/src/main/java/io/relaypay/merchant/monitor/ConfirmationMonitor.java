package io.relaypay.merchant.monitor;

import io.relaypay.merchant.config.MonitorProperties;
import io.relaypay.merchant.notification.EmailKind;
import io.relaypay.merchant.notification.EmailNotifier;
import io.relaypay.merchant.notification.RealtimeEvents;
import io.relaypay.merchant.notification.RealtimePublisher;
import io.relaypay.merchant.order.OrderSnapshot;
import io.relaypay.merchant.order.OrderStore;
import io.relaypay.merchant.order.OrderUpdate;
import io.relaypay.merchant.payment.PaymentVerificationService;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Polls the ledger for an order's transaction until it reaches the required confirmation depth,
 * then marks the order confirmed and tells the customer. At most one job runs per order key.
 *
 * <p>A failing ledger poll is logged and retried at the next tick. Order store and push failures
 * are logged and never keep a job alive.
 */
@Service
public class ConfirmationMonitor {

  private static final Logger log = LoggerFactory.getLogger(ConfirmationMonitor.class);

  private final ConcurrentHashMap<String, MonitoringJob> jobs = new ConcurrentHashMap<>();
  private final TaskScheduler scheduler;
  private final PaymentVerificationService payments;
  private final OrderStore orderStore;
  private final EmailNotifier emailNotifier;
  private final RealtimePublisher publisher;
  private final int requiredConfirmations;
  private final Duration pollInterval;
  private final Clock clock;

  @Autowired
  public ConfirmationMonitor(
      TaskScheduler scheduler,
      PaymentVerificationService payments,
      OrderStore orderStore,
      EmailNotifier emailNotifier,
      RealtimePublisher publisher,
      MonitorProperties properties) {
    this(
        scheduler,
        payments,
        orderStore,
        emailNotifier,
        publisher,
        properties,
        Clock.systemUTC());
  }

  ConfirmationMonitor(
      TaskScheduler scheduler,
      PaymentVerificationService payments,
      OrderStore orderStore,
      EmailNotifier emailNotifier,
      RealtimePublisher publisher,
      MonitorProperties properties,
      Clock clock) {
    this.scheduler = scheduler;
    this.payments = payments;
    this.orderStore = orderStore;
    this.emailNotifier = emailNotifier;
    this.publisher = publisher;
    this.requiredConfirmations = properties.requiredConfirmations();
    this.pollInterval = properties.pollInterval();
    this.clock = clock;
  }

  /** Starts polling for {@code orderKey}. Does nothing when a job for it already exists. */
  public void startMonitoring(String orderKey, String transactionHash, String chain) {
    var job = new MonitoringJob(orderKey, transactionHash, chain);
    if (jobs.putIfAbsent(orderKey, job) != null) {
      log.debug("Order {} is already being monitored", orderKey);
      return;
    }
    log.info(
        "Starting confirmation monitoring for order {} (tx {}, {})",
        orderKey,
        transactionHash,
        chain);
    ScheduledFuture<?> handle =
        scheduler.scheduleAtFixedRate(
            () -> poll(job), clock.instant().plus(pollInterval), pollInterval);
    job.begin(handle);
  }

  /** Cancels the job for {@code orderKey}, if any. Safe to call repeatedly. */
  public void stopMonitoring(String orderKey) {
    MonitoringJob job = jobs.remove(orderKey);
    if (job != null && job.finish(MonitorState.CANCELLED)) {
      log.info("Stopped confirmation monitoring for order {}", orderKey);
    }
  }

  public boolean isActive(String orderKey) {
    return jobs.containsKey(orderKey);
  }

  public Set<String> activeOrderKeys() {
    return Set.copyOf(jobs.keySet());
  }

  /** State of the live job for {@code orderKey}; IDLE when none is registered. */
  public MonitorState stateOf(String orderKey) {
    MonitoringJob job = jobs.get(orderKey);
    return job == null ? MonitorState.IDLE : job.state();
  }

  @PreDestroy
  public void shutdown() {
    if (!jobs.isEmpty()) {
      log.info("Cancelling {} confirmation monitoring job(s)", jobs.size());
    }
    jobs.keySet().forEach(this::stopMonitoring);
  }

  void poll(MonitoringJob job) {
    if (job.state().isTerminal()) {
      return;
    }
    String orderKey = job.orderKey();
    long confirmations;
    try {
      confirmations = payments.currentConfirmations(job.transactionHash());
    } catch (RuntimeException e) {
      log.warn("Error monitoring confirmations for order {}: {}", orderKey, e.getMessage());
      return;
    }
    log.info("Order {}: {}/{} confirmations", orderKey, confirmations, requiredConfirmations);
    recordProgress(orderKey, confirmations);

    if (confirmations >= requiredConfirmations) {
      complete(job, confirmations);
    }
  }

  private void recordProgress(String orderKey, long confirmations) {
    try {
      orderStore.updateOrder(orderKey, OrderUpdate.confirmations(confirmations));
    } catch (RuntimeException e) {
      log.warn("Failed to record confirmations for order {}: {}", orderKey, e.getMessage());
    }
    publish(
        orderKey,
        RealtimeEvents.CONFIRMATION_UPDATE,
        Map.of("confirmations", confirmations, "required", requiredConfirmations));
  }

  private void complete(MonitoringJob job, long confirmations) {
    if (!job.finish(MonitorState.CONFIRMED)) {
      return;
    }
    String orderKey = job.orderKey();
    jobs.remove(orderKey, job);
    log.info(
        "Order {} confirmed on {} with {} confirmations", orderKey, job.chain(), confirmations);

    OrderSnapshot order = null;
    try {
      order = orderStore.updateOrder(orderKey, OrderUpdate.confirmed(clock.instant()));
    } catch (RuntimeException e) {
      log.error("Failed to mark order {} as confirmed", orderKey, e);
    }

    if (order != null && order.customerEmail() != null) {
      var fields = new LinkedHashMap<String, String>();
      fields.put("orderId", orderKey);
      fields.put(
          "amount", order.totalAmount() == null ? "" : order.totalAmount().toPlainString());
      fields.put("txHash", job.transactionHash());
      try {
        emailNotifier.send(EmailKind.PAYMENT_CONFIRMED, order.customerEmail(), fields);
      } catch (RuntimeException e) {
        log.error("Failed to send confirmation email for order {}", orderKey, e);
      }
    }

    publish(
        orderKey,
        RealtimeEvents.PAYMENT_CONFIRMED,
        Map.of("orderId", orderKey, "confirmations", confirmations));
  }

  private void publish(String room, String event, Map<String, Object> payload) {
    try {
      publisher.publish(room, event, payload);
    } catch (RuntimeException e) {
      log.warn("Failed to publish {} to {}: {}", event, room, e.getMessage());
    }
  }
}
