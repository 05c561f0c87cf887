package io.relaypay.merchant.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.relaypay.merchant.config.MonitorProperties;
import io.relaypay.merchant.ledger.TransientLedgerException;
import io.relaypay.merchant.notification.EmailKind;
import io.relaypay.merchant.notification.EmailNotifier;
import io.relaypay.merchant.notification.RealtimePublisher;
import io.relaypay.merchant.order.OrderSnapshot;
import io.relaypay.merchant.order.OrderStatus;
import io.relaypay.merchant.order.OrderStore;
import io.relaypay.merchant.order.OrderUpdate;
import io.relaypay.merchant.payment.PaymentVerificationService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

class ConfirmationMonitorTest {

  private static final String ORDER = "order-1";
  private static final String TX_HASH = "0x" + "cd".repeat(32);
  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

  private final TaskScheduler scheduler = mock(TaskScheduler.class);
  private final PaymentVerificationService payments = mock(PaymentVerificationService.class);
  private final OrderStore orderStore = mock(OrderStore.class);
  private final EmailNotifier emailNotifier = mock(EmailNotifier.class);
  private final RealtimePublisher publisher = mock(RealtimePublisher.class);
  private final ScheduledFuture<?> future = mock(ScheduledFuture.class);
  private final List<Runnable> scheduledPolls = new ArrayList<>();

  private ConfirmationMonitor monitor;

  @BeforeEach
  void setUp() {
    when(scheduler.scheduleAtFixedRate(
            any(Runnable.class), any(Instant.class), any(Duration.class)))
        .thenAnswer(
            invocation -> {
              scheduledPolls.add(invocation.getArgument(0));
              return future;
            });
    when(orderStore.updateOrder(eq(ORDER), any(OrderUpdate.class)))
        .thenReturn(
            new OrderSnapshot(
                ORDER, OrderStatus.PAYMENT_CONFIRMED, "buyer@example.com", new BigDecimal("0.5")));
    monitor =
        new ConfirmationMonitor(
            scheduler,
            payments,
            orderStore,
            emailNotifier,
            publisher,
            new MonitorProperties(12, Duration.ofSeconds(30)),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void startMonitoring_twiceForSameOrderSchedulesOneJob() {
    monitor.startMonitoring(ORDER, TX_HASH, "11155111");
    monitor.startMonitoring(ORDER, TX_HASH, "11155111");

    assertThat(scheduledPolls).hasSize(1);
    assertThat(monitor.activeOrderKeys()).containsExactly(ORDER);
    assertThat(monitor.stateOf(ORDER)).isEqualTo(MonitorState.MONITORING);
    verify(scheduler)
        .scheduleAtFixedRate(
            any(Runnable.class), eq(NOW.plusSeconds(30)), eq(Duration.ofSeconds(30)));
  }

  @Test
  void poll_confirmsExactlyOnceWhenThresholdReached() {
    when(payments.currentConfirmations(TX_HASH)).thenReturn(11L, 11L, 12L);
    monitor.startMonitoring(ORDER, TX_HASH, "11155111");
    Runnable poll = scheduledPolls.get(0);

    poll.run();
    poll.run();
    assertThat(monitor.isActive(ORDER)).isTrue();
    verify(emailNotifier, never()).send(any(), any(), anyMap());

    poll.run();
    assertThat(monitor.isActive(ORDER)).isFalse();
    assertThat(monitor.activeOrderKeys()).isEmpty();
    verify(future).cancel(false);

    // a tick already in flight after confirmation does nothing
    poll.run();

    verify(payments, times(3)).currentConfirmations(TX_HASH);
    verify(orderStore).updateOrder(ORDER, OrderUpdate.confirmed(NOW));
    verify(emailNotifier)
        .send(
            EmailKind.PAYMENT_CONFIRMED,
            "buyer@example.com",
            Map.of("orderId", ORDER, "amount", "0.5", "txHash", TX_HASH));
    verify(publisher)
        .publish(ORDER, "payment-confirmed", Map.of("orderId", ORDER, "confirmations", 12L));
    verify(publisher, times(3)).publish(eq(ORDER), eq("confirmation-update"), anyMap());
    verify(publisher)
        .publish(ORDER, "confirmation-update", Map.of("confirmations", 12L, "required", 12));
  }

  @Test
  void poll_keepsJobAliveWhenLedgerFails() {
    when(payments.currentConfirmations(TX_HASH))
        .thenThrow(new TransientLedgerException("timeout"))
        .thenReturn(3L);
    monitor.startMonitoring(ORDER, TX_HASH, "11155111");
    Runnable poll = scheduledPolls.get(0);

    poll.run();
    assertThat(monitor.isActive(ORDER)).isTrue();

    poll.run();
    verify(orderStore).updateOrder(ORDER, OrderUpdate.confirmations(3L));
    assertThat(monitor.isActive(ORDER)).isTrue();
  }

  @Test
  void poll_confirmsEvenWhenEmailFails() {
    when(payments.currentConfirmations(TX_HASH)).thenReturn(20L);
    doThrow(new IllegalStateException("smtp down"))
        .when(emailNotifier)
        .send(any(), any(), anyMap());
    monitor.startMonitoring(ORDER, TX_HASH, "11155111");

    scheduledPolls.get(0).run();

    assertThat(monitor.isActive(ORDER)).isFalse();
    verify(publisher).publish(eq(ORDER), eq("payment-confirmed"), anyMap());
  }

  @Test
  void poll_confirmsAndDeregistersWhenOrderStoreFails() {
    when(payments.currentConfirmations(TX_HASH)).thenReturn(50L);
    when(orderStore.updateOrder(eq(ORDER), any(OrderUpdate.class)))
        .thenThrow(new IllegalStateException("order " + ORDER + " not found"));
    monitor.startMonitoring(ORDER, TX_HASH, "11155111");

    scheduledPolls.get(0).run();

    assertThat(monitor.isActive(ORDER)).isFalse();
    assertThat(monitor.stateOf(ORDER)).isEqualTo(MonitorState.IDLE);
    verify(future).cancel(false);
    verify(emailNotifier, never()).send(any(), any(), anyMap());
    verify(publisher)
        .publish(ORDER, "payment-confirmed", Map.of("orderId", ORDER, "confirmations", 50L));
  }

  @Test
  void poll_confirmsAndDeregistersWhenProgressPushFails() {
    when(payments.currentConfirmations(TX_HASH)).thenReturn(50L);
    doThrow(new IllegalStateException("socket closed"))
        .when(publisher)
        .publish(eq(ORDER), eq("confirmation-update"), anyMap());
    monitor.startMonitoring(ORDER, TX_HASH, "11155111");

    scheduledPolls.get(0).run();

    assertThat(monitor.isActive(ORDER)).isFalse();
    verify(future).cancel(false);
    verify(orderStore).updateOrder(ORDER, OrderUpdate.confirmed(NOW));
    verify(emailNotifier).send(eq(EmailKind.PAYMENT_CONFIRMED), eq("buyer@example.com"), anyMap());
  }

  @Test
  void stopMonitoring_isIdempotentAndCancelsTimer() {
    monitor.startMonitoring(ORDER, TX_HASH, "11155111");

    monitor.stopMonitoring(ORDER);
    monitor.stopMonitoring(ORDER);

    verify(future, times(1)).cancel(false);
    assertThat(monitor.isActive(ORDER)).isFalse();
    assertThat(monitor.stateOf(ORDER)).isEqualTo(MonitorState.IDLE);

    scheduledPolls.get(0).run();
    verify(payments, never()).currentConfirmations(any());
  }

  @Test
  void shutdown_cancelsEveryJob() {
    monitor.startMonitoring(ORDER, TX_HASH, "11155111");
    monitor.startMonitoring("order-2", "0x" + "ef".repeat(32), "11155111");

    monitor.shutdown();

    assertThat(monitor.activeOrderKeys()).isEmpty();
    verify(future, times(2)).cancel(false);
  }
}
