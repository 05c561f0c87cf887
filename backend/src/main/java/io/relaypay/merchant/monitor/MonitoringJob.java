package io.relaypay.merchant.monitor;

import java.util.concurrent.ScheduledFuture;

/** One order's confirmation polling. State changes are guarded by the job's monitor. */
final class MonitoringJob {

  private final String orderKey;
  private final String transactionHash;
  private final String chain;
  private ScheduledFuture<?> handle;
  private MonitorState state = MonitorState.IDLE;

  MonitoringJob(String orderKey, String transactionHash, String chain) {
    this.orderKey = orderKey;
    this.transactionHash = transactionHash;
    this.chain = chain;
  }

  String orderKey() {
    return orderKey;
  }

  String transactionHash() {
    return transactionHash;
  }

  String chain() {
    return chain;
  }

  synchronized MonitorState state() {
    return state;
  }

  /** Attaches the scheduled poll. A job stopped before this point cancels the poll at once. */
  synchronized void begin(ScheduledFuture<?> scheduled) {
    if (state.isTerminal()) {
      scheduled.cancel(false);
      return;
    }
    this.handle = scheduled;
    this.state = MonitorState.MONITORING;
  }

  /** Moves to a terminal state and cancels the poll. False when the job had already ended. */
  synchronized boolean finish(MonitorState terminal) {
    if (state.isTerminal()) {
      return false;
    }
    state = terminal;
    if (handle != null) {
      handle.cancel(false);
    }
    return true;
  }
}
