package io.relaypay.merchant.ledger;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/** Classifies ledger failures into transient (retry) and permanent (fail now). */
public final class LedgerFailures {

  private LedgerFailures() {}

  public static boolean isTransient(Throwable failure) {
    Throwable current = failure;
    int depth = 0;
    while (current != null && depth++ < 10) {
      if (current instanceof TransientLedgerException
          || current instanceof InterruptedIOException
          || current instanceof ConnectException
          || current instanceof NoRouteToHostException
          || current instanceof UnknownHostException
          || current instanceof TimeoutException) {
        return true;
      }
      String message = current.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout") || lower.contains("timed out") || lower.contains("network")) {
          return true;
        }
      }
      current = current.getCause();
    }
    return false;
  }

  /** Short description for verification reasons; never a stack trace. */
  public static String describe(Throwable failure) {
    String message = failure.getMessage();
    return message != null ? message : failure.getClass().getSimpleName();
  }
}
