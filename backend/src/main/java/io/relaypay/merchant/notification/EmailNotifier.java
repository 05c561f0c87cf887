package io.relaypay.merchant.notification;

import java.util.Map;

/** Outbound customer email. Delivery itself is owned by another system. */
public interface EmailNotifier {

  /**
   * Sends a templated email.
   *
   * @param kind which template to use
   * @param recipient customer email address
   * @param fields template values such as {@code orderId}, {@code amount}, {@code txHash}
   */
  void send(EmailKind kind, String recipient, Map<String, String> fields);
}
