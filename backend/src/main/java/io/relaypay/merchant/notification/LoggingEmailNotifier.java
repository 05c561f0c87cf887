package io.relaypay.merchant.notification;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fallback used when no email delivery is configured. Logs instead of sending. */
public class LoggingEmailNotifier implements EmailNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingEmailNotifier.class);

  @Override
  public void send(EmailKind kind, String recipient, Map<String, String> fields) {
    log.info("NoOp email: would send {} to {} with {}", kind, recipient, fields);
  }
}
