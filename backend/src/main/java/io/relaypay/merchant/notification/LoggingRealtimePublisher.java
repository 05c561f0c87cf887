package io.relaypay.merchant.notification;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingRealtimePublisher implements RealtimePublisher {

  private static final Logger log = LoggerFactory.getLogger(LoggingRealtimePublisher.class);

  @Override
  public void publish(String room, String event, Map<String, Object> payload) {
    log.info("NoOp realtime: would emit '{}' to room {} with {}", event, room, payload);
  }
}
