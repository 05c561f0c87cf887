package io.relaypay.merchant.notification;

import java.util.Map;

/** Pushes events to clients subscribed to a room (order id, payment id or transaction hash). */
public interface RealtimePublisher {

  void publish(String room, String event, Map<String, Object> payload);
}
