package io.relaypay.merchant.order;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback used when no order store is configured. Finds nothing, so webhooks are still verified
 * and proven but no order is touched.
 */
public class NoOpOrderStore implements OrderStore {

  private static final Logger log = LoggerFactory.getLogger(NoOpOrderStore.class);

  @Override
  public Optional<OrderSnapshot> findOrder(String reference) {
    log.debug("NoOp order store: no order for {}", reference);
    return Optional.empty();
  }

  @Override
  public OrderSnapshot updateOrder(String orderKey, OrderUpdate update) {
    log.info("NoOp order store: would update order {} with {}", orderKey, update);
    return new OrderSnapshot(orderKey, update.status(), null, null);
  }
}
