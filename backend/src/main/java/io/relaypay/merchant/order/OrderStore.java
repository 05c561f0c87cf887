package io.relaypay.merchant.order;

import java.util.Optional;

/**
 * Access to the merchant's order records. The order catalogue lives outside this service; a
 * deployment supplies its own implementation as a bean.
 */
public interface OrderStore {

  /** Looks an order up by order id, payment id or transaction hash. */
  Optional<OrderSnapshot> findOrder(String reference);

  /** Applies the non-null fields of {@code update} and returns the order as stored afterwards. */
  OrderSnapshot updateOrder(String orderKey, OrderUpdate update);
}
