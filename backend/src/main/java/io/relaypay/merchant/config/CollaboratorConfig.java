package io.relaypay.merchant.config;

import io.relaypay.merchant.notification.EmailNotifier;
import io.relaypay.merchant.notification.LoggingEmailNotifier;
import io.relaypay.merchant.notification.LoggingRealtimePublisher;
import io.relaypay.merchant.notification.RealtimePublisher;
import io.relaypay.merchant.order.NoOpOrderStore;
import io.relaypay.merchant.order.OrderStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Logging fallbacks for the order store and notification channels. */
@Configuration
public class CollaboratorConfig {

  @Bean
  @ConditionalOnMissingBean(OrderStore.class)
  OrderStore orderStore() {
    return new NoOpOrderStore();
  }

  @Bean
  @ConditionalOnMissingBean(EmailNotifier.class)
  EmailNotifier emailNotifier() {
    return new LoggingEmailNotifier();
  }

  @Bean
  @ConditionalOnMissingBean(RealtimePublisher.class)
  RealtimePublisher realtimePublisher() {
    return new LoggingRealtimePublisher();
  }
}
