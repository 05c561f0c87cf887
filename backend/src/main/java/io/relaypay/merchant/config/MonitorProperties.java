package io.relaypay.merchant.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param requiredConfirmations confirmations after which an order counts as settled
 * @param pollInterval time between two confirmation polls of one job
 */
@ConfigurationProperties(prefix = "relaypay.monitor")
public record MonitorProperties(int requiredConfirmations, Duration pollInterval) {

  public MonitorProperties {
    if (requiredConfirmations <= 0) {
      requiredConfirmations = 12;
    }
    if (pollInterval == null) {
      pollInterval = Duration.ofSeconds(30);
    }
  }
}
