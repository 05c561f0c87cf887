package io.relaypay.merchant.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** @param retention how long a processed payment id blocks replays */
@ConfigurationProperties(prefix = "relaypay.duplicates")
public record DuplicateProperties(Duration retention) {

  public DuplicateProperties {
    if (retention == null) {
      retention = Duration.ofHours(24);
    }
  }
}
