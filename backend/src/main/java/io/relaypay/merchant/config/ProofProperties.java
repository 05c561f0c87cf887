package io.relaypay.merchant.config;

import io.relaypay.merchant.proof.ProofMethod;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Merchant proof settings. The private key is mandatory; the generator refuses to start without
 * it.
 */
@ConfigurationProperties(prefix = "relaypay.proof")
public record ProofProperties(
    String merchantPrivateKey,
    Duration expiry,
    ProofMethod method,
    String domainName,
    String domainVersion) {

  public ProofProperties {
    if (expiry == null) {
      expiry = Duration.ofHours(1);
    }
    if (method == null) {
      method = ProofMethod.SIMPLE;
    }
    if (domainName == null) {
      domainName = "Web3Pay Merchant Confirmation";
    }
    if (domainVersion == null) {
      domainVersion = "1";
    }
  }
}
