package io.relaypay.merchant.listener;

import io.relaypay.merchant.config.VerificationMode;
import io.relaypay.merchant.config.VerificationProperties;
import io.relaypay.merchant.ledger.LedgerFailures;
import io.relaypay.merchant.ledger.ListenerRecord;
import io.relaypay.merchant.ledger.RetryingLedgerClient;
import io.relaypay.merchant.verification.VerificationResult;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.utils.Convert;

/**
 * Decides whether a listener may deliver webhooks: registered and active, not slashed, and above
 * the configured stake and reputation floors. Nothing is cached between requests.
 */
@Service
public class ListenerRegistryService {

  private static final Logger log = LoggerFactory.getLogger(ListenerRegistryService.class);

  private final RetryingLedgerClient ledger;
  private final VerificationMode mode;
  private final BigDecimal minStakeEth;
  private final BigInteger minStakeWei;
  private final int minReputation;

  public ListenerRegistryService(RetryingLedgerClient ledger, VerificationProperties properties) {
    this.ledger = ledger;
    this.mode = properties.listenerMode();
    this.minStakeEth = properties.minListenerStake();
    this.minStakeWei = Convert.toWei(minStakeEth, Convert.Unit.ETHER).toBigIntegerExact();
    this.minReputation = properties.minListenerReputation();
    if (mode == VerificationMode.DEGRADED_ON_FAILURE) {
      log.warn(
          "Listener registry check runs in DEGRADED_ON_FAILURE mode: listeners are accepted when"
              + " the registry cannot be reached");
    }
  }

  public VerificationResult checkListener(String address) {
    log.info("Verifying listener registration for {}", address);

    ListenerRecord record;
    try {
      record = ledger.read("getListener", client -> client.getListener(address));
    } catch (RuntimeException e) {
      return onLedgerFailure(address, e);
    }

    var info = ListenerInfo.from(address, record);
    log.debug(
        "Listener {}: active={}, slashed={}, stake={} ETH, reputation={}",
        address,
        info.active(),
        info.slashed(),
        toEth(info.stake()),
        info.reputation());

    if (!info.active()) {
      return VerificationResult.failure("Listener is not active");
    }
    if (info.slashed()) {
      return VerificationResult.failure("Listener has been slashed (banned)");
    }
    if (info.stake().compareTo(minStakeWei) < 0) {
      return VerificationResult.failure(
          String.format(
              "Listener stake too low: %s ETH (minimum: %s ETH)",
              toEth(info.stake()).toPlainString(), minStakeEth.toPlainString()));
    }
    if (info.reputation().compareTo(BigInteger.valueOf(minReputation)) < 0) {
      return VerificationResult.failure(
          String.format(
              "Listener reputation too low: %s (minimum: %d)", info.reputation(), minReputation));
    }

    log.info("Listener {} passed registry verification", address);
    return VerificationResult.ok(Map.of("listener", info));
  }

  /** Read-only statistics view of a registry entry. Ledger failures propagate. */
  public ListenerStats getListenerStats(String address) {
    ListenerRecord record = ledger.read("getListener", client -> client.getListener(address));
    String successRate =
        record.totalDelivered().signum() > 0
            ? new BigDecimal(record.successfulDeliveries())
                    .multiply(BigDecimal.valueOf(100))
                    .divide(new BigDecimal(record.totalDelivered()), 2, RoundingMode.HALF_UP)
                    .toPlainString()
                + "%"
            : "0%";
    return new ListenerStats(
        address,
        record.active(),
        record.slashed(),
        toEth(record.stake()),
        record.reputation().toString(),
        Instant.ofEpochSecond(record.registeredAt().longValue()),
        record.totalDelivered().toString(),
        record.successfulDeliveries().toString(),
        record.failedDeliveries().toString(),
        toEth(record.totalEarned()),
        successRate);
  }

  private VerificationResult onLedgerFailure(String address, RuntimeException e) {
    String cause = LedgerFailures.describe(e);
    if (!LedgerFailures.isTransient(e)) {
      log.error("Listener registry query for {} failed: {}", address, cause);
      return VerificationResult.failure("Listener registry query failed: " + cause);
    }

    log.error("Listener registry unreachable for {} after retries: {}", address, cause);
    if (mode == VerificationMode.DEGRADED_ON_FAILURE) {
      log.warn("Accepting listener {} without registry verdict (degraded mode)", address);
      return VerificationResult.degraded(
          Map.of(
              "address",
              address,
              "note",
              "Verification skipped due to RPC failure (degraded mode)"));
    }
    return VerificationResult.failure("Blockchain query failed after retries: " + cause);
  }

  private static BigDecimal toEth(BigInteger wei) {
    return Convert.fromWei(new BigDecimal(wei), Convert.Unit.ETHER).stripTrailingZeros();
  }
}
