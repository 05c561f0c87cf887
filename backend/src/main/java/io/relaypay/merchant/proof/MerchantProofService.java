package io.relaypay.merchant.proof;

import io.relaypay.merchant.config.LedgerProperties;
import io.relaypay.merchant.config.ProofProperties;
import io.relaypay.merchant.proof.ProofGenerationException.Reason;
import io.relaypay.merchant.signature.Signatures;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Convert;
import org.web3j.utils.Numeric;

/**
 * Issues merchant-signed proofs that a listener delivered a webhook. A listener redeems the proof
 * on-chain for its delivery reward, so the signed payload must match what the registry contract
 * reconstructs.
 */
@Service
public class MerchantProofService {

  private static final Logger log = LoggerFactory.getLogger(MerchantProofService.class);

  private static final Pattern BYTES32 = Pattern.compile("^0x[0-9a-fA-F]{64}$");
  private static final Duration CLOCK_SKEW = Duration.ofSeconds(60);
  private static final byte[] ZERO_BYTES32 = new byte[32];

  private final Credentials merchant;
  private final ProofProperties properties;
  private final byte[] domainSeparator;
  private final Map<String, Object> domain;
  private final Clock clock;

  @Autowired
  public MerchantProofService(ProofProperties properties, LedgerProperties ledgerProperties) {
    this(properties, ledgerProperties, Clock.systemUTC());
  }

  MerchantProofService(
      ProofProperties properties, LedgerProperties ledgerProperties, Clock clock) {
    String key = properties.merchantPrivateKey();
    if (key == null || key.isBlank()) {
      throw new IllegalStateException("relaypay.proof.merchant-private-key is not configured");
    }
    this.merchant = Credentials.create(key.trim());
    this.properties = properties;
    this.clock = clock;

    String verifyingContract = ledgerProperties.listenerRegistryAddress();
    this.domainSeparator =
        WebhookConfirmationTypedData.domainSeparator(
            properties.domainName(),
            properties.domainVersion(),
            ledgerProperties.chainId(),
            verifyingContract);
    var domainFields = new LinkedHashMap<String, Object>();
    domainFields.put("name", properties.domainName());
    domainFields.put("version", properties.domainVersion());
    domainFields.put("chainId", ledgerProperties.chainId());
    domainFields.put("verifyingContract", verifyingContract);
    this.domain = Map.copyOf(domainFields);

    log.info("Proof generator initialized, merchant address {}", merchantAddress());
  }

  /** Checksummed address of the merchant signing key. */
  public String merchantAddress() {
    return Keys.toChecksumAddress(merchant.getAddress());
  }

  /** Proof using the configured default method. */
  public MerchantProof generateProof(ProofRequest request) {
    return generateProof(request, properties.method());
  }

  public MerchantProof generateProof(ProofRequest request, ProofMethod method) {
    log.info(
        "Generating {} merchant proof for payment {} listener {}",
        method.wireName(),
        request.paymentId(),
        request.listenerAddress());
    validate(request);
    MerchantProof proof =
        switch (method) {
          case SIMPLE -> simpleProof(request);
          case EIP712 -> typedProof(request);
        };
    log.info(
        "Merchant proof generated for payment {}, signature {}...",
        request.paymentId(),
        proof.signature().substring(0, 10));
    return proof;
  }

  /** True when {@code signature} personal-signs {@code messageHex} and recovers to the signer. */
  public boolean verifyProof(String messageHex, String signature, String expectedSigner) {
    try {
      var parsed = Signatures.parse(signature);
      if (parsed.isEmpty() || messageHex == null) {
        return false;
      }
      byte[] message = Numeric.hexStringToByteArray(messageHex);
      return Signatures.sameAddress(
          Signatures.recoverPersonalSigner(message, parsed.get()), expectedSigner);
    } catch (SignatureException | RuntimeException e) {
      log.debug("Proof verification failed: {}", e.getMessage());
      return false;
    }
  }

  /**
   * Rebuilds the EIP-712 digest from the proof's domain and value and checks the recovered signer.
   * A proof whose stated digest disagrees with the rebuilt one is rejected.
   */
  public boolean verifyTypedProof(TypedDataProof proof, String expectedSigner) {
    try {
      var parsed = Signatures.parse(proof.signature());
      if (parsed.isEmpty()) {
        return false;
      }
      Map<String, Object> d = proof.domain();
      byte[] separator =
          WebhookConfirmationTypedData.domainSeparator(
              String.valueOf(d.get("name")),
              String.valueOf(d.get("version")),
              Long.parseLong(String.valueOf(d.get("chainId"))),
              String.valueOf(d.get("verifyingContract")));
      Map<String, Object> v = proof.value();
      byte[] structHash =
          WebhookConfirmationTypedData.structHash(
              Numeric.hexStringToByteArray(String.valueOf(v.get("paymentId"))),
              String.valueOf(v.get("listener")),
              String.valueOf(v.get("merchant")),
              new BigInteger(String.valueOf(v.get("amount"))),
              Numeric.hexStringToByteArray(String.valueOf(v.get("orderId"))),
              Long.parseLong(String.valueOf(v.get("timestamp"))),
              Boolean.parseBoolean(String.valueOf(v.get("received"))));
      byte[] digest = WebhookConfirmationTypedData.digest(separator, structHash);
      if (proof.digest() != null && !Numeric.toHexString(digest).equalsIgnoreCase(proof.digest())) {
        return false;
      }
      return Signatures.sameAddress(
          Signatures.recoverDigestSigner(digest, parsed.get()), expectedSigner);
    } catch (SignatureException | RuntimeException e) {
      log.debug("Typed proof verification failed: {}", e.getMessage());
      return false;
    }
  }

  private SimpleProof simpleProof(ProofRequest request) {
    byte[] packed = new byte[52];
    System.arraycopy(Numeric.hexStringToByteArray(request.paymentId()), 0, packed, 0, 32);
    System.arraycopy(Numeric.hexStringToByteArray(request.listenerAddress()), 0, packed, 32, 20);
    byte[] message = Hash.sha3(packed);
    Sign.SignatureData signature = Sign.signPrefixedMessage(message, merchant.getEcKeyPair());
    return new SimpleProof(
        Numeric.toHexString(message),
        Signatures.format(signature),
        request.timestamp().toEpochMilli());
  }

  private TypedDataProof typedProof(ProofRequest request) {
    byte[] paymentId = Numeric.hexStringToByteArray(request.paymentId());
    byte[] orderId =
        request.orderId() == null || request.orderId().isEmpty()
            ? ZERO_BYTES32
            : Hash.sha3(request.orderId().getBytes(StandardCharsets.UTF_8));
    BigInteger amountWei = request.amount() == null ? BigInteger.ZERO : toWei(request.amount());
    long timestamp = request.timestamp().toEpochMilli();

    byte[] structHash =
        WebhookConfirmationTypedData.structHash(
            paymentId,
            request.listenerAddress(),
            merchant.getAddress(),
            amountWei,
            orderId,
            timestamp,
            true);
    byte[] digest = WebhookConfirmationTypedData.digest(domainSeparator, structHash);
    Sign.SignatureData signature = Sign.signMessage(digest, merchant.getEcKeyPair(), false);

    var value = new LinkedHashMap<String, Object>();
    value.put("paymentId", request.paymentId());
    value.put("listener", request.listenerAddress());
    value.put("merchant", merchantAddress());
    value.put("amount", amountWei.toString());
    value.put("orderId", Numeric.toHexString(orderId));
    value.put("timestamp", timestamp);
    value.put("received", true);

    return new TypedDataProof(
        domain,
        WebhookConfirmationTypedData.TYPES,
        value,
        Numeric.toHexString(digest),
        Signatures.format(signature),
        timestamp);
  }

  private void validate(ProofRequest request) {
    if (request.paymentId() == null || !BYTES32.matcher(request.paymentId()).matches()) {
      throw new ProofGenerationException(
          Reason.INVALID_PARAMETER, "payment_id must be a 0x-prefixed 32-byte hex string");
    }
    if (!Signatures.isAddress(request.listenerAddress())) {
      throw new ProofGenerationException(
          Reason.INVALID_PARAMETER, "Valid listener_address is required");
    }
    if (request.timestamp() == null || request.timestamp().toEpochMilli() <= 0) {
      throw new ProofGenerationException(Reason.INVALID_PARAMETER, "Valid timestamp is required");
    }
    if (request.amount() != null) {
      toWei(request.amount());
    }

    Instant now = clock.instant();
    Duration age = Duration.between(request.timestamp(), now);
    if (age.compareTo(properties.expiry()) > 0) {
      throw new ProofGenerationException(
          Reason.STALE_TIMESTAMP,
          "Timestamp too old: %ds (max: %ds)"
              .formatted(age.toSeconds(), properties.expiry().toSeconds()));
    }
    if (request.timestamp().isAfter(now.plus(CLOCK_SKEW))) {
      throw new ProofGenerationException(Reason.FUTURE_TIMESTAMP, "Timestamp is in the future");
    }
  }

  private static BigInteger toWei(String amount) {
    try {
      BigDecimal wei = Convert.toWei(new BigDecimal(amount.trim()), Convert.Unit.ETHER);
      if (wei.signum() < 0) {
        throw new ProofGenerationException(
            Reason.INVALID_PARAMETER, "amount must not be negative: " + amount);
      }
      return wei.toBigIntegerExact();
    } catch (NumberFormatException | ArithmeticException e) {
      throw new ProofGenerationException(
          Reason.INVALID_PARAMETER, "amount is not a valid ETH decimal: " + amount);
    }
  }
}
