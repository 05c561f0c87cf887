package io.relaypay.merchant.signature;

import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks that a webhook was signed by the listener it claims to come from. Malformed signatures are
 * a failed verification, never an exception.
 */
@Component
public class ListenerSignatureVerifier {

  private static final Logger log = LoggerFactory.getLogger(ListenerSignatureVerifier.class);

  public boolean verify(String canonicalMessage, String signature, String claimedAddress) {
    if (canonicalMessage == null || signature == null || claimedAddress == null) {
      log.warn("Missing message, signature or listener address");
      return false;
    }
    var parsed = Signatures.parse(signature);
    if (parsed.isEmpty()) {
      log.warn("Malformed listener signature from {}", claimedAddress);
      return false;
    }

    String recovered;
    try {
      recovered =
          Signatures.recoverPersonalSigner(
              canonicalMessage.getBytes(StandardCharsets.UTF_8), parsed.get());
    } catch (SignatureException | RuntimeException e) {
      log.warn("Could not recover signer for listener {}: {}", claimedAddress, e.getMessage());
      return false;
    }

    boolean valid = Signatures.sameAddress(recovered, claimedAddress);
    if (!valid) {
      log.warn("Signature mismatch: expected={}, recovered={}", claimedAddress, recovered);
    } else {
      log.debug("Listener signature verified for {}", claimedAddress);
    }
    return valid;
  }
}
