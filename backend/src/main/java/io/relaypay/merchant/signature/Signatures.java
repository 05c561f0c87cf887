package io.relaypay.merchant.signature;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Optional;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

/** Helpers around 65-byte Ethereum signatures ({@code r || s || v}). */
public final class Signatures {

  private Signatures() {}

  public static boolean isAddress(String address) {
    return address != null && address.startsWith("0x") && WalletUtils.isValidAddress(address);
  }

  public static boolean sameAddress(String a, String b) {
    return a != null
        && b != null
        && Numeric.cleanHexPrefix(a).equalsIgnoreCase(Numeric.cleanHexPrefix(b));
  }

  /** Parses a hex signature, accepting recovery ids 0/1 as well as 27/28. */
  public static Optional<Sign.SignatureData> parse(String signatureHex) {
    if (signatureHex == null || signatureHex.isBlank()) {
      return Optional.empty();
    }
    byte[] bytes;
    try {
      bytes = Numeric.hexStringToByteArray(signatureHex.trim());
    } catch (RuntimeException e) {
      return Optional.empty();
    }
    if (bytes.length != 65) {
      return Optional.empty();
    }
    byte v = bytes[64];
    if (v < 27) {
      v = (byte) (v + 27);
    }
    byte[] r = Arrays.copyOfRange(bytes, 0, 32);
    byte[] s = Arrays.copyOfRange(bytes, 32, 64);
    return Optional.of(new Sign.SignatureData(v, r, s));
  }

  public static String format(Sign.SignatureData signature) {
    byte[] bytes = new byte[65];
    System.arraycopy(signature.getR(), 0, bytes, 0, 32);
    System.arraycopy(signature.getS(), 0, bytes, 32, 32);
    bytes[64] = signature.getV()[0];
    return Numeric.toHexString(bytes);
  }

  /** Signer of an EIP-191 personal message ({@code "\x19Ethereum Signed Message:\n" + len}). */
  public static String recoverPersonalSigner(byte[] message, Sign.SignatureData signature)
      throws SignatureException {
    BigInteger publicKey = Sign.signedPrefixedMessageToKey(message, signature);
    return "0x" + Keys.getAddress(publicKey);
  }

  /** Signer of a raw 32-byte digest, as used for EIP-712 typed data. */
  public static String recoverDigestSigner(byte[] digest, Sign.SignatureData signature)
      throws SignatureException {
    BigInteger publicKey = Sign.signedMessageHashToKey(digest, signature);
    return "0x" + Keys.getAddress(publicKey);
  }
}
