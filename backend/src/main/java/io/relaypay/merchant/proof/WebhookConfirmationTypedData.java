package io.relaypay.merchant.proof;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

/** EIP-712 hashing for the {@code WebhookConfirmation} struct. */
final class WebhookConfirmationTypedData {

  static final String PRIMARY_TYPE = "WebhookConfirmation";

  private static final String DOMAIN_TYPE =
      "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";
  private static final String STRUCT_TYPE =
      "WebhookConfirmation(bytes32 paymentId,address listener,address merchant,uint256 amount,"
          + "bytes32 orderId,uint256 timestamp,bool received)";

  static final Map<String, List<Map<String, String>>> TYPES =
      Map.of(
          PRIMARY_TYPE,
          List.of(
              field("paymentId", "bytes32"),
              field("listener", "address"),
              field("merchant", "address"),
              field("amount", "uint256"),
              field("orderId", "bytes32"),
              field("timestamp", "uint256"),
              field("received", "bool")));

  private WebhookConfirmationTypedData() {}

  static byte[] domainSeparator(
      String name, String version, long chainId, String verifyingContract) {
    var out = new ByteArrayOutputStream();
    out.writeBytes(keccak(DOMAIN_TYPE));
    out.writeBytes(keccak(name));
    out.writeBytes(keccak(version));
    out.writeBytes(encode(new Uint256(BigInteger.valueOf(chainId))));
    out.writeBytes(encode(new Address(verifyingContract)));
    return Hash.sha3(out.toByteArray());
  }

  static byte[] structHash(
      byte[] paymentId,
      String listener,
      String merchant,
      BigInteger amount,
      byte[] orderId,
      long timestamp,
      boolean received) {
    var out = new ByteArrayOutputStream();
    out.writeBytes(keccak(STRUCT_TYPE));
    out.writeBytes(paymentId);
    out.writeBytes(encode(new Address(listener)));
    out.writeBytes(encode(new Address(merchant)));
    out.writeBytes(encode(new Uint256(amount)));
    out.writeBytes(orderId);
    out.writeBytes(encode(new Uint256(BigInteger.valueOf(timestamp))));
    out.writeBytes(encode(new Bool(received)));
    return Hash.sha3(out.toByteArray());
  }

  static byte[] digest(byte[] domainSeparator, byte[] structHash) {
    var out = new ByteArrayOutputStream();
    out.write(0x19);
    out.write(0x01);
    out.writeBytes(domainSeparator);
    out.writeBytes(structHash);
    return Hash.sha3(out.toByteArray());
  }

  private static byte[] keccak(String text) {
    return Hash.sha3(text.getBytes(StandardCharsets.UTF_8));
  }

  @SuppressWarnings("rawtypes")
  private static byte[] encode(Type value) {
    return Numeric.hexStringToByteArray(TypeEncoder.encode(value));
  }

  private static Map<String, String> field(String name, String type) {
    return Map.of("name", name, "type", type);
  }
}
