package io.relaypay.merchant.webhook;

/**
 * Listener identity as claimed by the request headers. Blank header values count as absent.
 *
 * @param signature {@code x-webhook-signature}
 * @param address {@code x-node-address}
 */
public record ListenerCredentials(String signature, String address) {

  public ListenerCredentials {
    signature = blankToNull(signature);
    address = blankToNull(address);
  }

  public static ListenerCredentials none() {
    return new ListenerCredentials(null, null);
  }

  public boolean hasSignature() {
    return signature != null;
  }

  public boolean hasAddress() {
    return address != null;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
