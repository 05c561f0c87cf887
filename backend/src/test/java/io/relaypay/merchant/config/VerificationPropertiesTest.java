package io.relaypay.merchant.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class VerificationPropertiesTest {

  @Test
  void defaults_areStrictEverywhere() {
    var properties = VerificationProperties.defaults();

    assertThat(properties.listenerMode()).isEqualTo(VerificationMode.STRICT);
    assertThat(properties.paymentMode()).isEqualTo(VerificationMode.STRICT);
    assertThat(properties.paymentSource()).isEqualTo(PaymentSource.PAYMENT_DATABASE);
    assertThat(properties.minListenerStake()).isEqualByComparingTo(new BigDecimal("0.01"));
    assertThat(properties.minListenerReputation()).isEqualTo(30);
    assertThat(properties.minConfirmations()).isEqualTo(3);
    assertThat(properties.requireSignedWebhooks()).isFalse();
  }

  @Test
  void listenerCheckCannotBeDisabled() {
    assertThatThrownBy(
            () ->
                new VerificationProperties(
                    null, null, null, VerificationMode.VERIFICATION_DISABLED, null, null, false))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void paymentCheckCannotFailOpen() {
    assertThatThrownBy(
            () ->
                new VerificationProperties(
                    null, null, null, null, VerificationMode.DEGRADED_ON_FAILURE, null, false))
        .isInstanceOf(IllegalStateException.class);
  }
}
