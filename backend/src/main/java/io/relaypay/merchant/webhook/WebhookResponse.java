package io.relaypay.merchant.webhook;

/** Body returned to the delivering listener. */
public sealed interface WebhookResponse permits ProcessedWebhookResponse, ReplayedWebhookResponse {

  String status();
}
