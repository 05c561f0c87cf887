package io.relaypay.merchant.webhook;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

  static final String SIGNATURE_HEADER = "x-webhook-signature";
  static final String NODE_ADDRESS_HEADER = "x-node-address";

  private final WebhookProcessingService processingService;

  public WebhookController(WebhookProcessingService processingService) {
    this.processingService = processingService;
  }

  /** Listener delivery endpoint. {@code /payment-confirmation} is kept for older relays. */
  @PostMapping({"/payment", "/payment-confirmation"})
  public ResponseEntity<WebhookResponse> receivePayment(
      @RequestBody WebhookClaim claim,
      @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
      @RequestHeader(value = NODE_ADDRESS_HEADER, required = false) String nodeAddress) {
    return ResponseEntity.ok(
        processingService.process(claim, new ListenerCredentials(signature, nodeAddress)));
  }

  @GetMapping("/stats")
  public ResponseEntity<WebhookStats> stats() {
    return ResponseEntity.ok(processingService.stats());
  }
}
