package io.relaypay.merchant.listener;

import io.relaypay.merchant.exception.InvalidRequestException;
import io.relaypay.merchant.signature.Signatures;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/listeners")
public class ListenerController {

  private final ListenerRegistryService registryService;

  public ListenerController(ListenerRegistryService registryService) {
    this.registryService = registryService;
  }

  @GetMapping("/{address}")
  public ResponseEntity<ListenerStats> getListener(@PathVariable String address) {
    if (!Signatures.isAddress(address)) {
      throw new InvalidRequestException(
          "Invalid listener address", List.of("address: must be a 0x-prefixed 20-byte address"));
    }
    return ResponseEntity.ok(registryService.getListenerStats(address));
  }
}
