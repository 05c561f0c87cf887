package io.relaypay.merchant.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Configuration
public class LedgerConfig {

  private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

  @Bean(destroyMethod = "shutdown")
  Web3j web3j(LedgerProperties properties) {
    log.info(
        "Connecting to ledger at {} (chain id {})", properties.rpcUrl(), properties.chainId());
    return Web3j.build(new HttpService(properties.rpcUrl()));
  }
}
