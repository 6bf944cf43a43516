package com.work.federation.config;

import com.work.federation.ledger.LedgerConnector;
import com.work.federation.ledger.web3j.Web3jLedgerConnector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;

/**
 * Web3j 装配：
 * 当 ledger.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "web3j")
public class Web3jLedgerConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(LedgerProperties properties) {
        // HTTP RPC；事件通过 eth_getLogs 轮询读取，不依赖 WebSocket 订阅
        return Web3j.build(new HttpService(requireNonEmpty(properties.getRpcUrl(), "ledger.rpc-url")));
    }

    @Bean
    public Credentials ledgerCredentials(LedgerProperties properties) {
        return Credentials.create(requireNonEmpty(properties.getPrivateKey(), "ledger.private-key"));
    }

    @Bean
    public LedgerConnector web3jLedgerConnector(Web3j web3j, Credentials credentials, LedgerProperties properties) {
        return new Web3jLedgerConnector(web3j, credentials, properties);
    }
}
