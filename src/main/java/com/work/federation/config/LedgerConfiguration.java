package com.work.federation.config;

import com.work.federation.core.lock.SubmitLockCoordinator;
import com.work.federation.core.lock.SubmitLockManager;
import com.work.federation.core.lock.impl.InMemorySubmitLockManager;
import com.work.federation.core.lock.impl.RedisSubmitLockManager;
import com.work.federation.core.metrics.FederationMetrics;
import com.work.federation.core.metrics.NoopFederationMetrics;
import com.work.federation.core.support.Sleeper;
import com.work.federation.ledger.FederationContractService;
import com.work.federation.ledger.FederationLedgerModel;
import com.work.federation.ledger.InMemoryFederationLedger;
import com.work.federation.ledger.LedgerClient;
import com.work.federation.ledger.LedgerConnector;
import com.work.federation.ledger.ServiceDirectory;
import com.work.federation.ledger.ServiceIdGenerator;
import com.work.federation.ledger.event.EventCursorFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.web3j.crypto.Credentials;

import java.time.Clock;

/**
 * 账本侧装配：connector、提交锁、LedgerClient 以及合约读写服务。
 * <p>
 * ledger.mode=mock（默认）使用进程内合约模拟；ledger.mode=web3j 时由 Web3jLedgerConfiguration 提供 connector。
 */
@Configuration
@EnableConfigurationProperties({LedgerProperties.class, FederationProperties.class})
public class LedgerConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(FederationMetrics.class)
    public FederationMetrics federationMetrics() {
        return new NoopFederationMetrics();
    }

    @Bean
    @ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "mock", matchIfMissing = true)
    public LedgerConnector inMemoryFederationLedger() {
        return new InMemoryFederationLedger();
    }

    @Bean
    @ConditionalOnProperty(prefix = "federation.lock", name = "redis-enabled", havingValue = "true")
    public SubmitLockManager redisSubmitLockManager(StringRedisTemplate redisTemplate) {
        return new RedisSubmitLockManager(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "federation.lock", name = "redis-enabled", havingValue = "false", matchIfMissing = true)
    public SubmitLockManager inMemorySubmitLockManager() {
        return new InMemorySubmitLockManager();
    }

    @Bean
    public SubmitLockCoordinator submitLockCoordinator(SubmitLockManager lockManager, FederationProperties properties) {
        return new SubmitLockCoordinator(lockManager, properties.getLock().getTtl(), properties.getLock().getWait());
    }

    /**
     * 本域账户：web3j 模式取私钥对应地址，mock 模式取 ledger.mock-address。
     */
    @Bean
    public LedgerClient ledgerClient(LedgerConnector connector,
                                     SubmitLockCoordinator lockCoordinator,
                                     LedgerProperties properties,
                                     FederationMetrics metrics,
                                     ObjectProvider<Credentials> credentials) {
        Credentials account = credentials.getIfAvailable();
        String address = account != null ? account.getAddress() : properties.getMockAddress();
        return new LedgerClient(address, connector, lockCoordinator, properties, metrics, Sleeper.THREAD);
    }

    @Bean
    public FederationLedgerModel federationLedgerModel(LedgerClient ledgerClient) {
        return new FederationLedgerModel(ledgerClient);
    }

    @Bean
    public FederationContractService federationContractService(LedgerClient ledgerClient,
                                                               FederationLedgerModel model,
                                                               Clock clock) {
        return new FederationContractService(ledgerClient, model, new ServiceIdGenerator(clock));
    }

    @Bean
    public EventCursorFactory eventCursorFactory(LedgerConnector connector, FederationMetrics metrics) {
        return new EventCursorFactory(connector, metrics);
    }

    @Bean
    public ServiceDirectory serviceDirectory(FederationLedgerModel model, EventCursorFactory cursors) {
        return new ServiceDirectory(model, cursors);
    }
}
