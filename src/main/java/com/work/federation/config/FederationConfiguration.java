package com.work.federation.config;

import com.work.federation.collaborator.DeploymentConnector;
import com.work.federation.collaborator.LoggingNetworkConnector;
import com.work.federation.collaborator.NetworkConnector;
import com.work.federation.collaborator.RouterApiNetworkConnector;
import com.work.federation.collaborator.StaticDeploymentConnector;
import com.work.federation.core.metrics.FederationMetrics;
import com.work.federation.core.support.Sleeper;
import com.work.federation.domain.DomainAutoRegistrar;
import com.work.federation.domain.DomainRegistrationService;
import com.work.federation.ledger.FederationContractService;
import com.work.federation.ledger.event.EventCursorFactory;
import com.work.federation.orchestrator.ActiveNegotiationRegistry;
import com.work.federation.orchestrator.ConsumerOrchestrator;
import com.work.federation.orchestrator.NegotiationRunner;
import com.work.federation.orchestrator.PollingSupport;
import com.work.federation.orchestrator.ProviderOrchestrator;
import com.work.federation.repository.NegotiationRunRepository;
import com.work.federation.repository.impl.InMemoryNegotiationRunRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 协商侧装配：轮询、协作方适配器、两种编排器、运行器与域注册。
 */
@Configuration
public class FederationConfiguration {

    @Bean
    public PollingSupport pollingSupport(Clock clock, FederationProperties properties) {
        FederationProperties.Negotiation negotiation = properties.getNegotiation();
        return new PollingSupport(clock, Sleeper.THREAD, negotiation.getPollInitial(), negotiation.getPollMax());
    }

    /**
     * 默认部署适配器：返回配置的 federated host（编排平台由业务方替换）
     */
    @Bean
    @ConditionalOnMissingBean(DeploymentConnector.class)
    public DeploymentConnector deploymentConnector(FederationProperties properties) {
        return new StaticDeploymentConnector(properties.getDeployment().getFederatedHost());
    }

    @Bean
    @ConditionalOnProperty(prefix = "federation.network", name = "mode", havingValue = "router")
    public NetworkConnector routerApiNetworkConnector(RestTemplateBuilder builder, FederationProperties properties) {
        FederationProperties.Network network = properties.getNetwork();
        return new RouterApiNetworkConnector(
                builder.setConnectTimeout(network.getRequestTimeout())
                        .setReadTimeout(network.getRequestTimeout())
                        .build(),
                network.getRouterUrl(),
                network.getRouterPassword());
    }

    @Bean
    @ConditionalOnProperty(prefix = "federation.network", name = "mode", havingValue = "logging", matchIfMissing = true)
    public NetworkConnector loggingNetworkConnector() {
        return new LoggingNetworkConnector();
    }

    @Bean
    public ConsumerOrchestrator consumerOrchestrator(FederationContractService contract,
                                                     EventCursorFactory cursors,
                                                     PollingSupport polling,
                                                     NetworkConnector network,
                                                     FederationProperties properties) {
        return new ConsumerOrchestrator(contract, cursors, polling, network, properties);
    }

    @Bean
    public ProviderOrchestrator providerOrchestrator(FederationContractService contract,
                                                     EventCursorFactory cursors,
                                                     PollingSupport polling,
                                                     DeploymentConnector deployment,
                                                     NetworkConnector network,
                                                     FederationProperties properties) {
        return new ProviderOrchestrator(contract, cursors, polling, deployment, network, properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "federation", name = "storage", havingValue = "memory", matchIfMissing = true)
    public NegotiationRunRepository inMemoryNegotiationRunRepository() {
        return new InMemoryNegotiationRunRepository();
    }

    @Bean
    public ActiveNegotiationRegistry activeNegotiationRegistry() {
        return new ActiveNegotiationRegistry();
    }

    @Bean
    public NegotiationRunner negotiationRunner(ConsumerOrchestrator consumerOrchestrator,
                                               ProviderOrchestrator providerOrchestrator,
                                               NegotiationRunRepository runRepository,
                                               ActiveNegotiationRegistry activeRegistry,
                                               FederationMetrics metrics,
                                               Clock clock,
                                               FederationProperties properties) {
        return new NegotiationRunner(consumerOrchestrator, providerOrchestrator, runRepository, activeRegistry,
                metrics, clock, properties.getNegotiation().getWorkers());
    }

    @Bean
    public DomainRegistrationService domainRegistrationService(FederationContractService contract,
                                                               ActiveNegotiationRegistry activeRegistry,
                                                               FederationProperties properties) {
        return new DomainRegistrationService(contract, activeRegistry, properties.getDomainName());
    }

    @Bean
    @ConditionalOnProperty(prefix = "federation", name = "auto-register", havingValue = "true")
    public DomainAutoRegistrar domainAutoRegistrar(DomainRegistrationService registrationService) {
        return new DomainAutoRegistrar(registrationService);
    }
}
