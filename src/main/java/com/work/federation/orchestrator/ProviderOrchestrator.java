package com.work.federation.orchestrator;

import com.work.federation.collaborator.DeploymentConnector;
import com.work.federation.collaborator.NetworkConnector;
import com.work.federation.collaborator.TunnelRequest;
import com.work.federation.config.FederationProperties;
import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.core.exception.ServiceNotFoundException;
import com.work.federation.ledger.FederationContractService;
import com.work.federation.ledger.FederationLedgerModel;
import com.work.federation.ledger.event.EventCursor;
import com.work.federation.ledger.event.EventCursorFactory;
import com.work.federation.ledger.event.FederationEvent;
import com.work.federation.ledger.event.FederationEventKind;
import com.work.federation.ledger.event.ProcessedEventRegistry;
import com.work.federation.model.ProviderCapability;
import com.work.federation.model.ServiceAnnouncement;
import com.work.federation.model.ServiceInfo;
import com.work.federation.model.ServiceRequirements;
import com.work.federation.negotiation.LifecycleObserver;
import com.work.federation.negotiation.NegotiationStateMachine;
import com.work.federation.negotiation.ServiceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * provider 侧编排：发现匹配的公告 → 报价 → 等待关闭 → 确认是否中标 →
 * 读取 consumer 信息 → 部署 → 建立连通 → 更新端点 → ServiceDeployed。
 * <p>
 * 未中标是正常结局（NOT_CHOSEN），此时绝不提交 ServiceDeployed。
 */
public class ProviderOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProviderOrchestrator.class);

    private final FederationContractService contract;
    private final FederationLedgerModel model;
    private final EventCursorFactory cursors;
    private final PollingSupport polling;
    private final DeploymentConnector deployment;
    private final NetworkConnector network;
    private final FederationProperties props;

    public ProviderOrchestrator(FederationContractService contract,
                                EventCursorFactory cursors,
                                PollingSupport polling,
                                DeploymentConnector deployment,
                                NetworkConnector network,
                                FederationProperties props) {
        this.contract = requireNonNull(contract, "contract");
        this.model = contract.getModel();
        this.cursors = requireNonNull(cursors, "cursors");
        this.polling = requireNonNull(polling, "polling");
        this.deployment = requireNonNull(deployment, "deployment");
        this.network = requireNonNull(network, "network");
        this.props = requireNonNull(props, "props");
    }

    public NegotiationResult run(NegotiationSession session, ProviderRequest request) {
        request.validate();
        FederationProperties.Negotiation timeouts = props.getNegotiation();

        EventCursor announcements = cursors.lookback(FederationEventKind.SERVICE_ANNOUNCEMENT,
                props.getEvents().getLookbackBlocks());
        ProcessedEventRegistry seen = new ProcessedEventRegistry(props.getEvents().getDedupeMaxSize(),
                props.getEvents().getDedupeTtl());

        ServiceAnnouncement target = session.step(NegotiationStep.DISCOVER, () -> polling.await(session,
                NegotiationStep.DISCOVER, timeouts.getDiscoveryTimeout(),
                () -> firstMatch(announcements.poll(), seen, request.getCapability())));
        String serviceId = target.getServiceId();
        session.setServiceId(serviceId);
        LifecycleObserver lifecycle = new LifecycleObserver(serviceId);
        lifecycle.observe(ServiceState.OPEN);

        // 先建关闭事件游标再报价
        EventCursor closures = cursors.latestOnly(FederationEventKind.SERVICE_ANNOUNCEMENT_CLOSED);

        session.execute(NegotiationStep.PLACE_BID,
                () -> contract.placeBid(serviceId, request.getPrice(), request.getEndpoint()));
        log.info("[federation] run={} bid placed serviceId={} price={}", session.getRunId(), serviceId, request.getPrice());

        session.execute(NegotiationStep.AWAIT_CLOSURE, () -> polling.await(session, NegotiationStep.AWAIT_CLOSURE,
                timeouts.getClosureTimeout(), () -> closures.poll().stream()
                        .filter(e -> serviceId.equals(e.getServiceId()))
                        .findFirst()));

        boolean winner = session.step(NegotiationStep.CHECK_WINNER, () -> {
            ServiceState state = model.getState(serviceId);
            lifecycle.observe(state);
            return model.isWinner(serviceId);
        });
        if (!winner) {
            log.info("[federation] run={} serviceId={} another provider was chosen", session.getRunId(), serviceId);
            return NegotiationResult.notChosen(session, request.getPrice());
        }
        log.info("[federation] run={} serviceId={} selected as winner", session.getRunId(), serviceId);

        ServiceInfo consumerInfo = session.step(NegotiationStep.FETCH_SERVICE_INFO,
                () -> model.getServiceInfo(serviceId, true));

        String federatedHost = session.step(NegotiationStep.DEPLOY, () -> deployment.deploy(
                descriptorOf(consumerInfo, target), props.getDeployment().getReplicas()));

        if (request.isEstablishConnectivity()) {
            session.execute(NegotiationStep.ESTABLISH_CONNECTIVITY,
                    () -> network.establishTunnel(TunnelRequest.forPeer(serviceId, request.getEndpoint(),
                            consumerInfo.getEndpoint(), props.getNetwork())));
        }

        session.execute(NegotiationStep.UPDATE_ENDPOINT,
                () -> contract.updateEndpoint(serviceId, true, request.getEndpoint()));

        session.execute(NegotiationStep.CONFIRM_DEPLOYMENT, () -> {
            contract.confirmDeployment(serviceId, federatedHost);
            polling.await(session, NegotiationStep.CONFIRM_DEPLOYMENT, timeouts.getDeploymentTimeout(), () -> {
                ServiceState state = model.getState(serviceId);
                lifecycle.observe(state);
                return NegotiationStateMachine.reached(state, ServiceState.DEPLOYED)
                        ? Optional.of(state) : Optional.empty();
            });
        });
        log.info("[federation] run={} serviceId={} deployed federatedHost={}", session.getRunId(), serviceId, federatedHost);

        return NegotiationResult.providerCompleted(session, request.getPrice(), federatedHost, consumerInfo.getEndpoint());
    }

    /**
     * 按账本顺序取第一条需求匹配且仍为 OPEN 的公告。
     * 账本暂不可用时不登记该事件，下一轮会重新评估。
     */
    private Optional<ServiceAnnouncement> firstMatch(List<FederationEvent> events, ProcessedEventRegistry seen,
                                                     ProviderCapability capability) {
        for (FederationEvent event : events) {
            if (seen.isProcessed(event)) {
                continue;
            }
            Optional<ServiceAnnouncement> match = evaluate(event, capability);
            seen.markProcessed(event);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * 需求无法解析、能力不匹配、服务已不存在或已关闭的公告返回空。
     */
    private Optional<ServiceAnnouncement> evaluate(FederationEvent event, ProviderCapability capability) {
        ServiceRequirements requirements;
        try {
            requirements = ServiceRequirements.parse(event.getRequirements());
        } catch (MalformedInputException e) {
            log.warn("[federation] skip announcement serviceId={} with malformed requirements: {}",
                    event.getServiceId(), e.getMessage());
            return Optional.empty();
        }
        if (!capability.canFulfil(requirements)) {
            log.debug("[federation] skip announcement serviceId={} requirements=[{}]", event.getServiceId(), requirements);
            return Optional.empty();
        }
        ServiceState state;
        try {
            state = model.getState(event.getServiceId());
        } catch (ServiceNotFoundException e) {
            log.warn("[federation] skip announcement serviceId={}: {}", event.getServiceId(), e.getMessage());
            return Optional.empty();
        }
        if (!NegotiationStateMachine.acceptsBids(state)) {
            return Optional.empty();
        }
        log.info("[federation] matched announcement serviceId={} requirements=[{}]", event.getServiceId(), requirements);
        return Optional.of(new ServiceAnnouncement(event.getServiceId(), event.getRequirements(), requirements,
                event.getBlockNumber(), event.getTxHash()));
    }

    /**
     * 部署描述符：优先使用 consumer 端点中的 NSD id，否则用需求中的 service_type。
     */
    private String descriptorOf(ServiceInfo consumerInfo, ServiceAnnouncement announcement) {
        String nsd = consumerInfo.getEndpoint().getNsdId();
        if (nsd != null) {
            return nsd;
        }
        return announcement.getRequirements().getServiceType();
    }
}
