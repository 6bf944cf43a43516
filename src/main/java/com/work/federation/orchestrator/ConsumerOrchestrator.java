package com.work.federation.orchestrator;

import com.work.federation.collaborator.NetworkConnector;
import com.work.federation.collaborator.TunnelRequest;
import com.work.federation.config.FederationProperties;
import com.work.federation.ledger.AnnouncedService;
import com.work.federation.ledger.FederationContractService;
import com.work.federation.ledger.FederationLedgerModel;
import com.work.federation.ledger.event.EventCursor;
import com.work.federation.ledger.event.EventCursorFactory;
import com.work.federation.ledger.event.FederationEventKind;
import com.work.federation.ledger.event.ProcessedEventRegistry;
import com.work.federation.model.Bid;
import com.work.federation.model.ServiceInfo;
import com.work.federation.negotiation.BidCollector;
import com.work.federation.negotiation.LifecycleObserver;
import com.work.federation.negotiation.NegotiationStateMachine;
import com.work.federation.negotiation.ServiceState;
import com.work.federation.negotiation.WinnerSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * consumer 侧编排：公告 → 等待报价 → 选出最低价 → ChooseProvider → 等待部署 → 读取服务信息 → 建立连通。
 * <p>
 * ChooseProvider 只提交一次，失败直接终止运行，不做重试。
 */
public class ConsumerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConsumerOrchestrator.class);

    private final FederationContractService contract;
    private final FederationLedgerModel model;
    private final EventCursorFactory cursors;
    private final PollingSupport polling;
    private final NetworkConnector network;
    private final FederationProperties props;

    public ConsumerOrchestrator(FederationContractService contract,
                                EventCursorFactory cursors,
                                PollingSupport polling,
                                NetworkConnector network,
                                FederationProperties props) {
        this.contract = requireNonNull(contract, "contract");
        this.model = contract.getModel();
        this.cursors = requireNonNull(cursors, "cursors");
        this.polling = requireNonNull(polling, "polling");
        this.network = requireNonNull(network, "network");
        this.props = requireNonNull(props, "props");
    }

    public NegotiationResult run(NegotiationSession session, ConsumerRequest request) {
        request.validate();
        FederationProperties.Negotiation timeouts = props.getNegotiation();

        // 游标必须先于公告创建，避免错过紧随其后的报价
        EventCursor bidEvents = cursors.latestOnly(FederationEventKind.NEW_BID);

        AnnouncedService announced = session.step(NegotiationStep.ANNOUNCE,
                () -> contract.announceService(request.getRequirements(), request.getEndpoint()));
        String serviceId = announced.getServiceId();
        session.setServiceId(serviceId);
        LifecycleObserver lifecycle = new LifecycleObserver(serviceId);

        BidCollector collector = new BidCollector(serviceId, newRegistry());
        int bidCount = session.step(NegotiationStep.AWAIT_BIDS, () -> polling.await(session,
                NegotiationStep.AWAIT_BIDS, timeouts.getBidTimeout(), () -> {
                    int count = collector.fold(bidEvents.poll());
                    return count >= request.getQuorum() ? Optional.of(count) : Optional.empty();
                }));
        log.info("[federation] run={} serviceId={} received {} bid(s)", session.getRunId(), serviceId, bidCount);

        Bid winner = session.step(NegotiationStep.EVALUATE_BIDS, () -> {
            List<Bid> bids = model.listBids(serviceId, bidCount);
            Bid best = WinnerSelector.select(bids);
            log.info("[federation] run={} serviceId={} winner index={} provider={} price={}",
                    session.getRunId(), serviceId, best.getBidIndex(), best.getProviderAddress(), best.getPrice());
            return best;
        });

        session.execute(NegotiationStep.CHOOSE_PROVIDER, () -> {
            contract.chooseProvider(serviceId, winner.getBidIndex());
            // 确认账本已关闭该服务
            awaitState(session, NegotiationStep.CHOOSE_PROVIDER, lifecycle, ServiceState.CLOSED,
                    timeouts.getClosureTimeout());
        });

        session.execute(NegotiationStep.AWAIT_DEPLOYMENT, () -> awaitState(session, NegotiationStep.AWAIT_DEPLOYMENT,
                lifecycle, ServiceState.DEPLOYED, timeouts.getDeploymentTimeout()));

        ServiceInfo providerInfo = session.step(NegotiationStep.FETCH_SERVICE_INFO,
                () -> model.getServiceInfo(serviceId, false));
        log.info("[federation] run={} serviceId={} federatedHost={} providerEndpoint={}",
                session.getRunId(), serviceId, providerInfo.getFederatedHost(), providerInfo.getEndpoint());

        if (request.isEstablishConnectivity()) {
            session.execute(NegotiationStep.ESTABLISH_CONNECTIVITY,
                    () -> network.establishTunnel(TunnelRequest.forPeer(serviceId, request.getEndpoint(),
                            providerInfo.getEndpoint(), props.getNetwork())));
        }

        return NegotiationResult.consumerCompleted(session, winner, providerInfo.getFederatedHost(),
                providerInfo.getEndpoint());
    }

    private void awaitState(NegotiationSession session, NegotiationStep step, LifecycleObserver lifecycle,
                            ServiceState target, Duration timeout) {
        polling.await(session, step, timeout, () -> {
            ServiceState state = model.getState(lifecycle.getServiceId());
            lifecycle.observe(state);
            return NegotiationStateMachine.reached(state, target) ? Optional.of(state) : Optional.empty();
        });
    }

    private ProcessedEventRegistry newRegistry() {
        FederationProperties.Events events = props.getEvents();
        return new ProcessedEventRegistry(events.getDedupeMaxSize(), events.getDedupeTtl());
    }
}
