package com.work.federation.web;

import com.work.federation.config.FederationProperties;
import com.work.federation.ledger.AnnouncedService;
import com.work.federation.ledger.FederationContractService;
import com.work.federation.ledger.FederationLedgerModel;
import com.work.federation.ledger.ServiceDirectory;
import com.work.federation.model.Bid;
import com.work.federation.model.ServiceAnnouncement;
import com.work.federation.negotiation.NegotiationStateMachine;
import com.work.federation.negotiation.ServiceState;
import com.work.federation.web.dto.AnnounceServiceRequest;
import com.work.federation.web.dto.AnnouncedServiceView;
import com.work.federation.web.dto.AnnouncementView;
import com.work.federation.web.dto.BidView;
import com.work.federation.web.dto.ChooseProviderRequest;
import com.work.federation.web.dto.ConfirmDeploymentRequest;
import com.work.federation.web.dto.EndpointPayload;
import com.work.federation.web.dto.PlaceBidRequest;
import com.work.federation.web.dto.ServiceInfoView;
import com.work.federation.web.dto.ServiceStateView;
import com.work.federation.web.dto.TxView;
import com.work.federation.web.dto.UpdateEndpointRequest;
import com.work.federation.web.dto.WinnerView;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * 单步合约操作：公告、报价、选择、端点更新与部署确认。
 * 编排好的完整流程见 NegotiationController。
 */
@RestController
@RequestMapping("/api/v1/federation/services")
public class ServiceController {

    private final FederationContractService contract;
    private final FederationLedgerModel model;
    private final ServiceDirectory directory;
    private final FederationProperties properties;

    public ServiceController(FederationContractService contract,
                             ServiceDirectory directory,
                             FederationProperties properties) {
        this.contract = contract;
        this.model = contract.getModel();
        this.directory = directory;
        this.properties = properties;
    }

    @PostMapping
    public AnnouncedServiceView announce(@Validated @RequestBody AnnounceServiceRequest req) {
        AnnouncedService announced = contract.announceService(req.getRequirements().toRequirements(),
                EndpointPayload.toEndpoint(req.getEndpoint()));
        return new AnnouncedServiceView(announced.getServiceId(), announced.getTransaction().getTxHash());
    }

    @GetMapping("/announcements")
    public ResponseEntity<List<AnnouncementView>> announcements() {
        List<ServiceAnnouncement> open = directory.openAnnouncements(properties.getEvents().getLookbackBlocks());
        if (open.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        List<AnnouncementView> views = new ArrayList<>(open.size());
        for (ServiceAnnouncement a : open) {
            views.add(AnnouncementView.from(a));
        }
        return ResponseEntity.ok(views);
    }

    @GetMapping("/{serviceId}/state")
    public ServiceStateView state(@PathVariable String serviceId) {
        ServiceState state = model.getState(serviceId);
        ServiceStateView v = new ServiceStateView();
        v.setServiceId(serviceId);
        v.setState(state.name());
        v.setCode(state.getCode());
        return v;
    }

    @GetMapping("/{serviceId}/info")
    public ServiceInfoView info(@PathVariable String serviceId,
                                @RequestParam(value = "asProvider", defaultValue = "false") boolean asProvider) {
        return ServiceInfoView.from(model.getServiceInfo(serviceId, asProvider));
    }

    @GetMapping("/{serviceId}/bids")
    public ResponseEntity<List<BidView>> bids(@PathVariable String serviceId) {
        List<Bid> bids = directory.bids(serviceId, properties.getEvents().getLookbackBlocks());
        if (bids.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        List<BidView> views = new ArrayList<>(bids.size());
        for (Bid bid : bids) {
            views.add(BidView.from(bid));
        }
        return ResponseEntity.ok(views);
    }

    @PostMapping("/{serviceId}/bids")
    public TxView placeBid(@PathVariable String serviceId, @Validated @RequestBody PlaceBidRequest req) {
        return TxView.from(contract.placeBid(serviceId, req.getPrice(), EndpointPayload.toEndpoint(req.getEndpoint())));
    }

    @PostMapping("/{serviceId}/winner")
    public TxView chooseProvider(@PathVariable String serviceId, @Validated @RequestBody ChooseProviderRequest req) {
        return TxView.from(contract.chooseProvider(serviceId, req.getBidIndex()));
    }

    @GetMapping("/{serviceId}/winner-chosen")
    public WinnerView winnerChosen(@PathVariable String serviceId) {
        return new WinnerView(serviceId, NegotiationStateMachine.reached(model.getState(serviceId), ServiceState.CLOSED));
    }

    @GetMapping("/{serviceId}/am-i-winner")
    public WinnerView amIWinner(@PathVariable String serviceId) {
        return new WinnerView(serviceId, model.isWinner(serviceId));
    }

    @PutMapping("/{serviceId}/endpoint")
    public TxView updateEndpoint(@PathVariable String serviceId, @Validated @RequestBody UpdateEndpointRequest req) {
        return TxView.from(contract.updateEndpoint(serviceId, req.isProvider(), EndpointPayload.toEndpoint(req.getEndpoint())));
    }

    @PostMapping("/{serviceId}/deployed")
    public TxView confirmDeployment(@PathVariable String serviceId,
                                    @RequestBody(required = false) ConfirmDeploymentRequest req) {
        String host = req == null || req.getFederatedHost() == null || req.getFederatedHost().trim().isEmpty()
                ? properties.getDeployment().getFederatedHost()
                : req.getFederatedHost().trim();
        return TxView.from(contract.confirmDeployment(serviceId, host));
    }
}
