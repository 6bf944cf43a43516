package com.work.federation.web;

import com.work.federation.config.FederationProperties;
import com.work.federation.model.ProviderCapability;
import com.work.federation.orchestrator.ConsumerRequest;
import com.work.federation.orchestrator.NegotiationHandle;
import com.work.federation.orchestrator.NegotiationRole;
import com.work.federation.orchestrator.NegotiationRunner;
import com.work.federation.orchestrator.ProviderRequest;
import com.work.federation.repository.NegotiationRunRecord;
import com.work.federation.repository.NegotiationRunRepository;
import com.work.federation.web.dto.ConsumerNegotiationRequest;
import com.work.federation.web.dto.EndpointPayload;
import com.work.federation.web.dto.ProviderNegotiationRequest;
import com.work.federation.web.dto.RunStartedView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * 编排好的协商运行：异步启动，返回 runId 后轮询查看时间线（poll-only）。
 */
@RestController
@RequestMapping("/api/v1/federation/negotiations")
public class NegotiationController {

    private static final int MAX_LIST = 200;

    private final NegotiationRunner runner;
    private final NegotiationRunRepository runRepository;
    private final FederationProperties properties;

    public NegotiationController(NegotiationRunner runner,
                                 NegotiationRunRepository runRepository,
                                 FederationProperties properties) {
        this.runner = runner;
        this.runRepository = runRepository;
        this.properties = properties;
    }

    @PostMapping("/consumer")
    public ResponseEntity<RunStartedView> startConsumer(@Validated @RequestBody ConsumerNegotiationRequest req) {
        int quorum = req.getQuorum() != null ? req.getQuorum() : properties.getNegotiation().getServiceProviders();
        ConsumerRequest request = new ConsumerRequest(
                req.getRequirements().toRequirements(),
                req.getEndpoint() != null
                        ? EndpointPayload.toEndpoint(req.getEndpoint())
                        : properties.getConsumer().getEndpoint().toEndpoint(),
                quorum,
                req.isEstablishConnectivity());
        NegotiationHandle handle = runner.startConsumer(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new RunStartedView(handle.getRunId(), NegotiationRole.CONSUMER.name()));
    }

    @PostMapping("/provider")
    public ResponseEntity<RunStartedView> startProvider(@Validated @RequestBody(required = false) ProviderNegotiationRequest req) {
        ProviderNegotiationRequest body = req != null ? req : new ProviderNegotiationRequest();
        FederationProperties.Provider defaults = properties.getProvider();
        ProviderCapability capability = new ProviderCapability(
                body.getServiceType() != null ? body.getServiceType() : defaults.getServiceType(),
                body.getMaxBandwidthGbps() != null ? body.getMaxBandwidthGbps() : defaults.getMaxBandwidthGbps(),
                body.getMinRttLatencyMs() != null ? body.getMinRttLatencyMs() : defaults.getMinRttLatencyMs(),
                body.getMaxComputeCpus() != null ? body.getMaxComputeCpus() : defaults.getMaxComputeCpus(),
                body.getMaxComputeRamGb() != null ? body.getMaxComputeRamGb() : defaults.getMaxComputeRamGb());
        BigInteger price = body.getPrice() != null ? body.getPrice() : defaults.getPrice();
        ProviderRequest request = new ProviderRequest(capability, price,
                body.getEndpoint() != null
                        ? EndpointPayload.toEndpoint(body.getEndpoint())
                        : defaults.getEndpoint().toEndpoint(),
                body.isEstablishConnectivity());
        NegotiationHandle handle = runner.startProvider(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new RunStartedView(handle.getRunId(), NegotiationRole.PROVIDER.name()));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<NegotiationRunRecord> get(@PathVariable String runId) {
        return runRepository.find(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<NegotiationRunRecord> listRecent(@RequestParam(value = "limit", defaultValue = "20") int limit) {
        return runRepository.listRecent(Math.max(1, Math.min(limit, MAX_LIST)));
    }

    @PostMapping("/{runId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String runId) {
        if (!runner.cancel(runId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }
}
