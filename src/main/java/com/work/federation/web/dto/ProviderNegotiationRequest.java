package com.work.federation.web.dto;

import javax.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

/**
 * 启动一次 provider 协商。各项为空时取 federation.provider.* 的配置值。
 */
public class ProviderNegotiationRequest {

    private String serviceType;

    @PositiveOrZero(message = "price 不能为负")
    private BigInteger price;

    private Double maxBandwidthGbps;

    private Integer minRttLatencyMs;

    private Integer maxComputeCpus;

    private Integer maxComputeRamGb;

    private EndpointPayload endpoint;

    private boolean establishConnectivity;

    public String getServiceType() {
        return serviceType;
    }

    public void setServiceType(String serviceType) {
        this.serviceType = serviceType;
    }

    public BigInteger getPrice() {
        return price;
    }

    public void setPrice(BigInteger price) {
        this.price = price;
    }

    public Double getMaxBandwidthGbps() {
        return maxBandwidthGbps;
    }

    public void setMaxBandwidthGbps(Double maxBandwidthGbps) {
        this.maxBandwidthGbps = maxBandwidthGbps;
    }

    public Integer getMinRttLatencyMs() {
        return minRttLatencyMs;
    }

    public void setMinRttLatencyMs(Integer minRttLatencyMs) {
        this.minRttLatencyMs = minRttLatencyMs;
    }

    public Integer getMaxComputeCpus() {
        return maxComputeCpus;
    }

    public void setMaxComputeCpus(Integer maxComputeCpus) {
        this.maxComputeCpus = maxComputeCpus;
    }

    public Integer getMaxComputeRamGb() {
        return maxComputeRamGb;
    }

    public void setMaxComputeRamGb(Integer maxComputeRamGb) {
        this.maxComputeRamGb = maxComputeRamGb;
    }

    public EndpointPayload getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(EndpointPayload endpoint) {
        this.endpoint = endpoint;
    }

    public boolean isEstablishConnectivity() {
        return establishConnectivity;
    }

    public void setEstablishConnectivity(boolean establishConnectivity) {
        this.establishConnectivity = establishConnectivity;
    }
}
