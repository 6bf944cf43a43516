package com.work.federation.web.dto;

import com.work.federation.model.ServiceRequirements;

import javax.validation.constraints.Positive;

/**
 * 服务需求。未填的数值项表示不限制。
 */
public class RequirementsPayload {

    private String serviceType = ServiceRequirements.DEFAULT_SERVICE_TYPE;

    @Positive(message = "bandwidthGbps 必须大于 0")
    private Double bandwidthGbps;

    @Positive(message = "rttLatencyMs 必须大于 0")
    private Integer rttLatencyMs;

    @Positive(message = "computeCpus 必须大于 0")
    private Integer computeCpus;

    @Positive(message = "computeRamGb 必须大于 0")
    private Integer computeRamGb;

    public ServiceRequirements toRequirements() {
        return new ServiceRequirements(serviceType, bandwidthGbps, rttLatencyMs, computeCpus, computeRamGb);
    }

    public String getServiceType() {
        return serviceType;
    }

    public void setServiceType(String serviceType) {
        this.serviceType = serviceType;
    }

    public Double getBandwidthGbps() {
        return bandwidthGbps;
    }

    public void setBandwidthGbps(Double bandwidthGbps) {
        this.bandwidthGbps = bandwidthGbps;
    }

    public Integer getRttLatencyMs() {
        return rttLatencyMs;
    }

    public void setRttLatencyMs(Integer rttLatencyMs) {
        this.rttLatencyMs = rttLatencyMs;
    }

    public Integer getComputeCpus() {
        return computeCpus;
    }

    public void setComputeCpus(Integer computeCpus) {
        this.computeCpus = computeCpus;
    }

    public Integer getComputeRamGb() {
        return computeRamGb;
    }

    public void setComputeRamGb(Integer computeRamGb) {
        this.computeRamGb = computeRamGb;
    }
}
