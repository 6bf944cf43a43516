package com.work.federation.model;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;

/**
 * provider 对外提供的能力。各上限为 null 表示不限制。
 */
public final class ProviderCapability {

    private final String serviceType;
    private final Double maxBandwidthGbps;
    private final Integer minRttLatencyMs;
    private final Integer maxComputeCpus;
    private final Integer maxComputeRamGb;

    public ProviderCapability(String serviceType,
                              Double maxBandwidthGbps,
                              Integer minRttLatencyMs,
                              Integer maxComputeCpus,
                              Integer maxComputeRamGb) {
        this.serviceType = requireNonEmpty(serviceType, "serviceType");
        this.maxBandwidthGbps = maxBandwidthGbps;
        this.minRttLatencyMs = minRttLatencyMs;
        this.maxComputeCpus = maxComputeCpus;
        this.maxComputeRamGb = maxComputeRamGb;
    }

    public static ProviderCapability ofType(String serviceType) {
        return new ProviderCapability(serviceType, null, null, null, null);
    }

    /**
     * 需求中未设置的字段总是满足；service_type 比较忽略大小写。
     */
    public boolean canFulfil(ServiceRequirements req) {
        if (req == null || !serviceType.equalsIgnoreCase(req.getServiceType())) {
            return false;
        }
        if (req.getBandwidthGbps() != null && maxBandwidthGbps != null
                && req.getBandwidthGbps() > maxBandwidthGbps) {
            return false;
        }
        // 能做到的最低时延必须不高于需求时延
        if (req.getRttLatencyMs() != null && minRttLatencyMs != null
                && req.getRttLatencyMs() < minRttLatencyMs) {
            return false;
        }
        if (req.getComputeCpus() != null && maxComputeCpus != null
                && req.getComputeCpus() > maxComputeCpus) {
            return false;
        }
        return req.getComputeRamGb() == null || maxComputeRamGb == null
                || req.getComputeRamGb() <= maxComputeRamGb;
    }

    public String getServiceType() {
        return serviceType;
    }

    public Double getMaxBandwidthGbps() {
        return maxBandwidthGbps;
    }

    public Integer getMinRttLatencyMs() {
        return minRttLatencyMs;
    }

    public Integer getMaxComputeCpus() {
        return maxComputeCpus;
    }

    public Integer getMaxComputeRamGb() {
        return maxComputeRamGb;
    }
}
