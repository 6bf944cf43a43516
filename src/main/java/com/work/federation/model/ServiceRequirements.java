package com.work.federation.model;

import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.core.support.ValidationUtils;

import java.util.Objects;

/**
 * 服务需求描述。链上以单个字符串保存：
 * <pre>
 * service_type=k8s_deployment; bandwidth_gbps=10.0; rtt_latency_ms=20; compute_cpus=None; compute_ram_gb=None
 * </pre>
 * 未设置的字段写作字面量 None。
 */
public final class ServiceRequirements {

    public static final String DEFAULT_SERVICE_TYPE = "k8s_deployment";

    static final String NONE = "None";

    private static final String SEPARATOR = "; ";

    private final String serviceType;
    private final Double bandwidthGbps;
    private final Integer rttLatencyMs;
    private final Integer computeCpus;
    private final Integer computeRamGb;

    public ServiceRequirements(String serviceType,
                               Double bandwidthGbps,
                               Integer rttLatencyMs,
                               Integer computeCpus,
                               Integer computeRamGb) {
        this.serviceType = serviceType == null || serviceType.trim().isEmpty() ? DEFAULT_SERVICE_TYPE : serviceType.trim();
        this.bandwidthGbps = bandwidthGbps;
        this.rttLatencyMs = rttLatencyMs;
        this.computeCpus = computeCpus;
        this.computeRamGb = computeRamGb;
    }

    public static ServiceRequirements ofType(String serviceType) {
        return new ServiceRequirements(serviceType, null, null, null, null);
    }

    /**
     * 在提交到账本之前调用；任何非法值都抛出 MalformedInputException。
     */
    public ServiceRequirements validate() {
        ValidationUtils.requireValidServiceType(serviceType);
        if (bandwidthGbps != null && (bandwidthGbps.isNaN() || bandwidthGbps.isInfinite() || bandwidthGbps <= 0)) {
            throw new MalformedInputException("bandwidth_gbps 必须大于0: " + bandwidthGbps);
        }
        requirePositiveOrUnset(rttLatencyMs, "rtt_latency_ms");
        requirePositiveOrUnset(computeCpus, "compute_cpus");
        requirePositiveOrUnset(computeRamGb, "compute_ram_gb");
        return this;
    }

    public String format() {
        return "service_type=" + serviceType
                + SEPARATOR + "bandwidth_gbps=" + wire(bandwidthGbps)
                + SEPARATOR + "rtt_latency_ms=" + wire(rttLatencyMs)
                + SEPARATOR + "compute_cpus=" + wire(computeCpus)
                + SEPARATOR + "compute_ram_gb=" + wire(computeRamGb);
    }

    /**
     * 解析链上需求字符串。容忍多余空白与未知 key；任一字段缺失或为 None 都视为未设置，
     * service_type 未设置时取默认类型。数值无法解析时抛出 MalformedInputException。
     */
    public static ServiceRequirements parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new MalformedInputException("requirements 不能为空");
        }
        String serviceType = null;
        Double bandwidth = null;
        Integer latency = null;
        Integer cpus = null;
        Integer ram = null;
        for (String part : text.split(";")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            int eq = item.indexOf('=');
            if (eq <= 0) {
                throw new MalformedInputException("requirements 片段缺少 '=': " + item);
            }
            String key = item.substring(0, eq).trim();
            String value = item.substring(eq + 1).trim();
            switch (key) {
                case "service_type":
                    serviceType = NONE.equals(value) ? null : value;
                    break;
                case "bandwidth_gbps":
                    bandwidth = parseDouble(key, value);
                    break;
                case "rtt_latency_ms":
                    latency = parseInt(key, value);
                    break;
                case "compute_cpus":
                    cpus = parseInt(key, value);
                    break;
                case "compute_ram_gb":
                    ram = parseInt(key, value);
                    break;
                default:
                    // 未知 key 忽略
                    break;
            }
        }
        return new ServiceRequirements(serviceType, bandwidth, latency, cpus, ram);
    }

    private static Double parseDouble(String key, String value) {
        if (value.isEmpty() || NONE.equals(value)) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new MalformedInputException(key + " 不是合法数字: " + value);
        }
    }

    private static Integer parseInt(String key, String value) {
        if (value.isEmpty() || NONE.equals(value)) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new MalformedInputException(key + " 不是合法整数: " + value);
        }
    }

    private static void requirePositiveOrUnset(Integer value, String name) {
        if (value != null && value <= 0) {
            throw new MalformedInputException(name + " 必须大于0: " + value);
        }
    }

    private static String wire(Object value) {
        return value == null ? NONE : value.toString();
    }

    public String getServiceType() {
        return serviceType;
    }

    public Double getBandwidthGbps() {
        return bandwidthGbps;
    }

    public Integer getRttLatencyMs() {
        return rttLatencyMs;
    }

    public Integer getComputeCpus() {
        return computeCpus;
    }

    public Integer getComputeRamGb() {
        return computeRamGb;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceRequirements)) return false;
        ServiceRequirements that = (ServiceRequirements) o;
        return serviceType.equals(that.serviceType)
                && Objects.equals(bandwidthGbps, that.bandwidthGbps)
                && Objects.equals(rttLatencyMs, that.rttLatencyMs)
                && Objects.equals(computeCpus, that.computeCpus)
                && Objects.equals(computeRamGb, that.computeRamGb);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceType, bandwidthGbps, rttLatencyMs, computeCpus, computeRamGb);
    }

    @Override
    public String toString() {
        return format();
    }
}
