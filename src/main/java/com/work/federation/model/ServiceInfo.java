package com.work.federation.model;

/**
 * GetServiceInfo 的结果。federatedHost 只有 consumer 读取 provider 侧信息时才有意义。
 */
public final class ServiceInfo {

    private final String serviceId;
    private final String federatedHost;
    private final ServiceEndpoint endpoint;

    public ServiceInfo(String serviceId, String federatedHost, ServiceEndpoint endpoint) {
        this.serviceId = serviceId;
        this.federatedHost = federatedHost == null || federatedHost.isEmpty() ? null : federatedHost;
        this.endpoint = endpoint == null ? ServiceEndpoint.EMPTY : endpoint;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getFederatedHost() {
        return federatedHost;
    }

    public ServiceEndpoint getEndpoint() {
        return endpoint;
    }

    @Override
    public String toString() {
        return "ServiceInfo{serviceId=" + serviceId + ", federatedHost=" + federatedHost + ", endpoint=" + endpoint + "}";
    }
}
