package com.work.federation.web.dto;

import com.work.federation.model.ServiceInfo;

public class ServiceInfoView {

    private String serviceId;
    private String federatedHost;
    private EndpointPayload endpoint;

    public static ServiceInfoView from(ServiceInfo info) {
        ServiceInfoView v = new ServiceInfoView();
        v.setServiceId(info.getServiceId());
        v.setFederatedHost(info.getFederatedHost());
        v.setEndpoint(EndpointPayload.from(info.getEndpoint()));
        return v;
    }

    public String getServiceId() {
        return serviceId;
    }

    public void setServiceId(String serviceId) {
        this.serviceId = serviceId;
    }

    public String getFederatedHost() {
        return federatedHost;
    }

    public void setFederatedHost(String federatedHost) {
        this.federatedHost = federatedHost;
    }

    public EndpointPayload getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(EndpointPayload endpoint) {
        this.endpoint = endpoint;
    }
}
