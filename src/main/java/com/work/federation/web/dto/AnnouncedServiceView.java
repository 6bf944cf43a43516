package com.work.federation.web.dto;

public class AnnouncedServiceView {

    private String serviceId;
    private String txHash;

    public AnnouncedServiceView() {
    }

    public AnnouncedServiceView(String serviceId, String txHash) {
        this.serviceId = serviceId;
        this.txHash = txHash;
    }

    public String getServiceId() {
        return serviceId;
    }

    public void setServiceId(String serviceId) {
        this.serviceId = serviceId;
    }

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }
}
