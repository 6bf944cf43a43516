package com.work.federation.web.dto;

/**
 * winner-chosen 与 am-i-winner 的应答。
 */
public class WinnerView {

    private String serviceId;
    private boolean result;

    public WinnerView() {
    }

    public WinnerView(String serviceId, boolean result) {
        this.serviceId = serviceId;
        this.result = result;
    }

    public String getServiceId() {
        return serviceId;
    }

    public void setServiceId(String serviceId) {
        this.serviceId = serviceId;
    }

    public boolean isResult() {
        return result;
    }

    public void setResult(boolean result) {
        this.result = result;
    }
}
