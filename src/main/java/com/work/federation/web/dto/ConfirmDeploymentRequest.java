package com.work.federation.web.dto;

/**
 * 部署确认。federatedHost 为空时使用 federation.deployment.federated-host。
 */
public class ConfirmDeploymentRequest {

    private String federatedHost;

    public String getFederatedHost() {
        return federatedHost;
    }

    public void setFederatedHost(String federatedHost) {
        this.federatedHost = federatedHost;
    }
}
