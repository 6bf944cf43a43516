package com.work.federation.web.dto;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

/**
 * 启动一次 consumer 协商。
 */
public class ConsumerNegotiationRequest {

    @Valid
    @NotNull(message = "requirements 不能为空")
    private RequirementsPayload requirements;

    /**
     * 为空时使用 federation.consumer.endpoint
     */
    private EndpointPayload endpoint;

    /**
     * 选择前至少收到的报价数；为空时使用 federation.negotiation.service-providers
     */
    @Min(value = 1, message = "quorum 至少为 1")
    private Integer quorum;

    private boolean establishConnectivity;

    public RequirementsPayload getRequirements() {
        return requirements;
    }

    public void setRequirements(RequirementsPayload requirements) {
        this.requirements = requirements;
    }

    public EndpointPayload getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(EndpointPayload endpoint) {
        this.endpoint = endpoint;
    }

    public Integer getQuorum() {
        return quorum;
    }

    public void setQuorum(Integer quorum) {
        this.quorum = quorum;
    }

    public boolean isEstablishConnectivity() {
        return establishConnectivity;
    }

    public void setEstablishConnectivity(boolean establishConnectivity) {
        this.establishConnectivity = establishConnectivity;
    }
}
