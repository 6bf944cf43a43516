package com.work.federation.web.dto;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;

public class AnnounceServiceRequest {

    @Valid
    @NotNull(message = "requirements 不能为空")
    private RequirementsPayload requirements;

    /**
     * consumer 端点（可选）
     */
    private EndpointPayload endpoint;

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
}
