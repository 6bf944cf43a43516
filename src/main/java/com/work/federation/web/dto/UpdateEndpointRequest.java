package com.work.federation.web.dto;

import javax.validation.constraints.NotNull;

public class UpdateEndpointRequest {

    /**
     * true：以中标 provider 身份更新；false：以 consumer 身份更新
     */
    private boolean provider;

    @NotNull(message = "endpoint 不能为空")
    private EndpointPayload endpoint;

    public boolean isProvider() {
        return provider;
    }

    public void setProvider(boolean provider) {
        this.provider = provider;
    }

    public EndpointPayload getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(EndpointPayload endpoint) {
        this.endpoint = endpoint;
    }
}
