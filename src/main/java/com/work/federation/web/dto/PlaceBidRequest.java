package com.work.federation.web.dto;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

public class PlaceBidRequest {

    @NotNull(message = "price 不能为空")
    @PositiveOrZero(message = "price 不能为负")
    private BigInteger price;

    /**
     * provider 端点（可选）
     */
    private EndpointPayload endpoint;

    public BigInteger getPrice() {
        return price;
    }

    public void setPrice(BigInteger price) {
        this.price = price;
    }

    public EndpointPayload getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(EndpointPayload endpoint) {
        this.endpoint = endpoint;
    }
}
