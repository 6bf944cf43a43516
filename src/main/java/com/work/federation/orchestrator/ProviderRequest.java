package com.work.federation.orchestrator;

import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.model.ProviderCapability;
import com.work.federation.model.ServiceEndpoint;

import java.math.BigInteger;

/**
 * provider 侧一次协商的输入。
 */
public class ProviderRequest {

    private final ProviderCapability capability;
    private final BigInteger price;
    private final ServiceEndpoint endpoint;
    private final boolean establishConnectivity;

    public ProviderRequest(ProviderCapability capability, BigInteger price, ServiceEndpoint endpoint,
                           boolean establishConnectivity) {
        this.capability = capability;
        this.price = price;
        this.endpoint = endpoint == null ? ServiceEndpoint.EMPTY : endpoint;
        this.establishConnectivity = establishConnectivity;
    }

    public ProviderRequest validate() {
        if (capability == null) {
            throw new MalformedInputException("capability 不能为空");
        }
        if (price == null || price.signum() < 0) {
            throw new MalformedInputException("price 必须为非负整数: " + price);
        }
        endpoint.validate();
        return this;
    }

    public ProviderCapability getCapability() {
        return capability;
    }

    public BigInteger getPrice() {
        return price;
    }

    public ServiceEndpoint getEndpoint() {
        return endpoint;
    }

    public boolean isEstablishConnectivity() {
        return establishConnectivity;
    }
}
