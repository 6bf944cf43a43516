package com.work.federation.orchestrator;

import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.model.ServiceEndpoint;
import com.work.federation.model.ServiceRequirements;

/**
 * consumer 侧一次协商的输入。
 */
public class ConsumerRequest {

    private final ServiceRequirements requirements;
    private final ServiceEndpoint endpoint;
    private final int quorum;
    private final boolean establishConnectivity;

    public ConsumerRequest(ServiceRequirements requirements, ServiceEndpoint endpoint, int quorum,
                           boolean establishConnectivity) {
        this.requirements = requirements;
        this.endpoint = endpoint == null ? ServiceEndpoint.EMPTY : endpoint;
        this.quorum = quorum;
        this.establishConnectivity = establishConnectivity;
    }

    /**
     * 在任何账本调用之前校验输入。
     */
    public ConsumerRequest validate() {
        if (requirements == null) {
            throw new MalformedInputException("requirements 不能为空");
        }
        requirements.validate();
        endpoint.validate();
        if (quorum < 1) {
            throw new MalformedInputException("service_providers 至少为 1: " + quorum);
        }
        return this;
    }

    public ServiceRequirements getRequirements() {
        return requirements;
    }

    public ServiceEndpoint getEndpoint() {
        return endpoint;
    }

    public int getQuorum() {
        return quorum;
    }

    public boolean isEstablishConnectivity() {
        return establishConnectivity;
    }
}
