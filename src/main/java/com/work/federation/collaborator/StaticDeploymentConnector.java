package com.work.federation.collaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;

/**
 * 不真正部署，直接返回配置的 federated host。用于演示与联调。
 */
public class StaticDeploymentConnector implements DeploymentConnector {

    private static final Logger log = LoggerFactory.getLogger(StaticDeploymentConnector.class);

    private final String federatedHost;

    public StaticDeploymentConnector(String federatedHost) {
        this.federatedHost = requireNonEmpty(federatedHost, "federatedHost");
    }

    @Override
    public String deploy(String descriptor, int replicas) {
        log.info("[federation] static deployment descriptor={} replicas={} federatedHost={}", descriptor, replicas, federatedHost);
        return federatedHost;
    }

    @Override
    public void teardown(String serviceName) {
        log.info("[federation] static teardown serviceName={}", serviceName);
    }
}
