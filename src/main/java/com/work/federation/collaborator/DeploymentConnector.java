package com.work.federation.collaborator;

/**
 * 工作负载部署后端（容器 / k8s 等）的端口。
 */
public interface DeploymentConnector {

    /**
     * 部署服务并返回对外可达的 federated host。
     *
     * @throws com.work.federation.core.exception.CollaboratorException 部署失败
     */
    String deploy(String descriptor, int replicas);

    void teardown(String serviceName);
}
