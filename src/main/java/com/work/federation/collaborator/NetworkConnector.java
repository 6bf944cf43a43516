package com.work.federation.collaborator;

/**
 * 数据面隧道（VXLAN）配置的端口。
 */
public interface NetworkConnector {

    /**
     * @throws com.work.federation.core.exception.CollaboratorException 隧道建立失败
     */
    void establishTunnel(TunnelRequest request);
}
