package com.work.federation.collaborator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.federation.config.FederationProperties;
import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.core.support.SubnetUtils;
import com.work.federation.model.ServiceEndpoint;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * 一次 VXLAN 隧道配置请求。字段名与路由器 API 的 /configure_router 请求体一致。
 */
public class TunnelRequest {

    @JsonProperty("local_ip")
    private final String localIp;

    @JsonProperty("remote_ip")
    private final String remoteIp;

    @JsonProperty("interface")
    private final String interfaceName;

    @JsonProperty("vni")
    private final int vni;

    @JsonProperty("dst_port")
    private final int dstPort;

    @JsonProperty("destination_network")
    private final String destinationNetwork;

    @JsonProperty("tunnel_ip")
    private final String tunnelIp;

    @JsonProperty("gateway_ip")
    private final String gatewayIp;

    @JsonIgnore
    private final String serviceId;

    @JsonIgnore
    private final ServiceEndpoint localEndpoint;

    @JsonIgnore
    private final ServiceEndpoint remoteEndpoint;

    public TunnelRequest(String serviceId, ServiceEndpoint localEndpoint, ServiceEndpoint remoteEndpoint,
                         String localIp, String remoteIp, String interfaceName, int vni, int dstPort,
                         String destinationNetwork, String tunnelIp, String gatewayIp) {
        this.serviceId = serviceId;
        this.localEndpoint = localEndpoint == null ? ServiceEndpoint.EMPTY : localEndpoint;
        this.remoteEndpoint = remoteEndpoint == null ? ServiceEndpoint.EMPTY : remoteEndpoint;
        this.localIp = localIp;
        this.remoteIp = remoteIp;
        this.interfaceName = interfaceName;
        this.vni = vni;
        this.dstPort = dstPort;
        this.destinationNetwork = destinationNetwork;
        this.tunnelIp = tunnelIp;
        this.gatewayIp = gatewayIp;
    }

    /**
     * 面向对端生成请求。remote_ip 取自账本上对端端点的主机（拓扑库优先，其次服务目录库），
     * 对端未公布任何 URL 时才回退到 network.remote-ip；其余本地参数都来自本域网络配置。
     * 对端子网 = federationNet 第三段替换为 peerSubnetId 的 /24。
     *
     * @param localEndpoint  本域在账本上公布的端点
     * @param remoteEndpoint FETCH_SERVICE_INFO 读到的对端端点
     */
    public static TunnelRequest forPeer(String serviceId, ServiceEndpoint localEndpoint, ServiceEndpoint remoteEndpoint,
                                        FederationProperties.Network net) {
        String destination = SubnetUtils.createSmallerSubnet(net.getFederationNet(), net.getPeerSubnetId());
        String peerHost = hostOf(remoteEndpoint);
        String remoteIp = peerHost != null ? peerHost : net.getRemoteIp();
        return new TunnelRequest(serviceId, localEndpoint, remoteEndpoint, net.getLocalIp(), remoteIp,
                net.getInterfaceName(), net.getVni(), net.getUdpPort(), destination, net.getTunnelIp(),
                net.getGatewayIp());
    }

    static String hostOf(ServiceEndpoint endpoint) {
        if (endpoint == null) {
            return null;
        }
        String url = endpoint.getTopologyDb() != null ? endpoint.getTopologyDb() : endpoint.getServiceCatalogDb();
        if (url == null) {
            return null;
        }
        try {
            String host = new URI(url).getHost();
            if (host == null) {
                throw new MalformedInputException("对端端点缺少主机: " + url);
            }
            return host;
        } catch (URISyntaxException e) {
            throw new MalformedInputException("对端端点不是合法 URL: " + url);
        }
    }

    public String getServiceId() {
        return serviceId;
    }

    public ServiceEndpoint getLocalEndpoint() {
        return localEndpoint;
    }

    public ServiceEndpoint getRemoteEndpoint() {
        return remoteEndpoint;
    }

    public String getLocalIp() {
        return localIp;
    }

    public String getRemoteIp() {
        return remoteIp;
    }

    public String getInterfaceName() {
        return interfaceName;
    }

    public int getVni() {
        return vni;
    }

    public int getDstPort() {
        return dstPort;
    }

    public String getDestinationNetwork() {
        return destinationNetwork;
    }

    public String getTunnelIp() {
        return tunnelIp;
    }

    public String getGatewayIp() {
        return gatewayIp;
    }

    @Override
    public String toString() {
        return "TunnelRequest{serviceId=" + serviceId + ", local=" + localIp + ", remote=" + remoteIp
                + ", remoteEndpoint=" + remoteEndpoint
                + ", if=" + interfaceName + ", vni=" + vni + ", port=" + dstPort + ", dst=" + destinationNetwork
                + ", tunnel=" + tunnelIp + ", gw=" + gatewayIp + "}";
    }
}
