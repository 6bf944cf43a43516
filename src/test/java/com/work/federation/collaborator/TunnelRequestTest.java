package com.work.federation.collaborator;

import com.work.federation.config.FederationProperties;
import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.model.ServiceEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TunnelRequestTest {

    private FederationProperties.Network network;

    @BeforeEach
    public void setUp() {
        network = new FederationProperties.Network();
        network.setLocalIp("10.5.15.16");
        network.setRemoteIp("10.5.98.105");
    }

    @Test
    public void destination_network_is_derived_from_federation_net() {
        network.setFederationNet("172.30.0.0/16");
        network.setPeerSubnetId(7);
        network.setVni(100);

        TunnelRequest request = TunnelRequest.forPeer("service1", null, null, network);

        assertEquals("172.30.7.0/24", request.getDestinationNetwork());
        assertEquals(100, request.getVni());
        assertEquals("service1", request.getServiceId());
    }

    @Test
    public void remote_ip_comes_from_the_peer_endpoint() {
        ServiceEndpoint local = new ServiceEndpoint("http://10.5.15.16:5000/catalog", null, null, null);
        ServiceEndpoint peer = new ServiceEndpoint("http://10.9.0.2:5000/catalog", "http://10.9.0.3:6000/topology",
                "nsd-1", null);

        TunnelRequest request = TunnelRequest.forPeer("service1", local, peer, network);

        // 拓扑库优先于服务目录库
        assertEquals("10.9.0.3", request.getRemoteIp());
        assertEquals("10.5.15.16", request.getLocalIp());
        assertSame(peer, request.getRemoteEndpoint());
        assertSame(local, request.getLocalEndpoint());
    }

    @Test
    public void configured_remote_ip_is_used_when_peer_publishes_no_url() {
        ServiceEndpoint peer = new ServiceEndpoint(null, null, "nsd-1", "ns-1");

        TunnelRequest request = TunnelRequest.forPeer("service1", null, peer, network);

        assertEquals("10.5.98.105", request.getRemoteIp());
        assertEquals(ServiceEndpoint.EMPTY, request.getLocalEndpoint());
    }

    @Test
    public void peer_endpoint_without_host_is_rejected() {
        ServiceEndpoint peer = new ServiceEndpoint("catalog-without-host", null, null, null);

        assertThrows(MalformedInputException.class, () -> TunnelRequest.forPeer("service1", null, peer, network));
    }

    @Test
    public void malformed_federation_net_is_rejected() {
        network.setFederationNet("not-a-cidr");

        assertThrows(MalformedInputException.class, () -> TunnelRequest.forPeer("service1", null, null, network));
    }
}
