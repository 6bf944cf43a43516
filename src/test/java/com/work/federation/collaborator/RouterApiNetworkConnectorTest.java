package com.work.federation.collaborator;

import com.work.federation.config.FederationProperties;
import com.work.federation.core.exception.CollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class RouterApiNetworkConnectorTest {

    private MockRestServiceServer server;
    private RouterApiNetworkConnector connector;
    private FederationProperties.Network network;

    @BeforeEach
    public void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        connector = new RouterApiNetworkConnector(restTemplate, "http://127.0.0.1:8000/", "secret");
        network = new FederationProperties.Network();
        network.setLocalIp("10.5.15.16");
        network.setRemoteIp("10.5.98.105");
        network.setPeerSubnetId(2);
    }

    @Test
    public void posts_tunnel_parameters_to_configure_router() {
        server.expect(requestTo("http://127.0.0.1:8000/configure_router"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.sudo_password").value("secret"))
                .andExpect(jsonPath("$.local_ip").value("10.5.15.16"))
                .andExpect(jsonPath("$.remote_ip").value("10.5.98.105"))
                .andExpect(jsonPath("$.interface").value("eno1"))
                .andExpect(jsonPath("$.vni").value(49))
                .andExpect(jsonPath("$.dst_port").value(4789))
                .andExpect(jsonPath("$.destination_network").value("10.0.2.0/24"))
                .andExpect(jsonPath("$.serviceId").doesNotExist())
                .andExpect(jsonPath("$.remoteEndpoint").doesNotExist())
                .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        connector.establishTunnel(TunnelRequest.forPeer("service1", null, null, network));

        server.verify();
    }

    @Test
    public void router_error_is_a_collaborator_failure() {
        server.expect(requestTo("http://127.0.0.1:8000/configure_router"))
                .andRespond(withServerError());

        assertThrows(CollaboratorException.class,
                () -> connector.establishTunnel(TunnelRequest.forPeer("service1", null, null, network)));
    }

    @Test
    public void missing_addresses_are_rejected_before_calling_the_router() {
        network.setRemoteIp(null);

        assertThrows(IllegalArgumentException.class,
                () -> connector.establishTunnel(TunnelRequest.forPeer("service1", null, null, network)));
        server.verify();
    }
}
