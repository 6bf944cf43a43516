package com.work.federation.collaborator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.work.federation.core.exception.CollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * 调用本地路由器 API 的 POST /configure_router 建立 VXLAN 隧道。
 */
public class RouterApiNetworkConnector implements NetworkConnector {

    private static final Logger log = LoggerFactory.getLogger(RouterApiNetworkConnector.class);

    private final RestTemplate restTemplate;
    private final String routerUrl;
    private final String password;

    public RouterApiNetworkConnector(RestTemplate restTemplate, String routerUrl, String password) {
        this.restTemplate = requireNonNull(restTemplate, "restTemplate");
        this.routerUrl = requireNonEmpty(routerUrl, "routerUrl");
        this.password = password;
    }

    @Override
    public void establishTunnel(TunnelRequest request) {
        requireNonNull(request, "request");
        requireNonEmpty(request.getLocalIp(), "localIp");
        requireNonEmpty(request.getRemoteIp(), "remoteIp");
        String url = routerUrl.endsWith("/") ? routerUrl + "configure_router" : routerUrl + "/configure_router";
        ResponseEntity<String> resp;
        try {
            resp = restTemplate.postForEntity(url, new ConfigureRouterBody(password, request), String.class);
        } catch (RestClientException e) {
            throw new CollaboratorException("路由器 API 调用失败: " + url, e);
        }
        if (!resp.getStatusCode().is2xxSuccessful()) {
            throw new CollaboratorException("路由器 API 返回 " + resp.getStatusCodeValue() + ": " + resp.getBody());
        }
        log.info("[federation] tunnel configured serviceId={} dst={} via {}", request.getServiceId(),
                request.getDestinationNetwork(), url);
    }

    static class ConfigureRouterBody {

        @JsonProperty("sudo_password")
        private final String sudoPassword;

        @JsonUnwrapped
        private final TunnelRequest tunnel;

        ConfigureRouterBody(String sudoPassword, TunnelRequest tunnel) {
            this.sudoPassword = sudoPassword;
            this.tunnel = tunnel;
        }

        public String getSudoPassword() {
            return sudoPassword;
        }

        public TunnelRequest getTunnel() {
            return tunnel;
        }
    }
}
