package com.work.federation.collaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 只记录隧道参数，不做任何配置。
 */
public class LoggingNetworkConnector implements NetworkConnector {

    private static final Logger log = LoggerFactory.getLogger(LoggingNetworkConnector.class);

    @Override
    public void establishTunnel(TunnelRequest request) {
        log.info("[federation] tunnel (logging only) {}", request);
    }
}
