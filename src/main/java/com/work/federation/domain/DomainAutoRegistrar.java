package com.work.federation.domain;

import com.work.federation.core.exception.DomainStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

/**
 * federation.auto-register=true 时，应用就绪后以配置的域名注册。
 * 账本不可用时启动失败，由部署侧重启。
 */
public class DomainAutoRegistrar implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(DomainAutoRegistrar.class);

    private final DomainRegistrationService registrationService;

    public DomainAutoRegistrar(DomainRegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        try {
            registrationService.register();
        } catch (DomainStateException e) {
            log.info("[federation] auto-register skipped: {}", e.getMessage());
        }
    }
}
