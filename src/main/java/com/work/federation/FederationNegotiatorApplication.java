package com.work.federation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口：本域以 consumer 或 provider 身份参与联邦协商，通过 REST 接口操作。
 */
@SpringBootApplication
public class FederationNegotiatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FederationNegotiatorApplication.class, args);
    }
}
