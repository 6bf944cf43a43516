package com.work.federation.web.dto;

import javax.validation.constraints.Size;

public class RegisterDomainRequest {

    /**
     * 域名称；为空时使用 federation.domain-name
     */
    @Size(max = 32, message = "name 最长 32 字节")
    private String name;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
