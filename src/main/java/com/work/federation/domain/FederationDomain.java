package com.work.federation.domain;

/**
 * 本进程代表的管理域：链上地址、域名与注册状态的快照。
 */
public class FederationDomain {

    private final String address;
    private final String name;
    private final boolean registered;

    public FederationDomain(String address, String name, boolean registered) {
        this.address = address;
        this.name = name;
        this.registered = registered;
    }

    public String getAddress() {
        return address;
    }

    public String getName() {
        return name;
    }

    public boolean isRegistered() {
        return registered;
    }
}
