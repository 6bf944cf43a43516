package com.work.federation.web.dto;

/**
 * 账本连接信息。
 */
public class Web3InfoView {

    private String mode;
    private String rpcUrl;
    private String connector;
    private String domainAddress;
    private String contractAddress;
    private Long latestBlock;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getConnector() {
        return connector;
    }

    public void setConnector(String connector) {
        this.connector = connector;
    }

    public String getDomainAddress() {
        return domainAddress;
    }

    public void setDomainAddress(String domainAddress) {
        this.domainAddress = domainAddress;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public Long getLatestBlock() {
        return latestBlock;
    }

    public void setLatestBlock(Long latestBlock) {
        this.latestBlock = latestBlock;
    }
}
