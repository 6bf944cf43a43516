package com.work.federation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 账本连接配置。
 *
 * mode=mock: 使用进程内 InMemoryFederationLedger
 * mode=web3j: 使用 Web3jLedgerConnector 连接真实 EVM 节点
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * Federation 合约地址。
     */
    private String contractAddress;

    /**
     * 本域账户私钥（十六进制）。web3j 模式下必填，账户地址由私钥推导。
     */
    private String privateKey;

    /**
     * mock 模式下的本域账户地址。
     */
    private String mockAddress = "0x00000000000000000000000000000000000000d1";

    /**
     * EIP-155 chainId；<=0 时使用不带 chainId 的签名。
     */
    private long chainId = 1337L;

    /**
     * gas 价格（wei）；<=0 时每次发送前通过 eth_gasPrice 查询。
     */
    private BigInteger gasPrice = BigInteger.ZERO;

    private BigInteger gasLimit = BigInteger.valueOf(6_000_000L);

    /**
     * query 在账本不可用时的最大尝试次数（含首次）。
     */
    private int queryMaxAttempts = 3;

    /**
     * query 重试退避的基础间隔，按 2 的幂递增。
     */
    private Duration queryBackoff = Duration.ofMillis(500);

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

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public String getMockAddress() {
        return mockAddress;
    }

    public void setMockAddress(String mockAddress) {
        this.mockAddress = mockAddress;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(BigInteger gasLimit) {
        this.gasLimit = gasLimit;
    }

    public int getQueryMaxAttempts() {
        return queryMaxAttempts;
    }

    public void setQueryMaxAttempts(int queryMaxAttempts) {
        this.queryMaxAttempts = queryMaxAttempts;
    }

    public Duration getQueryBackoff() {
        return queryBackoff;
    }

    public void setQueryBackoff(Duration queryBackoff) {
        this.queryBackoff = queryBackoff;
    }
}
