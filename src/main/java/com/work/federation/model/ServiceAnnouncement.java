package com.work.federation.model;

/**
 * 从 ServiceAnnouncement 事件还原的公告。requirements 解析失败时为 null，原始文本保留在 rawRequirements。
 */
public final class ServiceAnnouncement {

    private final String serviceId;
    private final String rawRequirements;
    private final ServiceRequirements requirements;
    private final long blockNumber;
    private final String txHash;

    public ServiceAnnouncement(String serviceId, String rawRequirements, ServiceRequirements requirements,
                               long blockNumber, String txHash) {
        this.serviceId = serviceId;
        this.rawRequirements = rawRequirements;
        this.requirements = requirements;
        this.blockNumber = blockNumber;
        this.txHash = txHash;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getRawRequirements() {
        return rawRequirements;
    }

    public ServiceRequirements getRequirements() {
        return requirements;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public String getTxHash() {
        return txHash;
    }
}
