package com.work.federation.ledger;

/**
 * 公告提交结果：consumer 生成的服务 id 与交易哈希。
 */
public class AnnouncedService {

    private final String serviceId;
    private final SubmittedTransaction transaction;

    public AnnouncedService(String serviceId, SubmittedTransaction transaction) {
        this.serviceId = serviceId;
        this.transaction = transaction;
    }

    public String getServiceId() {
        return serviceId;
    }

    public SubmittedTransaction getTransaction() {
        return transaction;
    }

    public String getTxHash() {
        return transaction.getTxHash();
    }
}
