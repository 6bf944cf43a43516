package com.work.federation.ledger;

/**
 * 最小 receipt 表达：只暴露运维查询需要的字段。
 */
public class LedgerReceipt {

    private final String txHash;
    private final long blockNumber;
    private final String blockHash;
    private final boolean success;
    private final String from;
    private final String to;

    public LedgerReceipt(String txHash, long blockNumber, String blockHash, boolean success, String from, String to) {
        this.txHash = txHash;
        this.blockNumber = blockNumber;
        this.blockHash = blockHash;
        this.success = success;
        this.from = from;
        this.to = to;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
