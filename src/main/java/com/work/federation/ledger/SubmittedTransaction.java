package com.work.federation.ledger;

/**
 * 节点已接受的一笔提交（不代表已上链终局）。
 */
public class SubmittedTransaction {

    private final String txHash;
    private final long nonce;
    private final LedgerFunction function;

    public SubmittedTransaction(String txHash, long nonce, LedgerFunction function) {
        this.txHash = txHash;
        this.nonce = nonce;
        this.function = function;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getNonce() {
        return nonce;
    }

    public LedgerFunction getFunction() {
        return function;
    }

    @Override
    public String toString() {
        return "SubmittedTransaction{txHash=" + txHash + ", nonce=" + nonce + ", function=" + function + "}";
    }
}
