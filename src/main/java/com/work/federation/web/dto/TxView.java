package com.work.federation.web.dto;

import com.work.federation.ledger.SubmittedTransaction;

/**
 * 已被节点接受的交易。
 */
public class TxView {

    private String txHash;
    private Long nonce;
    private String function;

    public static TxView from(SubmittedTransaction tx) {
        TxView v = new TxView();
        v.setTxHash(tx.getTxHash());
        v.setNonce(tx.getNonce());
        v.setFunction(tx.getFunction().getContractName());
        return v;
    }

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public Long getNonce() {
        return nonce;
    }

    public void setNonce(Long nonce) {
        this.nonce = nonce;
    }

    public String getFunction() {
        return function;
    }

    public void setFunction(String function) {
        this.function = function;
    }
}
