package com.work.federation;

import com.work.federation.ledger.LedgerCall;
import com.work.federation.ledger.LedgerConnector;
import com.work.federation.ledger.LedgerReceipt;
import com.work.federation.ledger.event.FederationEvent;
import com.work.federation.ledger.event.FederationEventKind;
import org.web3j.abi.datatypes.Type;

import java.util.List;

/**
 * 测试用：全部委托给另一个连接，子类只覆盖需要注入故障或计数的方法。
 */
public abstract class ForwardingLedgerConnector implements LedgerConnector {

    protected final LedgerConnector delegate;

    protected ForwardingLedgerConnector(LedgerConnector delegate) {
        this.delegate = delegate;
    }

    @Override
    public long getPendingNonce(String address) {
        return delegate.getPendingNonce(address);
    }

    @Override
    public String sendTransaction(String from, long nonce, LedgerCall call) {
        return delegate.sendTransaction(from, nonce, call);
    }

    @Override
    public List<Type<?>> call(String from, LedgerCall call) {
        return delegate.call(from, call);
    }

    @Override
    public long getLatestBlockNumber() {
        return delegate.getLatestBlockNumber();
    }

    @Override
    public List<FederationEvent> getLogs(FederationEventKind kind, long fromBlock, long toBlock) {
        return delegate.getLogs(kind, fromBlock, toBlock);
    }

    @Override
    public LedgerReceipt getTransactionReceipt(String txHash) {
        return delegate.getTransactionReceipt(txHash);
    }
}
