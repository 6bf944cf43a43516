package com.work.federation.ledger;

import com.work.federation.ledger.event.FederationEvent;
import com.work.federation.ledger.event.FederationEventKind;
import org.web3j.abi.datatypes.Type;

import java.util.List;

/**
 * 账本交互最小端口。
 * <p>
 * 实现方负责把底层错误映射为统一异常：连接失败为 LedgerUnavailableException，
 * 节点拒绝为 LedgerRejectedException，返回值无法解码为 LedgerAbiMismatchException。
 */
public interface LedgerConnector {

    /**
     * 查询 pending nonce（EVM: eth_getTransactionCount(pending)）。
     */
    long getPendingNonce(String address);

    /**
     * 使用给定 nonce 签名并发送交易，返回 txHash。节点接受即返回，不等待上链。
     */
    String sendTransaction(String from, long nonce, LedgerCall call);

    /**
     * 只读调用（eth_call），返回按 {@link LedgerFunction#outputParameters()} 解码后的值。
     */
    List<Type<?>> call(String from, LedgerCall call);

    long getLatestBlockNumber();

    /**
     * 读取 [fromBlock, toBlock] 内指定类型的合约事件，按账本顺序返回。
     */
    List<FederationEvent> getLogs(FederationEventKind kind, long fromBlock, long toBlock);

    /**
     * 查询交易 receipt。返回 null 表示 NotFound（尚未上链）。
     */
    LedgerReceipt getTransactionReceipt(String txHash);

    /**
     * 节点描述（运维接口展示用）。
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
