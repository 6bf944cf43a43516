package com.work.federation.ledger.event;

import com.work.federation.core.exception.LedgerAbiMismatchException;
import com.work.federation.ledger.FederationAbi;
import org.web3j.abi.datatypes.Type;

import java.util.List;

/**
 * 已解码的合约事件。payload 字段按事件种类填充，其余为 null。
 */
public final class FederationEvent {

    private final FederationEventKind kind;
    private final String txHash;
    private final long blockNumber;
    private final long transactionIndex;
    private final long logIndex;

    private final String serviceId;
    private final String requirements;
    private final Integer bidCount;
    private final String operatorAddress;
    private final String operatorName;

    private FederationEvent(FederationEventKind kind, String txHash, long blockNumber, long transactionIndex,
                            long logIndex, String serviceId, String requirements, Integer bidCount,
                            String operatorAddress, String operatorName) {
        this.kind = kind;
        this.txHash = txHash;
        this.blockNumber = blockNumber;
        this.transactionIndex = transactionIndex;
        this.logIndex = logIndex;
        this.serviceId = serviceId;
        this.requirements = requirements;
        this.bidCount = bidCount;
        this.operatorAddress = operatorAddress;
        this.operatorName = operatorName;
    }

    /**
     * 按事件声明顺序从非 indexed 参数还原 payload。
     */
    public static FederationEvent fromValues(FederationEventKind kind, String txHash, long blockNumber,
                                             long transactionIndex, long logIndex, List<Type<?>> values) {
        int expected = kind.getEvent().getNonIndexedParameters().size();
        if (values == null || values.size() != expected) {
            throw new LedgerAbiMismatchException(kind.getEventName() + " 事件参数个数不符，期望 " + expected
                    + "，实际 " + (values == null ? 0 : values.size()));
        }
        switch (kind) {
            case OPERATOR_REGISTERED:
                return new FederationEvent(kind, txHash, blockNumber, transactionIndex, logIndex,
                        null, null, null, FederationAbi.address(values.get(0)), FederationAbi.text(values.get(1)));
            case OPERATOR_REMOVED:
                return new FederationEvent(kind, txHash, blockNumber, transactionIndex, logIndex,
                        null, null, null, FederationAbi.address(values.get(0)), null);
            case SERVICE_ANNOUNCEMENT:
                return new FederationEvent(kind, txHash, blockNumber, transactionIndex, logIndex,
                        FederationAbi.text(values.get(1)), FederationAbi.text(values.get(0)), null, null, null);
            case NEW_BID:
                return new FederationEvent(kind, txHash, blockNumber, transactionIndex, logIndex,
                        FederationAbi.text(values.get(0)), null, FederationAbi.uint(values.get(1)).intValueExact(),
                        null, null);
            case SERVICE_ANNOUNCEMENT_CLOSED:
            case SERVICE_DEPLOYED:
                return new FederationEvent(kind, txHash, blockNumber, transactionIndex, logIndex,
                        FederationAbi.text(values.get(0)), null, null, null, null);
            default:
                throw new LedgerAbiMismatchException("未知事件种类: " + kind);
        }
    }

    /**
     * 幂等去重 key：同一交易内的同一条 log。
     */
    public String dedupeKey() {
        return txHash + "#" + logIndex;
    }

    public FederationEventKind getKind() {
        return kind;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public long getTransactionIndex() {
        return transactionIndex;
    }

    public long getLogIndex() {
        return logIndex;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getRequirements() {
        return requirements;
    }

    public Integer getBidCount() {
        return bidCount;
    }

    public String getOperatorAddress() {
        return operatorAddress;
    }

    public String getOperatorName() {
        return operatorName;
    }

    @Override
    public String toString() {
        return "FederationEvent{kind=" + kind + ", block=" + blockNumber + ", tx=" + txHash + ", log=" + logIndex
                + ", serviceId=" + serviceId + ", bidCount=" + bidCount + "}";
    }
}
