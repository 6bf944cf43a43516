package com.work.federation.ledger.web3j;

import com.work.federation.config.LedgerProperties;
import com.work.federation.core.exception.LedgerAbiMismatchException;
import com.work.federation.core.exception.LedgerRejectedException;
import com.work.federation.core.exception.LedgerUnavailableException;
import com.work.federation.ledger.FederationAbi;
import com.work.federation.ledger.LedgerCall;
import com.work.federation.ledger.LedgerConnector;
import com.work.federation.ledger.LedgerReceipt;
import com.work.federation.ledger.event.FederationEvent;
import com.work.federation.ledger.event.FederationEventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.EventValues;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 Web3j 的账本连接器：
 * - 本地签名（EIP-155）并 eth_sendRawTransaction
 * - eth_call + FunctionReturnDecoder 解码只读调用
 * - eth_getLogs 按合约地址与事件 topic 过滤，Contract.staticExtractEventParameters 解码
 */
public class Web3jLedgerConnector implements LedgerConnector {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerConnector.class);

    private final Web3j web3j;
    private final Credentials credentials;
    private final LedgerProperties props;
    private final String contractAddress;

    public Web3jLedgerConnector(Web3j web3j, Credentials credentials, LedgerProperties props) {
        this.web3j = requireNonNull(web3j, "web3j");
        this.credentials = requireNonNull(credentials, "credentials");
        this.props = requireNonNull(props, "props");
        this.contractAddress = requireNonEmpty(props.getContractAddress(), "ledger.contract-address");
    }

    public String getAddress() {
        return credentials.getAddress();
    }

    @Override
    public long getPendingNonce(String address) {
        try {
            return web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send()
                    .getTransactionCount().longValue();
        } catch (IOException e) {
            throw new LedgerUnavailableException("eth_getTransactionCount 失败: " + address, e);
        }
    }

    @Override
    public String sendTransaction(String from, long nonce, LedgerCall call) {
        if (!credentials.getAddress().equalsIgnoreCase(from)) {
            throw new IllegalArgumentException("from 与签名账户不一致: " + from);
        }
        try {
            RawTransaction raw = RawTransaction.createTransaction(
                    BigInteger.valueOf(nonce), resolveGasPrice(), props.getGasLimit(), contractAddress, call.encode());
            byte[] signed = props.getChainId() > 0
                    ? TransactionEncoder.signMessage(raw, props.getChainId(), credentials)
                    : TransactionEncoder.signMessage(raw, credentials);
            EthSendTransaction resp = web3j.ethSendRawTransaction(Numeric.toHexString(signed)).send();
            if (resp.hasError()) {
                throw classify(call, resp.getError());
            }
            return resp.getTransactionHash();
        } catch (IOException e) {
            throw new LedgerUnavailableException("eth_sendRawTransaction 失败: " + call.getFunction(), e);
        }
    }

    @Override
    public List<Type<?>> call(String from, LedgerCall call) {
        Function function = call.toAbiFunction();
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(from, contractAddress, call.encode()),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw classify(call, resp.getError());
            }
            List<Type<?>> values = FederationAbi.typed(
                    FunctionReturnDecoder.decode(resp.getValue(), function.getOutputParameters()));
            if (values == null || values.isEmpty()) {
                throw new LedgerAbiMismatchException(call.getFunction() + " 返回值为空或无法解码，合约地址/ABI 可能不匹配");
            }
            return values;
        } catch (IOException e) {
            throw new LedgerUnavailableException("eth_call 失败: " + call.getFunction(), e);
        }
    }

    @Override
    public long getLatestBlockNumber() {
        try {
            return web3j.ethBlockNumber().send().getBlockNumber().longValue();
        } catch (IOException e) {
            throw new LedgerUnavailableException("eth_blockNumber 失败", e);
        }
    }

    @Override
    public List<FederationEvent> getLogs(FederationEventKind kind, long fromBlock, long toBlock) {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
                contractAddress);
        filter.addSingleTopic(kind.getTopic());
        EthLog resp;
        try {
            resp = web3j.ethGetLogs(filter).send();
        } catch (IOException e) {
            throw new LedgerUnavailableException("eth_getLogs 失败: " + kind, e);
        }
        if (resp.hasError()) {
            throw new LedgerUnavailableException("eth_getLogs 返回错误: " + resp.getError().getMessage());
        }
        List<FederationEvent> events = new ArrayList<>();
        for (EthLog.LogResult result : resp.getLogs()) {
            if (!(result.get() instanceof Log)) {
                continue;
            }
            Log eventLog = (Log) result.get();
            EventValues values = Contract.staticExtractEventParameters(kind.getEvent(), eventLog);
            if (values == null) {
                log.warn("[ledger] skip undecodable {} log, tx={}", kind.getEventName(), eventLog.getTransactionHash());
                continue;
            }
            events.add(FederationEvent.fromValues(kind, eventLog.getTransactionHash(),
                    eventLog.getBlockNumber().longValue(), eventLog.getTransactionIndex().longValue(),
                    eventLog.getLogIndex().longValue(), FederationAbi.typed(values.getNonIndexedValues())));
        }
        return events;
    }

    @Override
    public LedgerReceipt getTransactionReceipt(String txHash) {
        try {
            EthGetTransactionReceipt resp = web3j.ethGetTransactionReceipt(txHash).send();
            Optional<TransactionReceipt> receiptOpt = resp.getTransactionReceipt();
            if (!receiptOpt.isPresent()) {
                return null;
            }
            TransactionReceipt r = receiptOpt.get();
            return new LedgerReceipt(txHash, r.getBlockNumber().longValue(), r.getBlockHash(), r.isStatusOK(),
                    r.getFrom(), r.getTo());
        } catch (IOException e) {
            throw new LedgerUnavailableException("eth_getTransactionReceipt 失败: " + txHash, e);
        }
    }

    @Override
    public String describe() {
        return props.getRpcUrl();
    }

    private BigInteger resolveGasPrice() throws IOException {
        BigInteger configured = props.getGasPrice();
        if (configured != null && configured.signum() > 0) {
            return configured;
        }
        return web3j.ethGasPrice().send().getGasPrice();
    }

    /**
     * 节点错误信息到统一异常的映射。
     */
    static LedgerRejectedException classify(LedgerCall call, Response.Error error) {
        String message = error == null || error.getMessage() == null ? "" : error.getMessage();
        return new LedgerRejectedException(classifyReason(message), call.getFunction() + " rejected: " + message);
    }

    static LedgerRejectedException.Reason classifyReason(String message) {
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (m.contains("nonce too low") || m.contains("already known")
                || m.contains("replacement transaction underpriced") || m.contains("known transaction")) {
            return LedgerRejectedException.Reason.NONCE_CONFLICT;
        }
        if (m.contains("unauthorized") || m.contains("not registered")) {
            return LedgerRejectedException.Reason.UNAUTHORIZED;
        }
        return LedgerRejectedException.Reason.REVERTED;
    }
}
