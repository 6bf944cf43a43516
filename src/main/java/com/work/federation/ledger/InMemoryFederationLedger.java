package com.work.federation.ledger;

import com.work.federation.core.exception.LedgerRejectedException;
import com.work.federation.core.exception.LedgerUnavailableException;
import com.work.federation.ledger.event.FederationEvent;
import com.work.federation.ledger.event.FederationEventKind;
import com.work.federation.negotiation.ServiceState;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 进程内的 Federation 合约模拟：mock 模式与测试使用。
 * <p>
 * 校验 nonce、执行与合约相同的状态迁移与权限检查，每笔交易单独出一个块并发出对应事件。
 * 被合约拒绝的交易不消耗 nonce、不出块。多个 {@link LedgerClient} 可共享同一实例模拟多域。
 */
public class InMemoryFederationLedger implements LedgerConnector {

    private static final String NONE = "None";

    private static final class Endpoint {
        final String catalog;
        final String topology;
        final String nsd;
        final String ns;

        Endpoint(String catalog, String topology, String nsd, String ns) {
            this.catalog = catalog;
            this.topology = topology;
            this.nsd = nsd;
            this.ns = ns;
        }

        static Endpoint none() {
            return new Endpoint(NONE, NONE, NONE, NONE);
        }

        List<Type<?>> toTypes() {
            return Arrays.asList(FederationAbi.bytes(catalog), FederationAbi.bytes(topology),
                    FederationAbi.bytes(nsd), FederationAbi.bytes(ns));
        }
    }

    private static final class StoredBid {
        final String provider;
        final BigInteger price;
        final Endpoint endpoint;

        StoredBid(String provider, BigInteger price, Endpoint endpoint) {
            this.provider = provider;
            this.price = price;
            this.endpoint = endpoint;
        }
    }

    private static final class StoredService {
        final String creator;
        final String requirements;
        Endpoint consumerEndpoint;
        Endpoint providerEndpoint = Endpoint.none();
        ServiceState state = ServiceState.OPEN;
        String winner;
        String federatedHost = "";
        final List<StoredBid> bids = new ArrayList<>();

        StoredService(String creator, String requirements, Endpoint consumerEndpoint) {
            this.creator = creator;
            this.requirements = requirements;
            this.consumerEndpoint = consumerEndpoint;
        }
    }

    private final Map<String, Long> nonces = new HashMap<>();
    private final Map<String, String> operators = new HashMap<>();
    private final Map<String, StoredService> services = new HashMap<>();
    private final List<FederationEvent> events = new ArrayList<>();
    private final Map<String, LedgerReceipt> receipts = new HashMap<>();

    private long latestBlock;
    private int unavailableCalls;
    private RuntimeException nextSubmitFailure;

    @Override
    public synchronized long getPendingNonce(String address) {
        checkAvailable();
        return nonces.getOrDefault(key(address), 0L);
    }

    @Override
    public synchronized String sendTransaction(String from, long nonce, LedgerCall call) {
        checkAvailable();
        if (nextSubmitFailure != null) {
            RuntimeException failure = nextSubmitFailure;
            nextSubmitFailure = null;
            throw failure;
        }
        String sender = key(from);
        long expected = nonces.getOrDefault(sender, 0L);
        if (nonce < expected) {
            throw new LedgerRejectedException(LedgerRejectedException.Reason.NONCE_CONFLICT,
                    "nonce too low: next nonce " + expected + ", tx nonce " + nonce);
        }
        if (nonce > expected) {
            throw new LedgerRejectedException(LedgerRejectedException.Reason.NONCE_CONFLICT,
                    "nonce gap: next nonce " + expected + ", tx nonce " + nonce);
        }
        long block = latestBlock + 1;
        String txHash = Hash.sha3String(sender + ":" + nonce + ":" + block);
        List<FederationEvent> emitted = execute(sender, call, txHash, block);
        // 执行成功才出块并消耗 nonce
        nonces.put(sender, nonce + 1);
        latestBlock = block;
        events.addAll(emitted);
        receipts.put(txHash, new LedgerReceipt(txHash, block, "0x" + Long.toHexString(block), true, sender, "federation"));
        return txHash;
    }

    @Override
    public synchronized List<Type<?>> call(String from, LedgerCall call) {
        checkAvailable();
        String caller = key(from);
        List<Type<?>> in = call.getInputs();
        switch (call.getFunction()) {
            case GET_SERVICE_STATE: {
                StoredService s = requireService(FederationAbi.text(in.get(0)));
                return Collections.singletonList(new Uint256(s.state.getCode()));
            }
            case GET_BID: {
                StoredService s = requireService(FederationAbi.text(in.get(0)));
                int index = FederationAbi.uint(in.get(1)).intValueExact();
                if (index >= s.bids.size()) {
                    throw reverted("bid index out of range: " + index);
                }
                StoredBid bid = s.bids.get(index);
                return Arrays.asList(new Address(bid.provider), new Uint256(bid.price), new Uint256(index));
            }
            case GET_SERVICE_INFO: {
                String id = FederationAbi.text(in.get(0));
                StoredService s = requireService(id);
                boolean asProvider = FederationAbi.bool(in.get(1));
                String requester = key(FederationAbi.address(in.get(2)));
                List<Type<?>> out = new ArrayList<>();
                out.add(FederationAbi.bytes32(id));
                if (asProvider) {
                    if (!requester.equals(s.winner)) {
                        throw unauthorized("only the chosen provider can read consumer info");
                    }
                    out.add(FederationAbi.bytes(""));
                    out.addAll(s.consumerEndpoint.toTypes());
                } else {
                    if (!requester.equals(s.creator)) {
                        throw unauthorized("only the consumer can read provider info");
                    }
                    out.add(FederationAbi.bytes(s.federatedHost));
                    out.addAll(s.providerEndpoint.toTypes());
                }
                return out;
            }
            case IS_WINNER: {
                StoredService s = requireService(FederationAbi.text(in.get(0)));
                String candidate = key(FederationAbi.address(in.get(1)));
                return Collections.singletonList(new Bool(candidate.equals(s.winner)));
            }
            default:
                throw new IllegalArgumentException("不是 QUERY 类函数: " + call.getFunction() + " caller=" + caller);
        }
    }

    @Override
    public synchronized long getLatestBlockNumber() {
        checkAvailable();
        return latestBlock;
    }

    @Override
    public synchronized List<FederationEvent> getLogs(FederationEventKind kind, long fromBlock, long toBlock) {
        checkAvailable();
        List<FederationEvent> out = new ArrayList<>();
        for (FederationEvent e : events) {
            if (e.getKind() == kind && e.getBlockNumber() >= fromBlock && e.getBlockNumber() <= toBlock) {
                out.add(e);
            }
        }
        return out;
    }

    @Override
    public synchronized LedgerReceipt getTransactionReceipt(String txHash) {
        checkAvailable();
        return receipts.get(txHash);
    }

    @Override
    public String describe() {
        return "in-memory";
    }

    /**
     * 测试用：接下来的 times 次调用抛出 LedgerUnavailableException。
     */
    public synchronized void failNextCalls(int times) {
        this.unavailableCalls = times;
    }

    /**
     * 测试用：下一次 sendTransaction 抛出给定异常（nonce 校验之前）。
     */
    public synchronized void failNextSubmit(RuntimeException failure) {
        this.nextSubmitFailure = failure;
    }

    /**
     * 测试用：模拟其他客户端用同一账户提交，使链上 nonce 前进。
     */
    public synchronized void advanceNonceExternally(String address, int count) {
        String sender = key(address);
        nonces.merge(sender, (long) count, Long::sum);
    }

    public synchronized boolean isRegistered(String address) {
        return operators.containsKey(key(address));
    }

    private List<FederationEvent> execute(String sender, LedgerCall call, String txHash, long block) {
        List<Type<?>> in = call.getInputs();
        switch (call.getFunction()) {
            case ADD_OPERATOR: {
                if (operators.containsKey(sender)) {
                    throw reverted("domain already registered");
                }
                String name = FederationAbi.text(in.get(0));
                operators.put(sender, name);
                return emit(FederationEventKind.OPERATOR_REGISTERED, txHash, block,
                        Arrays.asList(new Address(sender), FederationAbi.bytes32(name)));
            }
            case REMOVE_OPERATOR: {
                requireOperator(sender);
                operators.remove(sender);
                return emit(FederationEventKind.OPERATOR_REMOVED, txHash, block,
                        Collections.singletonList(new Address(sender)));
            }
            case ANNOUNCE_SERVICE: {
                requireOperator(sender);
                String requirements = FederationAbi.text(in.get(0));
                String id = FederationAbi.text(in.get(1));
                if (services.containsKey(id)) {
                    throw reverted("service id already exists: " + id);
                }
                services.put(id, new StoredService(sender, requirements, endpoint(in, 2)));
                return emit(FederationEventKind.SERVICE_ANNOUNCEMENT, txHash, block,
                        Arrays.asList(FederationAbi.bytes(requirements), FederationAbi.bytes32(id)));
            }
            case UPDATE_ENDPOINT: {
                boolean provider = FederationAbi.bool(in.get(0));
                StoredService s = requireService(FederationAbi.text(in.get(1)));
                if (provider) {
                    if (!sender.equals(s.winner)) {
                        throw unauthorized("only the chosen provider can update its endpoint");
                    }
                    s.providerEndpoint = endpoint(in, 2);
                } else {
                    if (!sender.equals(s.creator)) {
                        throw unauthorized("only the consumer can update its endpoint");
                    }
                    s.consumerEndpoint = endpoint(in, 2);
                }
                return Collections.emptyList();
            }
            case PLACE_BID: {
                requireOperator(sender);
                String id = FederationAbi.text(in.get(0));
                StoredService s = requireService(id);
                if (s.state != ServiceState.OPEN) {
                    throw reverted("service is not open for bids: " + id);
                }
                s.bids.add(new StoredBid(sender, FederationAbi.uint(in.get(1)), endpoint(in, 2)));
                return emit(FederationEventKind.NEW_BID, txHash, block,
                        Arrays.asList(FederationAbi.bytes32(id), new Uint256(s.bids.size())));
            }
            case CHOOSE_PROVIDER: {
                String id = FederationAbi.text(in.get(0));
                StoredService s = requireService(id);
                if (!sender.equals(s.creator)) {
                    throw unauthorized("only the consumer can choose a provider");
                }
                if (s.state != ServiceState.OPEN) {
                    throw reverted("service is not open: " + id);
                }
                int index = FederationAbi.uint(in.get(1)).intValueExact();
                if (index >= s.bids.size()) {
                    throw reverted("bid index out of range: " + index);
                }
                StoredBid chosen = s.bids.get(index);
                s.winner = chosen.provider;
                s.providerEndpoint = chosen.endpoint;
                s.state = ServiceState.CLOSED;
                return emit(FederationEventKind.SERVICE_ANNOUNCEMENT_CLOSED, txHash, block,
                        Collections.singletonList(FederationAbi.bytes32(id)));
            }
            case SERVICE_DEPLOYED: {
                String host = FederationAbi.text(in.get(0));
                String id = FederationAbi.text(in.get(1));
                StoredService s = requireService(id);
                if (!sender.equals(s.winner)) {
                    throw unauthorized("only the chosen provider can confirm deployment");
                }
                if (s.state != ServiceState.CLOSED) {
                    throw reverted("service is not closed: " + id);
                }
                s.federatedHost = host;
                s.state = ServiceState.DEPLOYED;
                return emit(FederationEventKind.SERVICE_DEPLOYED, txHash, block,
                        Collections.singletonList(FederationAbi.bytes32(id)));
            }
            default:
                throw new IllegalArgumentException("不是 SUBMIT 类函数: " + call.getFunction());
        }
    }

    private List<FederationEvent> emit(FederationEventKind kind, String txHash, long block, List<Type<?>> values) {
        return Collections.singletonList(FederationEvent.fromValues(kind, txHash, block, 0L, 0L, values));
    }

    private Endpoint endpoint(List<Type<?>> in, int offset) {
        return new Endpoint(FederationAbi.text(in.get(offset)), FederationAbi.text(in.get(offset + 1)),
                FederationAbi.text(in.get(offset + 2)), FederationAbi.text(in.get(offset + 3)));
    }

    private void requireOperator(String sender) {
        if (!operators.containsKey(sender)) {
            throw unauthorized("domain is not registered: " + sender);
        }
    }

    private StoredService requireService(String id) {
        StoredService s = services.get(id);
        if (s == null) {
            throw reverted("service does not exist: " + id);
        }
        return s;
    }

    private void checkAvailable() {
        if (unavailableCalls > 0) {
            unavailableCalls--;
            throw new LedgerUnavailableException("in-memory ledger unavailable (injected)");
        }
    }

    private static LedgerRejectedException reverted(String message) {
        return new LedgerRejectedException(LedgerRejectedException.Reason.REVERTED, "execution reverted: " + message);
    }

    private static LedgerRejectedException unauthorized(String message) {
        return new LedgerRejectedException(LedgerRejectedException.Reason.UNAUTHORIZED, "unauthorized: " + message);
    }

    private static String key(String address) {
        return address == null ? "" : address.toLowerCase(Locale.ROOT);
    }
}
