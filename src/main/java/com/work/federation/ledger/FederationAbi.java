package com.work.federation.ledger;

import com.work.federation.core.exception.LedgerAbiMismatchException;
import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.model.ServiceEndpoint;
import com.work.federation.model.ServiceRequirements;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.BytesType;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Federation 合约的 ABI 编解码约定。
 * <p>
 * 服务 id 与域名称为 bytes32（UTF-8，右侧补零）；需求、端点与 federated host 为动态 bytes；
 * 价格与报价序号为 uint256。
 */
public final class FederationAbi {

    private FederationAbi() {
        throw new AssertionError("工具类不允许实例化");
    }

    // ---------------------------------------------------------------- submit

    public static LedgerCall addOperator(String domainName) {
        return new LedgerCall(LedgerFunction.ADD_OPERATOR, Collections.singletonList(bytes32(domainName)));
    }

    public static LedgerCall removeOperator() {
        return new LedgerCall(LedgerFunction.REMOVE_OPERATOR, Collections.emptyList());
    }

    public static LedgerCall announceService(ServiceRequirements requirements, String serviceId, ServiceEndpoint endpoint) {
        List<Type<?>> inputs = new ArrayList<>();
        inputs.add(bytes(requirements.format()));
        inputs.add(bytes32(serviceId));
        inputs.addAll(endpoint(endpoint));
        return new LedgerCall(LedgerFunction.ANNOUNCE_SERVICE, inputs);
    }

    public static LedgerCall updateEndpoint(boolean asProvider, String serviceId, ServiceEndpoint endpoint) {
        List<Type<?>> inputs = new ArrayList<>();
        inputs.add(new Bool(asProvider));
        inputs.add(bytes32(serviceId));
        inputs.addAll(endpoint(endpoint));
        return new LedgerCall(LedgerFunction.UPDATE_ENDPOINT, inputs);
    }

    public static LedgerCall placeBid(String serviceId, BigInteger price, ServiceEndpoint endpoint) {
        List<Type<?>> inputs = new ArrayList<>();
        inputs.add(bytes32(serviceId));
        inputs.add(new Uint256(price));
        inputs.addAll(endpoint(endpoint));
        return new LedgerCall(LedgerFunction.PLACE_BID, inputs);
    }

    public static LedgerCall chooseProvider(String serviceId, int bidIndex) {
        return new LedgerCall(LedgerFunction.CHOOSE_PROVIDER,
                Arrays.asList(bytes32(serviceId), new Uint256(BigInteger.valueOf(bidIndex))));
    }

    public static LedgerCall serviceDeployed(String serviceId, String federatedHost) {
        return new LedgerCall(LedgerFunction.SERVICE_DEPLOYED, Arrays.asList(bytes(federatedHost), bytes32(serviceId)));
    }

    // ---------------------------------------------------------------- query

    public static LedgerCall getServiceState(String serviceId) {
        return new LedgerCall(LedgerFunction.GET_SERVICE_STATE, Collections.singletonList(bytes32(serviceId)));
    }

    public static LedgerCall getBid(String serviceId, int bidIndex, String caller) {
        return new LedgerCall(LedgerFunction.GET_BID,
                Arrays.asList(bytes32(serviceId), new Uint256(BigInteger.valueOf(bidIndex)), new Address(caller)));
    }

    public static LedgerCall getServiceInfo(String serviceId, boolean asProvider, String caller) {
        return new LedgerCall(LedgerFunction.GET_SERVICE_INFO,
                Arrays.asList(bytes32(serviceId), new Bool(asProvider), new Address(caller)));
    }

    public static LedgerCall isWinner(String serviceId, String address) {
        return new LedgerCall(LedgerFunction.IS_WINNER, Arrays.asList(bytes32(serviceId), new Address(address)));
    }

    // ---------------------------------------------------------------- 编解码

    /**
     * 文本编码为 bytes32；超过 32 字节视为非法输入而不是截断。
     */
    public static Bytes32 bytes32(String text) {
        if (text == null || text.isEmpty()) {
            throw new MalformedInputException("bytes32 文本不能为空");
        }
        byte[] raw = text.getBytes(StandardCharsets.UTF_8);
        if (raw.length > 32) {
            throw new MalformedInputException("文本超过 32 字节，无法编码为 bytes32: " + text);
        }
        return new Bytes32(Arrays.copyOf(raw, 32));
    }

    public static DynamicBytes bytes(String text) {
        return new DynamicBytes(text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * bytes32 / bytes 解码为文本，去掉右侧补零。
     */
    public static String text(Type<?> value) {
        if (!(value instanceof BytesType)) {
            throw new LedgerAbiMismatchException("期望 bytes 类型，实际为 " + typeName(value));
        }
        byte[] raw = ((BytesType) value).getValue();
        int end = raw.length;
        while (end > 0 && raw[end - 1] == 0) {
            end--;
        }
        return new String(raw, 0, end, StandardCharsets.UTF_8);
    }

    public static BigInteger uint(Type<?> value) {
        if (!(value instanceof Uint256)) {
            throw new LedgerAbiMismatchException("期望 uint256，实际为 " + typeName(value));
        }
        return ((Uint256) value).getValue();
    }

    public static String address(Type<?> value) {
        if (!(value instanceof Address)) {
            throw new LedgerAbiMismatchException("期望 address，实际为 " + typeName(value));
        }
        return ((Address) value).getValue();
    }

    public static boolean bool(Type<?> value) {
        if (!(value instanceof Bool)) {
            throw new LedgerAbiMismatchException("期望 bool，实际为 " + typeName(value));
        }
        return ((Bool) value).getValue();
    }

    /**
     * 校验返回值个数，不足时说明合约 ABI 与本地约定不一致。
     */
    public static List<Type<?>> requireArity(LedgerFunction function, List<Type<?>> values, int expected) {
        if (values == null || values.size() < expected) {
            throw new LedgerAbiMismatchException(function.getContractName() + " 返回值个数不符，期望 " + expected
                    + "，实际 " + (values == null ? 0 : values.size()));
        }
        return values;
    }

    /**
     * web3j 解码结果为原始类型列表，这里逐个转成 {@code Type<?>}。
     */
    public static List<Type<?>> typed(List<?> values) {
        if (values == null) {
            return null;
        }
        List<Type<?>> out = new ArrayList<>(values.size());
        for (Object value : values) {
            if (!(value instanceof Type)) {
                throw new LedgerAbiMismatchException("无法识别的 ABI 返回值: " + value);
            }
            out.add((Type<?>) value);
        }
        return out;
    }

    private static List<Type<?>> endpoint(ServiceEndpoint endpoint) {
        ServiceEndpoint e = endpoint == null ? ServiceEndpoint.EMPTY : endpoint;
        return Arrays.asList(bytes(e.catalogWire()), bytes(e.topologyWire()), bytes(e.nsdWire()), bytes(e.nsWire()));
    }

    private static String typeName(Type<?> value) {
        return value == null ? "null" : value.getTypeAsString();
    }
}
