package com.work.federation.ledger;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Federation 合约上本系统会调用的全部函数。SUBMIT 类改变账本状态并消耗 nonce，QUERY 类只读。
 */
public enum LedgerFunction {

    ADD_OPERATOR("addOperator", Kind.SUBMIT),
    REMOVE_OPERATOR("removeOperator", Kind.SUBMIT),
    ANNOUNCE_SERVICE("AnnounceService", Kind.SUBMIT),
    UPDATE_ENDPOINT("UpdateEndpoint", Kind.SUBMIT),
    PLACE_BID("PlaceBid", Kind.SUBMIT),
    CHOOSE_PROVIDER("ChooseProvider", Kind.SUBMIT),
    SERVICE_DEPLOYED("ServiceDeployed", Kind.SUBMIT),

    GET_SERVICE_STATE("GetServiceState", Kind.QUERY),
    GET_BID("GetBid", Kind.QUERY),
    GET_SERVICE_INFO("GetServiceInfo", Kind.QUERY),
    IS_WINNER("isWinner", Kind.QUERY);

    public enum Kind {
        SUBMIT,
        QUERY
    }

    private final String contractName;
    private final Kind kind;

    LedgerFunction(String contractName, Kind kind) {
        this.contractName = contractName;
        this.kind = kind;
    }

    public String getContractName() {
        return contractName;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isQuery() {
        return kind == Kind.QUERY;
    }

    /**
     * 返回值的 ABI 类型；SUBMIT 类函数没有返回值。
     */
    public List<TypeReference<?>> outputParameters() {
        switch (this) {
            case GET_SERVICE_STATE:
                return Collections.singletonList(new TypeReference<Uint256>() {
                });
            case GET_BID:
                // (provider, price, bid index)
                return Arrays.asList(
                        new TypeReference<Address>() {
                        },
                        new TypeReference<Uint256>() {
                        },
                        new TypeReference<Uint256>() {
                        });
            case GET_SERVICE_INFO:
                // (id, federated host, catalog, topology, nsd, ns)
                return Arrays.asList(
                        new TypeReference<Bytes32>() {
                        },
                        new TypeReference<DynamicBytes>() {
                        },
                        new TypeReference<DynamicBytes>() {
                        },
                        new TypeReference<DynamicBytes>() {
                        },
                        new TypeReference<DynamicBytes>() {
                        },
                        new TypeReference<DynamicBytes>() {
                        });
            case IS_WINNER:
                return Collections.singletonList(new TypeReference<Bool>() {
                });
            default:
                return Collections.emptyList();
        }
    }
}
