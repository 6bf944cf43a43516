package com.work.federation.ledger;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * 一次合约调用：函数 + 已编码为 ABI 类型的入参。通过 {@link FederationAbi} 的工厂方法构造。
 */
public final class LedgerCall {

    private final LedgerFunction function;
    private final List<Type<?>> inputs;

    public LedgerCall(LedgerFunction function, List<Type<?>> inputs) {
        this.function = requireNonNull(function, "function");
        this.inputs = inputs == null ? Collections.emptyList() : Collections.unmodifiableList(inputs);
    }

    public LedgerFunction getFunction() {
        return function;
    }

    public List<Type<?>> getInputs() {
        return inputs;
    }

    public Function toAbiFunction() {
        return new Function(function.getContractName(), new ArrayList<Type>(inputs), function.outputParameters());
    }

    public String encode() {
        return FunctionEncoder.encode(toAbiFunction());
    }

    @Override
    public String toString() {
        return function.getContractName() + inputs;
    }
}
