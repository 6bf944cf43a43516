package com.work.federation.domain;

import com.work.federation.core.exception.DomainStateException;
import com.work.federation.core.exception.LedgerRejectedException;
import com.work.federation.ledger.FederationContractService;
import com.work.federation.ledger.SubmittedTransaction;
import com.work.federation.orchestrator.ActiveNegotiationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.work.federation.core.support.ValidationUtils.requireNonNull;
import static com.work.federation.core.support.ValidationUtils.requireValidIdentifier;

/**
 * 管理域在 Federation 合约上的注册与注销。
 * <p>
 * 规则：
 * 1. 同一域只注册一次，重复注册抛 DomainStateException；
 * 2. 未注册时注销、或本进程仍有在途协商时注销，同样拒绝。
 */
public class DomainRegistrationService {

    private static final Logger log = LoggerFactory.getLogger(DomainRegistrationService.class);

    private final FederationContractService contract;
    private final ActiveNegotiationRegistry activeRegistry;
    private final String defaultName;

    private volatile String registeredName;
    private volatile boolean registered;

    public DomainRegistrationService(FederationContractService contract,
                                     ActiveNegotiationRegistry activeRegistry,
                                     String defaultName) {
        this.contract = requireNonNull(contract, "contract");
        this.activeRegistry = requireNonNull(activeRegistry, "activeRegistry");
        this.defaultName = defaultName;
    }

    /**
     * 使用配置的域名注册。
     */
    public SubmittedTransaction register() {
        return register(defaultName);
    }

    public synchronized SubmittedTransaction register(String name) {
        requireValidIdentifier(name, "domainName");
        if (registered) {
            throw new DomainStateException("domain already registered: " + registeredName);
        }
        SubmittedTransaction tx;
        try {
            tx = contract.registerDomain(name);
        } catch (LedgerRejectedException e) {
            if (e.getReason() == LedgerRejectedException.Reason.REVERTED) {
                // 合约拒绝重复注册（如进程重启后本地状态丢失）
                registered = true;
                registeredName = name;
                throw new DomainStateException("domain already registered on ledger: " + name);
            }
            throw e;
        }
        registered = true;
        registeredName = name;
        log.info("[federation] domain registered name={} address={} txHash={}", name, getAddress(), tx.getTxHash());
        return tx;
    }

    public synchronized SubmittedTransaction unregister() {
        if (!registered) {
            throw new DomainStateException("domain is not registered");
        }
        // 检查与提交期间不允许新协商登记
        SubmittedTransaction tx = activeRegistry.exclusive(active -> {
            if (active > 0) {
                throw new DomainStateException("cannot unregister while " + active + " negotiation(s) are in flight");
            }
            return contract.unregisterDomain();
        });
        log.info("[federation] domain unregistered name={} txHash={}", registeredName, tx.getTxHash());
        registered = false;
        registeredName = null;
        return tx;
    }

    public FederationDomain current() {
        return new FederationDomain(getAddress(), registered ? registeredName : defaultName, registered);
    }

    public boolean isRegistered() {
        return registered;
    }

    private String getAddress() {
        return contract.getClient().getAddress();
    }
}
