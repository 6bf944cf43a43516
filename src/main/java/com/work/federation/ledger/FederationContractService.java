package com.work.federation.ledger;

import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.core.exception.NotWinnerException;
import com.work.federation.core.support.ValidationUtils;
import com.work.federation.model.ServiceEndpoint;
import com.work.federation.model.ServiceRequirements;
import com.work.federation.negotiation.NegotiationStateMachine;
import com.work.federation.negotiation.ServiceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * Federation 合约的类型化写操作。所有输入在发起任何账本调用之前完成校验。
 */
public class FederationContractService {

    private static final Logger log = LoggerFactory.getLogger(FederationContractService.class);

    private final LedgerClient client;
    private final FederationLedgerModel model;
    private final ServiceIdGenerator idGenerator;

    public FederationContractService(LedgerClient client, FederationLedgerModel model, ServiceIdGenerator idGenerator) {
        this.client = requireNonNull(client, "client");
        this.model = requireNonNull(model, "model");
        this.idGenerator = requireNonNull(idGenerator, "idGenerator");
    }

    public SubmittedTransaction registerDomain(String domainName) {
        ValidationUtils.requireValidIdentifier(domainName, "domainName");
        return client.submit(FederationAbi.addOperator(domainName));
    }

    public SubmittedTransaction unregisterDomain() {
        return client.submit(FederationAbi.removeOperator());
    }

    public AnnouncedService announceService(ServiceRequirements requirements, ServiceEndpoint consumerEndpoint) {
        requireNonNull(requirements, "requirements").validate();
        ServiceEndpoint endpoint = consumerEndpoint == null ? ServiceEndpoint.EMPTY : consumerEndpoint.validate();
        String serviceId = idGenerator.next();
        SubmittedTransaction tx = client.submit(FederationAbi.announceService(requirements, serviceId, endpoint));
        log.info("[federation] announced serviceId={} requirements=[{}] txHash={}", serviceId, requirements, tx.getTxHash());
        return new AnnouncedService(serviceId, tx);
    }

    public SubmittedTransaction placeBid(String serviceId, BigInteger price, ServiceEndpoint providerEndpoint) {
        requireNonEmpty(serviceId, "serviceId");
        if (price == null || price.signum() < 0) {
            throw new MalformedInputException("price 必须为非负整数: " + price);
        }
        ServiceEndpoint endpoint = providerEndpoint == null ? ServiceEndpoint.EMPTY : providerEndpoint.validate();
        return client.submit(FederationAbi.placeBid(serviceId, price, endpoint));
    }

    /**
     * 只在服务仍为 OPEN 时提交；否则直接抛出 ILLEGAL_TRANSITION，不发起交易。
     */
    public SubmittedTransaction chooseProvider(String serviceId, int bidIndex) {
        requireNonEmpty(serviceId, "serviceId");
        if (bidIndex < 0) {
            throw new MalformedInputException("bidIndex 不能为负数: " + bidIndex);
        }
        ServiceState state = model.getState(serviceId);
        NegotiationStateMachine.requireTransition(state, ServiceState.CLOSED);
        return client.submit(FederationAbi.chooseProvider(serviceId, bidIndex));
    }

    public SubmittedTransaction updateEndpoint(String serviceId, boolean asProvider, ServiceEndpoint endpoint) {
        requireNonEmpty(serviceId, "serviceId");
        requireNonNull(endpoint, "endpoint").validate();
        return client.submit(FederationAbi.updateEndpoint(asProvider, serviceId, endpoint));
    }

    /**
     * 提交 ServiceDeployed 之前再次确认本域是胜者。
     *
     * @throws NotWinnerException 本域不是该服务的胜者（或服务尚未关闭）
     */
    public SubmittedTransaction confirmDeployment(String serviceId, String federatedHost) {
        requireNonEmpty(serviceId, "serviceId");
        if (federatedHost == null || federatedHost.trim().isEmpty()) {
            throw new MalformedInputException("federatedHost 不能为空");
        }
        if (!model.isWinner(serviceId)) {
            throw new NotWinnerException(serviceId, "本域不是服务 " + serviceId + " 的胜者，不能确认部署");
        }
        return client.submit(FederationAbi.serviceDeployed(serviceId, federatedHost.trim()));
    }

    public FederationLedgerModel getModel() {
        return model;
    }

    public LedgerClient getClient() {
        return client;
    }
}
