package com.work.federation.ledger;

import com.work.federation.core.exception.LedgerRejectedException;
import com.work.federation.core.exception.ServiceNotFoundException;
import com.work.federation.model.Bid;
import com.work.federation.model.ServiceEndpoint;
import com.work.federation.model.ServiceInfo;
import com.work.federation.negotiation.NegotiationStateMachine;
import com.work.federation.negotiation.ServiceState;
import org.web3j.abi.datatypes.Type;

import java.util.ArrayList;
import java.util.List;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;
import static com.work.federation.core.support.ValidationUtils.requireNonNegative;

/**
 * 账本上服务 / 报价状态的类型化只读视图。
 * <p>
 * 每次都从账本重新读取，不缓存任何可变状态：两个域必须看到相同的值。
 */
public class FederationLedgerModel {

    private final LedgerClient client;

    public FederationLedgerModel(LedgerClient client) {
        this.client = client;
    }

    public ServiceState getState(String serviceId) {
        requireNonEmpty(serviceId, "serviceId");
        List<Type<?>> values = query(FederationAbi.getServiceState(serviceId), serviceId, 1);
        return ServiceState.fromCode(FederationAbi.uint(values.get(0)).longValueExact());
    }

    public Bid getBid(String serviceId, int bidIndex) {
        requireNonEmpty(serviceId, "serviceId");
        requireNonNegative(bidIndex, "bidIndex");
        List<Type<?>> values = query(FederationAbi.getBid(serviceId, bidIndex, client.getAddress()), serviceId, 3);
        return new Bid(serviceId, FederationAbi.uint(values.get(2)).intValueExact(),
                FederationAbi.address(values.get(0)), FederationAbi.uint(values.get(1)));
    }

    /**
     * 读取报价 0..count-1。
     */
    public List<Bid> listBids(String serviceId, int count) {
        List<Bid> bids = new ArrayList<>(Math.max(0, count));
        for (int i = 0; i < count; i++) {
            bids.add(getBid(serviceId, i));
        }
        return bids;
    }

    /**
     * asProvider=true：provider 读取 consumer 的端点（不含 federated host）；
     * asProvider=false：consumer 读取 provider 的端点与 federated host。
     */
    public ServiceInfo getServiceInfo(String serviceId, boolean asProvider) {
        requireNonEmpty(serviceId, "serviceId");
        List<Type<?>> values = query(FederationAbi.getServiceInfo(serviceId, asProvider, client.getAddress()), serviceId, 6);
        ServiceEndpoint endpoint = ServiceEndpoint.fromWire(
                FederationAbi.text(values.get(2)), FederationAbi.text(values.get(3)),
                FederationAbi.text(values.get(4)), FederationAbi.text(values.get(5)));
        String host = asProvider ? null : FederationAbi.text(values.get(1));
        return new ServiceInfo(FederationAbi.text(values.get(0)), host, endpoint);
    }

    /**
     * 只有服务处于 CLOSED 时才向账本询问；OPEN 与 DEPLOYED 一律返回 false。
     */
    public boolean isWinner(String serviceId, String address) {
        requireNonEmpty(serviceId, "serviceId");
        if (!NegotiationStateMachine.winnerDecided(getState(serviceId))) {
            return false;
        }
        List<Type<?>> values = query(FederationAbi.isWinner(serviceId, address), serviceId, 1);
        return FederationAbi.bool(values.get(0));
    }

    public boolean isWinner(String serviceId) {
        return isWinner(serviceId, client.getAddress());
    }

    public String getAddress() {
        return client.getAddress();
    }

    private List<Type<?>> query(LedgerCall call, String serviceId, int arity) {
        try {
            return FederationAbi.requireArity(call.getFunction(), client.query(call), arity);
        } catch (LedgerRejectedException e) {
            if (e.getReason() == LedgerRejectedException.Reason.REVERTED) {
                throw new ServiceNotFoundException("服务不存在或数据不可读: " + serviceId, e);
            }
            throw e;
        }
    }
}
