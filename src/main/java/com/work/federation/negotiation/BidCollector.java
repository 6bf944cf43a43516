package com.work.federation.negotiation;

import com.work.federation.ledger.event.FederationEvent;
import com.work.federation.ledger.event.FederationEventKind;
import com.work.federation.ledger.event.ProcessedEventRegistry;

import java.util.List;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;

/**
 * 折叠某个服务的 NewBid 事件：报价数取看到过的最大值，重复事件不会重复计数。
 */
public class BidCollector {

    private final String serviceId;
    private final ProcessedEventRegistry registry;
    private int bidCount;

    public BidCollector(String serviceId) {
        this(serviceId, new ProcessedEventRegistry());
    }

    public BidCollector(String serviceId, ProcessedEventRegistry registry) {
        this.serviceId = requireNonEmpty(serviceId, "serviceId");
        this.registry = registry;
    }

    /**
     * @return 折叠后的报价数
     */
    public int fold(List<FederationEvent> events) {
        for (FederationEvent event : events) {
            if (event.getKind() != FederationEventKind.NEW_BID || !serviceId.equals(event.getServiceId())) {
                continue;
            }
            if (!registry.markProcessed(event)) {
                continue;
            }
            if (event.getBidCount() != null) {
                bidCount = Math.max(bidCount, event.getBidCount());
            }
        }
        return bidCount;
    }

    public int getBidCount() {
        return bidCount;
    }

    public boolean reached(int quorum) {
        return bidCount >= quorum;
    }
}
