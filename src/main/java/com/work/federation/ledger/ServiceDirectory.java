package com.work.federation.ledger;

import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.core.exception.ServiceNotFoundException;
import com.work.federation.ledger.event.EventCursorFactory;
import com.work.federation.ledger.event.FederationEvent;
import com.work.federation.ledger.event.FederationEventKind;
import com.work.federation.model.Bid;
import com.work.federation.model.ServiceAnnouncement;
import com.work.federation.model.ServiceRequirements;
import com.work.federation.negotiation.BidCollector;
import com.work.federation.negotiation.NegotiationStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * 面向运维接口的只读查询：近期公告与某服务的报价列表。
 * 每次调用都重新读取账本，不缓存。
 */
public class ServiceDirectory {

    private static final Logger log = LoggerFactory.getLogger(ServiceDirectory.class);

    private final FederationLedgerModel model;
    private final EventCursorFactory cursors;

    public ServiceDirectory(FederationLedgerModel model, EventCursorFactory cursors) {
        this.model = requireNonNull(model, "model");
        this.cursors = requireNonNull(cursors, "cursors");
    }

    /**
     * 最近 lookbackBlocks 个区块内、当前仍为 OPEN 的公告，按账本顺序。
     * 需求串无法解析的公告仍然返回，requirements 为 null。
     */
    public List<ServiceAnnouncement> openAnnouncements(long lookbackBlocks) {
        List<ServiceAnnouncement> open = new ArrayList<>();
        for (FederationEvent event : cursors.lookback(FederationEventKind.SERVICE_ANNOUNCEMENT, lookbackBlocks).poll()) {
            try {
                if (!NegotiationStateMachine.acceptsBids(model.getState(event.getServiceId()))) {
                    continue;
                }
            } catch (ServiceNotFoundException e) {
                log.debug("[federation] announcement without service record serviceId={}", event.getServiceId());
                continue;
            }
            ServiceRequirements requirements = null;
            try {
                requirements = ServiceRequirements.parse(event.getRequirements());
            } catch (MalformedInputException e) {
                log.warn("[federation] announcement serviceId={} has malformed requirements: {}",
                        event.getServiceId(), e.getMessage());
            }
            open.add(new ServiceAnnouncement(event.getServiceId(), event.getRequirements(), requirements,
                    event.getBlockNumber(), event.getTxHash()));
        }
        return open;
    }

    /**
     * 某服务收到的全部报价（按 bidIndex）。
     * NewBid 事件带累计报价数，窗口内只要有一条该服务的报价事件，更早的报价也会一并列出；
     * 窗口内没有报价事件时返回空列表。
     *
     * @throws ServiceNotFoundException 服务不存在
     */
    public List<Bid> bids(String serviceId, long lookbackBlocks) {
        requireNonEmpty(serviceId, "serviceId");
        model.getState(serviceId);
        BidCollector collector = new BidCollector(serviceId);
        collector.fold(cursors.lookback(FederationEventKind.NEW_BID, lookbackBlocks).poll());
        return model.listBids(serviceId, collector.getBidCount());
    }
}
