package com.work.federation.ledger.event;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;
import java.util.Collections;

/**
 * Federation 合约发出的事件种类。所有参数均为非 indexed，按声明顺序位于 log data 中。
 */
public enum FederationEventKind {

    OPERATOR_REGISTERED(new Event("OperatorRegistered", Arrays.asList(
            new TypeReference<Address>() {
            },
            new TypeReference<Bytes32>() {
            }))),

    OPERATOR_REMOVED(new Event("OperatorRemoved", Collections.singletonList(
            new TypeReference<Address>() {
            }))),

    SERVICE_ANNOUNCEMENT(new Event("ServiceAnnouncement", Arrays.asList(
            new TypeReference<DynamicBytes>() {
            },
            new TypeReference<Bytes32>() {
            }))),

    /**
     * 第二个参数 max_bid_index 实际是该服务当前的报价总数。
     */
    NEW_BID(new Event("NewBid", Arrays.asList(
            new TypeReference<Bytes32>() {
            },
            new TypeReference<Uint256>() {
            }))),

    SERVICE_ANNOUNCEMENT_CLOSED(new Event("ServiceAnnouncementClosed", Collections.singletonList(
            new TypeReference<Bytes32>() {
            }))),

    SERVICE_DEPLOYED(new Event("ServiceDeployedEvent", Collections.singletonList(
            new TypeReference<Bytes32>() {
            })));

    private final Event event;
    private final String topic;

    FederationEventKind(Event event) {
        this.event = event;
        this.topic = EventEncoder.encode(event);
    }

    public Event getEvent() {
        return event;
    }

    public String getEventName() {
        return event.getName();
    }

    /**
     * topic0：keccak256(事件签名)。
     */
    public String getTopic() {
        return topic;
    }
}
