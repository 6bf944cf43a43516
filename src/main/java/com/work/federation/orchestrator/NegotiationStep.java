package com.work.federation.orchestrator;

/**
 * 协商运行中的步骤。失败、超时都归属到具体步骤上，便于定位。
 */
public enum NegotiationStep {

    // consumer
    ANNOUNCE(NegotiationRole.CONSUMER),
    AWAIT_BIDS(NegotiationRole.CONSUMER),
    EVALUATE_BIDS(NegotiationRole.CONSUMER),
    CHOOSE_PROVIDER(NegotiationRole.CONSUMER),
    AWAIT_DEPLOYMENT(NegotiationRole.CONSUMER),

    // provider
    DISCOVER(NegotiationRole.PROVIDER),
    PLACE_BID(NegotiationRole.PROVIDER),
    AWAIT_CLOSURE(NegotiationRole.PROVIDER),
    CHECK_WINNER(NegotiationRole.PROVIDER),
    DEPLOY(NegotiationRole.PROVIDER),
    UPDATE_ENDPOINT(NegotiationRole.PROVIDER),
    CONFIRM_DEPLOYMENT(NegotiationRole.PROVIDER),

    // 双方共用
    FETCH_SERVICE_INFO(null),
    ESTABLISH_CONNECTIVITY(null);

    private final NegotiationRole role;

    NegotiationStep(NegotiationRole role) {
        this.role = role;
    }

    /**
     * @return 所属角色；双方共用的步骤返回 null
     */
    public NegotiationRole getRole() {
        return role;
    }
}
