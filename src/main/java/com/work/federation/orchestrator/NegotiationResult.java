package com.work.federation.orchestrator;

import com.work.federation.model.Bid;
import com.work.federation.model.ServiceEndpoint;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * 一次协商运行的结果。成功与 NOT_CHOSEN 由编排器返回，失败类结局由运行器根据异常构造。
 */
public class NegotiationResult {

    private final String runId;
    private final NegotiationRole role;
    private final NegotiationOutcome outcome;
    private final String serviceId;
    private final Bid winningBid;
    private final BigInteger offeredPrice;
    private final String federatedHost;
    private final ServiceEndpoint peerEndpoint;
    private final NegotiationStep failedStep;
    private final String errorType;
    private final String errorMessage;
    private final List<StepMark> timeline;

    private NegotiationResult(NegotiationSession session, NegotiationOutcome outcome, Bid winningBid,
                              BigInteger offeredPrice, String federatedHost, ServiceEndpoint peerEndpoint,
                              NegotiationStep failedStep, String errorType, String errorMessage) {
        this.runId = session.getRunId();
        this.role = session.getRole();
        this.serviceId = session.getServiceId();
        this.timeline = Collections.unmodifiableList(session.getTimeline());
        this.outcome = outcome;
        this.winningBid = winningBid;
        this.offeredPrice = offeredPrice;
        this.federatedHost = federatedHost;
        this.peerEndpoint = peerEndpoint;
        this.failedStep = failedStep;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
    }

    public static NegotiationResult consumerCompleted(NegotiationSession session, Bid winningBid,
                                                      String federatedHost, ServiceEndpoint providerEndpoint) {
        return new NegotiationResult(session, NegotiationOutcome.COMPLETED, winningBid, null, federatedHost,
                providerEndpoint, null, null, null);
    }

    public static NegotiationResult providerCompleted(NegotiationSession session, BigInteger offeredPrice,
                                                      String federatedHost, ServiceEndpoint consumerEndpoint) {
        return new NegotiationResult(session, NegotiationOutcome.COMPLETED, null, offeredPrice, federatedHost,
                consumerEndpoint, null, null, null);
    }

    public static NegotiationResult notChosen(NegotiationSession session, BigInteger offeredPrice) {
        return new NegotiationResult(session, NegotiationOutcome.NOT_CHOSEN, null, offeredPrice, null, null,
                null, null, null);
    }

    /**
     * 按异常种类映射结局：超时 TIMED_OUT，取消 CANCELLED，其余 FAILED。
     */
    public static NegotiationResult fromFailure(NegotiationSession session, RuntimeException error) {
        NegotiationOutcome outcome;
        NegotiationStep step;
        Throwable root = error;
        if (error instanceof NegotiationTimeoutException) {
            outcome = NegotiationOutcome.TIMED_OUT;
            step = ((NegotiationTimeoutException) error).getStep();
        } else if (error instanceof NegotiationCancelledException) {
            outcome = NegotiationOutcome.CANCELLED;
            step = ((NegotiationCancelledException) error).getStep();
        } else if (error instanceof NegotiationFailedException) {
            outcome = NegotiationOutcome.FAILED;
            step = ((NegotiationFailedException) error).getStep();
            root = error.getCause() == null ? error : error.getCause();
        } else {
            outcome = NegotiationOutcome.FAILED;
            step = session.getCurrentStep();
        }
        return new NegotiationResult(session, outcome, null, null, null, null, step,
                root.getClass().getSimpleName(), root.getMessage());
    }

    public String getRunId() {
        return runId;
    }

    public NegotiationRole getRole() {
        return role;
    }

    public NegotiationOutcome getOutcome() {
        return outcome;
    }

    public String getServiceId() {
        return serviceId;
    }

    public Bid getWinningBid() {
        return winningBid;
    }

    public BigInteger getOfferedPrice() {
        return offeredPrice;
    }

    public String getFederatedHost() {
        return federatedHost;
    }

    public ServiceEndpoint getPeerEndpoint() {
        return peerEndpoint;
    }

    public NegotiationStep getFailedStep() {
        return failedStep;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<StepMark> getTimeline() {
        return timeline;
    }
}
