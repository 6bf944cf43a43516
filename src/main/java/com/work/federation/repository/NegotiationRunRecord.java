package com.work.federation.repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次协商运行的持久化视图。
 */
public class NegotiationRunRecord {

    private String runId;
    private String role;
    private String serviceId;
    private String outcome;
    private String failedStep;
    private String errorType;
    private String errorMessage;
    private String federatedHost;
    private Instant createdAt;
    private Instant finishedAt;
    private List<NegotiationStepRecord> steps = new ArrayList<>();

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public String getServiceId() {
        return serviceId;
    }

    public void setServiceId(String serviceId) {
        this.serviceId = serviceId;
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public String getFailedStep() {
        return failedStep;
    }

    public void setFailedStep(String failedStep) {
        this.failedStep = failedStep;
    }

    public String getErrorType() {
        return errorType;
    }

    public void setErrorType(String errorType) {
        this.errorType = errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getFederatedHost() {
        return federatedHost;
    }

    public void setFederatedHost(String federatedHost) {
        this.federatedHost = federatedHost;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public List<NegotiationStepRecord> getSteps() {
        return steps;
    }

    public void setSteps(List<NegotiationStepRecord> steps) {
        this.steps = steps;
    }
}
