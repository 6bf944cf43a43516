package com.work.federation.orchestrator;

import java.time.Duration;
import java.time.Instant;

/**
 * 时间线上的一个步骤记录。
 */
public class StepMark {

    public enum Status {
        STARTED,
        DONE,
        FAILED
    }

    private final NegotiationStep step;
    private final Instant startedAt;
    private Instant finishedAt;
    private Status status;
    private String detail;

    public StepMark(NegotiationStep step, Instant startedAt) {
        this.step = step;
        this.startedAt = startedAt;
        this.status = Status.STARTED;
    }

    void finish(Instant at, Status status, String detail) {
        this.finishedAt = at;
        this.status = status;
        this.detail = detail;
    }

    public NegotiationStep getStep() {
        return step;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Status getStatus() {
        return status;
    }

    public String getDetail() {
        return detail;
    }

    public Duration elapsed() {
        return finishedAt == null ? null : Duration.between(startedAt, finishedAt);
    }
}
