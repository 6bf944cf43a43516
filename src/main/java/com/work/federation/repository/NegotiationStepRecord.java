package com.work.federation.repository;

import java.time.Instant;

/**
 * 运行时间线中的一条步骤记录（持久化视图）。
 */
public class NegotiationStepRecord {

    private final int seq;
    private final String step;
    private final String status;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String detail;

    public NegotiationStepRecord(int seq, String step, String status, Instant startedAt, Instant finishedAt, String detail) {
        this.seq = seq;
        this.step = step;
        this.status = status;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.detail = detail;
    }

    public int getSeq() {
        return seq;
    }

    public String getStep() {
        return step;
    }

    public String getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public String getDetail() {
        return detail;
    }
}
