package com.work.federation.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 协商运行记录的存储。只用于运维查询，不参与协商决策（决策只看账本）。
 */
public interface NegotiationRunRepository {

    void create(String runId, String role, Instant createdAt);

    void updateServiceId(String runId, String serviceId);

    /**
     * 按 (runId, seq) 插入或覆盖一条步骤记录。
     */
    void saveStep(String runId, NegotiationStepRecord step);

    void finish(String runId, String outcome, String failedStep, String errorType, String errorMessage,
                String federatedHost, Instant finishedAt);

    /**
     * @return 带完整时间线的记录
     */
    Optional<NegotiationRunRecord> find(String runId);

    List<NegotiationRunRecord> listRecent(int limit);
}
