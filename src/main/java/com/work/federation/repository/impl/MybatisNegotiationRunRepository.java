package com.work.federation.repository.impl;

import com.work.federation.repository.NegotiationRunRecord;
import com.work.federation.repository.NegotiationRunRepository;
import com.work.federation.repository.NegotiationStepRecord;
import com.work.federation.repository.entity.FederationRunEntity;
import com.work.federation.repository.entity.FederationRunStepEntity;
import com.work.federation.repository.mapper.FederationRunMapper;
import com.work.federation.repository.mapper.FederationRunStepMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的运行记录存储（federation.storage=postgres）。
 * <p>
 * 每条语句单独提交：时间线写入失败只影响运维视图，不回滚协商本身。
 */
public class MybatisNegotiationRunRepository implements NegotiationRunRepository {

    private static final Logger log = LoggerFactory.getLogger(MybatisNegotiationRunRepository.class);

    private final FederationRunMapper runMapper;
    private final FederationRunStepMapper stepMapper;

    public MybatisNegotiationRunRepository(FederationRunMapper runMapper, FederationRunStepMapper stepMapper) {
        this.runMapper = requireNonNull(runMapper, "runMapper");
        this.stepMapper = requireNonNull(stepMapper, "stepMapper");
    }

    @Override
    public void create(String runId, String role, Instant createdAt) {
        requireNonEmpty(runId, "runId");
        runMapper.insertRun(runId, role, createdAt);
    }

    @Override
    public void updateServiceId(String runId, String serviceId) {
        runMapper.updateServiceId(runId, serviceId);
    }

    @Override
    public void saveStep(String runId, NegotiationStepRecord step) {
        requireNonNull(step, "step");
        stepMapper.upsertStep(runId, step.getSeq(), step.getStep(), step.getStatus(),
                step.getStartedAt(), step.getFinishedAt(), step.getDetail());
    }

    @Override
    public void finish(String runId, String outcome, String failedStep, String errorType, String errorMessage,
                       String federatedHost, Instant finishedAt) {
        int updated = runMapper.finishRun(runId, outcome, failedStep, errorType, errorMessage, federatedHost, finishedAt);
        if (updated == 0) {
            // 已是终态或记录不存在
            log.warn("[federation] run {} not finished in storage (missing or already terminal), outcome={}",
                    runId, outcome);
        }
    }

    @Override
    public Optional<NegotiationRunRecord> find(String runId) {
        FederationRunEntity entity = runMapper.selectByRunId(runId);
        if (entity == null) {
            return Optional.empty();
        }
        NegotiationRunRecord record = convert(entity);
        List<NegotiationStepRecord> steps = new ArrayList<>();
        for (FederationRunStepEntity stepEntity : stepMapper.listByRunId(runId)) {
            steps.add(new NegotiationStepRecord(stepEntity.getSeq(), stepEntity.getStep(), stepEntity.getStatus(),
                    stepEntity.getStartedAt(), stepEntity.getFinishedAt(), stepEntity.getDetail()));
        }
        record.setSteps(steps);
        return Optional.of(record);
    }

    @Override
    public List<NegotiationRunRecord> listRecent(int limit) {
        List<NegotiationRunRecord> records = new ArrayList<>();
        for (FederationRunEntity entity : runMapper.listRecent(limit)) {
            records.add(convert(entity));
        }
        return records;
    }

    private NegotiationRunRecord convert(FederationRunEntity entity) {
        NegotiationRunRecord record = new NegotiationRunRecord();
        record.setRunId(entity.getRunId());
        record.setRole(entity.getRole());
        record.setServiceId(entity.getServiceId());
        record.setOutcome(entity.getOutcome());
        record.setFailedStep(entity.getFailedStep());
        record.setErrorType(entity.getErrorType());
        record.setErrorMessage(entity.getErrorMessage());
        record.setFederatedHost(entity.getFederatedHost());
        record.setCreatedAt(entity.getCreatedAt());
        record.setFinishedAt(entity.getFinishedAt());
        return record;
    }
}
