package com.work.federation.repository.impl;

import com.work.federation.repository.NegotiationRunRecord;
import com.work.federation.repository.NegotiationRunRepository;
import com.work.federation.repository.NegotiationStepRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;

/**
 * 进程内运行记录存储，用于本地运行与测试（federation.storage=memory）。
 */
public class InMemoryNegotiationRunRepository implements NegotiationRunRepository {

    private static final String RUNNING = "RUNNING";

    private final Map<String, Entry> runs = new ConcurrentHashMap<>();

    private static final class Entry {
        final NegotiationRunRecord record = new NegotiationRunRecord();
        final TreeMap<Integer, NegotiationStepRecord> steps = new TreeMap<>();
    }

    @Override
    public void create(String runId, String role, Instant createdAt) {
        requireNonEmpty(runId, "runId");
        Entry entry = new Entry();
        entry.record.setRunId(runId);
        entry.record.setRole(role);
        entry.record.setOutcome(RUNNING);
        entry.record.setCreatedAt(createdAt);
        runs.putIfAbsent(runId, entry);
    }

    @Override
    public void updateServiceId(String runId, String serviceId) {
        Entry entry = runs.get(runId);
        if (entry != null) {
            synchronized (entry) {
                entry.record.setServiceId(serviceId);
            }
        }
    }

    @Override
    public void saveStep(String runId, NegotiationStepRecord step) {
        Entry entry = runs.get(runId);
        if (entry != null) {
            synchronized (entry) {
                entry.steps.put(step.getSeq(), step);
            }
        }
    }

    @Override
    public void finish(String runId, String outcome, String failedStep, String errorType, String errorMessage,
                       String federatedHost, Instant finishedAt) {
        Entry entry = runs.get(runId);
        if (entry == null) {
            return;
        }
        synchronized (entry) {
            if (!RUNNING.equals(entry.record.getOutcome())) {
                return;
            }
            entry.record.setOutcome(outcome);
            entry.record.setFailedStep(failedStep);
            entry.record.setErrorType(errorType);
            entry.record.setErrorMessage(errorMessage);
            entry.record.setFederatedHost(federatedHost);
            entry.record.setFinishedAt(finishedAt);
        }
    }

    @Override
    public Optional<NegotiationRunRecord> find(String runId) {
        Entry entry = runs.get(runId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            NegotiationRunRecord copy = copyOf(entry.record);
            copy.setSteps(new ArrayList<>(entry.steps.values()));
            return Optional.of(copy);
        }
    }

    @Override
    public List<NegotiationRunRecord> listRecent(int limit) {
        List<NegotiationRunRecord> all = new ArrayList<>();
        for (Entry entry : runs.values()) {
            synchronized (entry) {
                all.add(copyOf(entry.record));
            }
        }
        all.sort(Comparator.comparing(NegotiationRunRecord::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return all.size() > limit ? new ArrayList<>(all.subList(0, limit)) : all;
    }

    private NegotiationRunRecord copyOf(NegotiationRunRecord source) {
        NegotiationRunRecord copy = new NegotiationRunRecord();
        copy.setRunId(source.getRunId());
        copy.setRole(source.getRole());
        copy.setServiceId(source.getServiceId());
        copy.setOutcome(source.getOutcome());
        copy.setFailedStep(source.getFailedStep());
        copy.setErrorType(source.getErrorType());
        copy.setErrorMessage(source.getErrorMessage());
        copy.setFederatedHost(source.getFederatedHost());
        copy.setCreatedAt(source.getCreatedAt());
        copy.setFinishedAt(source.getFinishedAt());
        return copy;
    }
}
