package com.work.federation.orchestrator;

import com.work.federation.core.metrics.FederationMetrics;
import com.work.federation.core.metrics.NoopFederationMetrics;
import com.work.federation.repository.NegotiationRunRepository;
import com.work.federation.repository.NegotiationStepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * 在有界工作线程池上执行协商运行。
 * <p>
 * 请求在调用线程上同步校验（非法输入直接抛出，不产生运行记录）；每次运行独占一个 NegotiationSession，
 * 时间线经由 listener 写入 NegotiationRunRepository，结束时落库结局并上报指标。
 */
public class NegotiationRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NegotiationRunner.class);

    private final ConsumerOrchestrator consumerOrchestrator;
    private final ProviderOrchestrator providerOrchestrator;
    private final NegotiationRunRepository runRepository;
    private final ActiveNegotiationRegistry activeRegistry;
    private final FederationMetrics metrics;
    private final Clock clock;
    private final ExecutorService executor;

    public NegotiationRunner(ConsumerOrchestrator consumerOrchestrator,
                             ProviderOrchestrator providerOrchestrator,
                             NegotiationRunRepository runRepository,
                             ActiveNegotiationRegistry activeRegistry,
                             FederationMetrics metrics,
                             Clock clock,
                             int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        this.consumerOrchestrator = requireNonNull(consumerOrchestrator, "consumerOrchestrator");
        this.providerOrchestrator = requireNonNull(providerOrchestrator, "providerOrchestrator");
        this.runRepository = requireNonNull(runRepository, "runRepository");
        this.activeRegistry = requireNonNull(activeRegistry, "activeRegistry");
        this.metrics = metrics == null ? new NoopFederationMetrics() : metrics;
        this.clock = requireNonNull(clock, "clock");
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("negotiation-worker-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(workers, tf);
    }

    public NegotiationHandle startConsumer(ConsumerRequest request) {
        requireNonNull(request, "request").validate();
        return start(NegotiationRole.CONSUMER, session -> consumerOrchestrator.run(session, request));
    }

    public NegotiationHandle startProvider(ProviderRequest request) {
        requireNonNull(request, "request").validate();
        return start(NegotiationRole.PROVIDER, session -> providerOrchestrator.run(session, request));
    }

    /**
     * @return false 表示该运行不在本进程中执行（已结束或不存在）
     */
    public boolean cancel(String runId) {
        return activeRegistry.find(runId).map(session -> {
            log.info("[federation] cancel requested run={} step={}", runId, session.getCurrentStep());
            session.cancel();
            return true;
        }).orElse(false);
    }

    public ActiveNegotiationRegistry getActiveRegistry() {
        return activeRegistry;
    }

    private NegotiationHandle start(NegotiationRole role, Function<NegotiationSession, NegotiationResult> body) {
        String runId = UUID.randomUUID().toString();
        NegotiationSession session = new NegotiationSession(runId, role, clock, new PersistingListener());
        runRepository.create(runId, role.name(), clock.instant());
        activeRegistry.register(session);
        Future<NegotiationResult> future;
        try {
            future = executor.submit(() -> execute(session, body));
        } catch (RejectedExecutionException e) {
            activeRegistry.remove(runId);
            runRepository.finish(runId, NegotiationOutcome.FAILED.name(), null, e.getClass().getSimpleName(),
                    "negotiation runner is shut down", null, clock.instant());
            throw e;
        }
        log.info("[federation] run={} role={} submitted", runId, role);
        return new NegotiationHandle(runId, future);
    }

    NegotiationResult execute(NegotiationSession session, Function<NegotiationSession, NegotiationResult> body) {
        String runId = session.getRunId();
        session.bindRunner(Thread.currentThread());
        NegotiationResult result;
        try {
            result = body.apply(session);
        } catch (RuntimeException e) {
            result = NegotiationResult.fromFailure(session, e);
            log.warn("[federation] run={} role={} ended outcome={} step={} error={}: {}", runId, session.getRole(),
                    result.getOutcome(), result.getFailedStep(), result.getErrorType(), result.getErrorMessage());
        } finally {
            session.unbindRunner();
            // 取消时的中断标记不能泄漏到下一次运行
            Thread.interrupted();
        }
        try {
            recordOutcome(result);
        } finally {
            activeRegistry.remove(runId);
        }
        return result;
    }

    private void recordOutcome(NegotiationResult result) {
        String role = result.getRole().name().toLowerCase(Locale.ROOT);
        metrics.negotiationFinished(role, result.getOutcome().name());
        log.info("[federation] run={} role={} serviceId={} outcome={} federatedHost={}", result.getRunId(), role,
                result.getServiceId(), result.getOutcome(), result.getFederatedHost());
        try {
            runRepository.finish(result.getRunId(), result.getOutcome().name(),
                    result.getFailedStep() == null ? null : result.getFailedStep().name(),
                    result.getErrorType(), result.getErrorMessage(), result.getFederatedHost(), clock.instant());
        } catch (RuntimeException e) {
            log.error("[federation] failed to persist outcome run={} outcome={}", result.getRunId(), result.getOutcome(), e);
        }
    }

    @Override
    public void close() {
        for (NegotiationSession session : activeRegistry.snapshot()) {
            session.cancel();
        }
        executor.shutdownNow();
    }

    /**
     * 把会话事件写入运行记录；写库失败由 NegotiationSession 记录日志，不影响协商。
     */
    private class PersistingListener implements NegotiationListener {

        @Override
        public void onStep(NegotiationSession session, StepMark mark) {
            List<StepMark> timeline = session.getTimeline();
            int seq = timeline.indexOf(mark);
            runRepository.saveStep(session.getRunId(), new NegotiationStepRecord(seq, mark.getStep().name(),
                    mark.getStatus().name(), mark.getStartedAt(), mark.getFinishedAt(), mark.getDetail()));
        }

        @Override
        public void onServiceId(NegotiationSession session, String serviceId) {
            runRepository.updateServiceId(session.getRunId(), serviceId);
        }
    }
}
