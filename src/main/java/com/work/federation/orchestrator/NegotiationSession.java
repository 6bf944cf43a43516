package com.work.federation.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * 一次协商运行的全部会话状态：服务 id、当前步骤、时间线、取消标记。
 * <p>
 * 由执行该运行的单个线程推进；cancel 与查询可以来自其他线程。
 */
public class NegotiationSession {

    private static final Logger log = LoggerFactory.getLogger(NegotiationSession.class);

    @FunctionalInterface
    public interface StepAction<T> {
        T run();
    }

    private final String runId;
    private final NegotiationRole role;
    private final Clock clock;
    private final NegotiationListener listener;
    private final List<StepMark> timeline = new CopyOnWriteArrayList<>();

    private volatile String serviceId;
    private volatile NegotiationStep currentStep;
    private volatile boolean cancelled;
    private volatile Thread runner;

    public NegotiationSession(String runId, NegotiationRole role, Clock clock, NegotiationListener listener) {
        this.runId = requireNonEmpty(runId, "runId");
        this.role = requireNonNull(role, "role");
        this.clock = requireNonNull(clock, "clock");
        this.listener = listener == null ? NegotiationListener.NOOP : listener;
    }

    /**
     * 执行一个步骤并记录到时间线。超时与取消原样抛出，其余错误包装为 NegotiationFailedException。
     */
    public <T> T step(NegotiationStep step, StepAction<T> action) {
        checkCancelled(step);
        StepMark mark = new StepMark(step, clock.instant());
        timeline.add(mark);
        currentStep = step;
        notifyStep(mark);
        log.info("[federation] run={} step={} started serviceId={}", runId, step, serviceId);
        try {
            T result = action.run();
            mark.finish(clock.instant(), StepMark.Status.DONE, null);
            notifyStep(mark);
            return result;
        } catch (NegotiationTimeoutException | NegotiationCancelledException | NegotiationFailedException e) {
            mark.finish(clock.instant(), StepMark.Status.FAILED, e.getMessage());
            notifyStep(mark);
            throw e;
        } catch (RuntimeException e) {
            mark.finish(clock.instant(), StepMark.Status.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
            notifyStep(mark);
            throw new NegotiationFailedException(step, e);
        }
    }

    public void execute(NegotiationStep step, Runnable action) {
        step(step, () -> {
            action.run();
            return null;
        });
    }

    public void checkCancelled(NegotiationStep step) {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new NegotiationCancelledException(step);
        }
    }

    /**
     * 请求取消：设置标记并中断执行线程，使阻塞中的等待尽快返回。
     */
    public void cancel() {
        cancelled = true;
        Thread t = runner;
        if (t != null) {
            t.interrupt();
        }
    }

    void bindRunner(Thread thread) {
        this.runner = thread;
    }

    void unbindRunner() {
        this.runner = null;
    }

    public void setServiceId(String serviceId) {
        this.serviceId = serviceId;
        try {
            listener.onServiceId(this, serviceId);
        } catch (RuntimeException e) {
            log.warn("[federation] listener onServiceId failed run={} serviceId={}", runId, serviceId, e);
        }
    }

    private void notifyStep(StepMark mark) {
        try {
            listener.onStep(this, mark);
        } catch (RuntimeException e) {
            log.warn("[federation] listener onStep failed run={} step={}", runId, mark.getStep(), e);
        }
    }

    public String getRunId() {
        return runId;
    }

    public NegotiationRole getRole() {
        return role;
    }

    public String getServiceId() {
        return serviceId;
    }

    public NegotiationStep getCurrentStep() {
        return currentStep;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Clock getClock() {
        return clock;
    }

    public List<StepMark> getTimeline() {
        return new ArrayList<>(timeline);
    }
}
