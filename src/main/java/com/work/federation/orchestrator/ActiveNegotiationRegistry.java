package com.work.federation.orchestrator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

/**
 * 本进程内正在执行的协商会话。用于取消与注销前的在途检查。
 */
public class ActiveNegotiationRegistry {

    private final Map<String, NegotiationSession> sessions = new ConcurrentHashMap<>();

    /** 新会话登记与 {@link #exclusive} 互斥 */
    private final Object guard = new Object();

    public void register(NegotiationSession session) {
        synchronized (guard) {
            if (sessions.putIfAbsent(session.getRunId(), session) != null) {
                throw new IllegalStateException("runId 已存在: " + session.getRunId());
            }
        }
    }

    public void remove(String runId) {
        sessions.remove(runId);
    }

    public Optional<NegotiationSession> find(String runId) {
        return Optional.ofNullable(sessions.get(runId));
    }

    public int activeCount() {
        return sessions.size();
    }

    public boolean hasActive() {
        return !sessions.isEmpty();
    }

    public Collection<NegotiationSession> snapshot() {
        return new ArrayList<>(sessions.values());
    }

    /**
     * 在阻止新会话登记的前提下执行 action，入参为此刻的在途数量。
     * <p>
     * action 返回（或抛出）之前，{@link #register} 会一直等待。已在途的会话仍可正常结束。
     */
    public <T> T exclusive(IntFunction<T> action) {
        synchronized (guard) {
            return action.apply(sessions.size());
        }
    }
}
