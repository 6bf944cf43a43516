package com.work.federation.negotiation;

import com.work.federation.core.exception.LifecycleViolationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 记录单个服务被观察到的状态序列，并拒绝回退。
 * <p>
 * 轮询可能错过中间状态，因此允许向前跳过（OPEN 直接看到 DEPLOYED），但不允许倒退。
 */
public class LifecycleObserver {

    private final String serviceId;
    private final List<ServiceState> observed = new ArrayList<>();

    public LifecycleObserver(String serviceId) {
        this.serviceId = serviceId;
    }

    /**
     * @return true 表示状态发生了变化
     */
    public synchronized boolean observe(ServiceState state) {
        if (state == null) {
            throw new IllegalArgumentException("state 不能为null");
        }
        ServiceState last = current();
        if (last == null) {
            observed.add(state);
            return true;
        }
        if (state == last) {
            return false;
        }
        if (state.ordinal() < last.ordinal()) {
            throw new LifecycleViolationException("服务 " + serviceId + " 状态回退: " + last + " -> " + state);
        }
        observed.add(state);
        return true;
    }

    public synchronized ServiceState current() {
        return observed.isEmpty() ? null : observed.get(observed.size() - 1);
    }

    public synchronized List<ServiceState> history() {
        return Collections.unmodifiableList(new ArrayList<>(observed));
    }

    public String getServiceId() {
        return serviceId;
    }
}
