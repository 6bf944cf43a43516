package com.work.federation.core.support;

import java.time.Duration;

/**
 * 可替换的等待动作，便于在单元测试中跳过真实 sleep。
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(Math.max(0L, duration.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
