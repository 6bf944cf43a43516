package com.work.federation.orchestrator;

import com.work.federation.core.exception.LedgerUnavailableException;
import com.work.federation.core.support.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

import static com.work.federation.core.support.ValidationUtils.requireNonNull;
import static com.work.federation.core.support.ValidationUtils.requirePositive;

/**
 * 可取消、带截止时间的轮询：间隔从 initial 开始按 2 倍增长，封顶 max。
 * <p>
 * condition 抛出的异常原样向上传播。账本不可用的重试已在 {@link com.work.federation.ledger.LedgerClient} 内完成，
 * 到这里说明当前步骤已经无法继续。
 */
public class PollingSupport {

    private static final Logger log = LoggerFactory.getLogger(PollingSupport.class);

    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration initial;
    private final Duration max;

    public PollingSupport(Clock clock, Sleeper sleeper, Duration initial, Duration max) {
        this.clock = requireNonNull(clock, "clock");
        this.sleeper = requireNonNull(sleeper, "sleeper");
        this.initial = requirePositive(initial, "initial");
        this.max = requirePositive(max, "max");
    }

    /**
     * 反复调用 condition 直到返回非空值。
     *
     * @throws NegotiationTimeoutException   超过 timeout 仍未等到
     * @throws NegotiationCancelledException 会话被取消或线程被中断
     * @throws LedgerUnavailableException    condition 访问账本失败
     */
    public <T> T await(NegotiationSession session, NegotiationStep step, Duration timeout, Supplier<Optional<T>> condition) {
        requirePositive(timeout, "timeout");
        Instant deadline = clock.instant().plus(timeout);
        Duration delay = initial;
        int rounds = 0;
        while (true) {
            session.checkCancelled(step);
            rounds++;
            Optional<T> value = condition.get();
            if (value.isPresent()) {
                log.debug("[federation] run={} step={} satisfied after {} polls", session.getRunId(), step, rounds);
                return value.get();
            }
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                throw new NegotiationTimeoutException(step, timeout);
            }
            Duration remaining = Duration.between(now, deadline);
            Duration wait = delay.compareTo(remaining) < 0 ? delay : remaining;
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NegotiationCancelledException(step);
            }
            Duration doubled = delay.multipliedBy(2);
            delay = doubled.compareTo(max) > 0 ? max : doubled;
        }
    }
}
