package com.work.federation.orchestrator;

import com.work.federation.core.exception.LedgerUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PollingSupportTest {

    /**
     * sleep 时把时间往前拨，测试不真正等待。
     */
    private static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final ManualClock clock = new ManualClock();
    private final List<Duration> sleeps = new ArrayList<>();
    private final PollingSupport polling = new PollingSupport(clock, d -> {
        sleeps.add(d);
        clock.advance(d);
    }, Duration.ofMillis(100), Duration.ofMillis(400));

    private NegotiationSession session() {
        return new NegotiationSession("run-1", NegotiationRole.CONSUMER, clock, null);
    }

    @Test
    public void interval_doubles_up_to_the_cap() {
        AtomicInteger calls = new AtomicInteger();

        String value = polling.await(session(), NegotiationStep.AWAIT_BIDS, Duration.ofMinutes(1),
                () -> calls.incrementAndGet() < 6 ? Optional.empty() : Optional.of("done"));

        assertEquals("done", value);
        assertEquals(Arrays.asList(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400),
                Duration.ofMillis(400), Duration.ofMillis(400)), sleeps);
    }

    @Test
    public void deadline_turns_into_timeout_for_the_step() {
        NegotiationTimeoutException e = assertThrows(NegotiationTimeoutException.class,
                () -> polling.await(session(), NegotiationStep.AWAIT_DEPLOYMENT, Duration.ofMillis(250),
                        Optional::empty));

        assertEquals(NegotiationStep.AWAIT_DEPLOYMENT, e.getStep());
        // 最后一次等待被截断到剩余时间
        assertEquals(Arrays.asList(Duration.ofMillis(100), Duration.ofMillis(150)), sleeps);
    }

    @Test
    public void unavailable_ledger_reaches_the_caller_without_waiting_for_the_deadline() {
        AtomicInteger calls = new AtomicInteger();
        LedgerUnavailableException outage = new LedgerUnavailableException("connection refused");

        LedgerUnavailableException e = assertThrows(LedgerUnavailableException.class,
                () -> polling.await(session(), NegotiationStep.AWAIT_DEPLOYMENT, Duration.ofMinutes(15), () -> {
                    if (calls.incrementAndGet() == 2) {
                        throw outage;
                    }
                    return Optional.empty();
                }));

        assertSame(outage, e);
        assertEquals(2, calls.get());
        assertEquals(Collections.singletonList(Duration.ofMillis(100)), sleeps);
    }

    @Test
    public void other_errors_propagate_immediately() {
        assertThrows(IllegalStateException.class, () -> polling.await(session(), NegotiationStep.AWAIT_CLOSURE,
                Duration.ofSeconds(5), () -> {
                    throw new IllegalStateException("bug");
                }));
        assertEquals(0, sleeps.size());
    }

    @Test
    public void cancelled_session_stops_polling() {
        NegotiationSession session = session();
        AtomicInteger calls = new AtomicInteger();

        NegotiationCancelledException e = assertThrows(NegotiationCancelledException.class,
                () -> polling.await(session, NegotiationStep.DISCOVER, Duration.ofMinutes(1), () -> {
                    if (calls.incrementAndGet() == 2) {
                        session.cancel();
                    }
                    return Optional.empty();
                }));

        assertEquals(NegotiationStep.DISCOVER, e.getStep());
        assertEquals(2, calls.get());
    }
}
