package com.work.federation.negotiation;

import com.work.federation.core.exception.LifecycleViolationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LifecycleObserverTest {

    @Test
    public void repeated_reads_do_not_change_history() {
        LifecycleObserver observer = new LifecycleObserver("service1");
        assertNull(observer.current());

        assertTrue(observer.observe(ServiceState.OPEN));
        assertFalse(observer.observe(ServiceState.OPEN));
        assertTrue(observer.observe(ServiceState.CLOSED));

        assertEquals(Arrays.asList(ServiceState.OPEN, ServiceState.CLOSED), observer.history());
    }

    @Test
    public void missed_intermediate_state_is_allowed() {
        LifecycleObserver observer = new LifecycleObserver("service1");
        observer.observe(ServiceState.OPEN);

        assertTrue(observer.observe(ServiceState.DEPLOYED));
        assertEquals(ServiceState.DEPLOYED, observer.current());
    }

    @Test
    public void going_backwards_is_a_violation() {
        LifecycleObserver observer = new LifecycleObserver("service1");
        observer.observe(ServiceState.CLOSED);

        assertThrows(LifecycleViolationException.class, () -> observer.observe(ServiceState.OPEN));
        assertEquals(ServiceState.CLOSED, observer.current());
    }
}
