package com.work.federation.repository;

import com.work.federation.repository.impl.InMemoryNegotiationRunRepository;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

public class InMemoryNegotiationRunRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    public void step_with_same_seq_is_overwritten() {
        InMemoryNegotiationRunRepository repo = new InMemoryNegotiationRunRepository();
        repo.create("run-1", "CONSUMER", T0);

        repo.saveStep("run-1", new NegotiationStepRecord(0, "ANNOUNCE", "STARTED", T0, null, null));
        repo.saveStep("run-1", new NegotiationStepRecord(1, "AWAIT_BIDS", "STARTED", T0, null, null));
        repo.saveStep("run-1", new NegotiationStepRecord(0, "ANNOUNCE", "DONE", T0, T0.plusSeconds(1), null));

        List<NegotiationStepRecord> steps = repo.find("run-1").orElseThrow(AssertionError::new).getSteps();
        assertEquals(2, steps.size());
        assertEquals("DONE", steps.get(0).getStatus());
        assertEquals("AWAIT_BIDS", steps.get(1).getStep());
    }

    @Test
    public void outcome_is_written_once() {
        InMemoryNegotiationRunRepository repo = new InMemoryNegotiationRunRepository();
        repo.create("run-1", "PROVIDER", T0);
        repo.updateServiceId("run-1", "service1");

        repo.finish("run-1", "NOT_CHOSEN", null, null, null, null, T0.plusSeconds(5));
        repo.finish("run-1", "FAILED", "DEPLOY", "CollaboratorException", "boom", null, T0.plusSeconds(6));

        NegotiationRunRecord record = repo.find("run-1").orElseThrow(AssertionError::new);
        assertEquals("NOT_CHOSEN", record.getOutcome());
        assertEquals("service1", record.getServiceId());
        assertNull(record.getFailedStep());
        assertEquals(T0.plusSeconds(5), record.getFinishedAt());
    }

    @Test
    public void recent_runs_are_newest_first_and_limited() {
        InMemoryNegotiationRunRepository repo = new InMemoryNegotiationRunRepository();
        repo.create("run-1", "CONSUMER", T0);
        repo.create("run-2", "PROVIDER", T0.plusSeconds(10));
        repo.create("run-3", "PROVIDER", T0.plusSeconds(5));

        List<NegotiationRunRecord> recent = repo.listRecent(2);

        assertEquals(2, recent.size());
        assertEquals("run-2", recent.get(0).getRunId());
        assertEquals("run-3", recent.get(1).getRunId());
        assertFalse(repo.find("run-9").isPresent());
    }
}
