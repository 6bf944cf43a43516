package com.work.federation.negotiation;

import com.work.federation.core.exception.LedgerRejectedException;
import org.junit.jupiter.api.Test;

import static com.work.federation.negotiation.ServiceState.CLOSED;
import static com.work.federation.negotiation.ServiceState.DEPLOYED;
import static com.work.federation.negotiation.ServiceState.OPEN;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NegotiationStateMachineTest {

    @Test
    public void only_forward_single_steps_are_legal() {
        assertTrue(NegotiationStateMachine.isLegal(OPEN, CLOSED));
        assertTrue(NegotiationStateMachine.isLegal(CLOSED, DEPLOYED));

        assertFalse(NegotiationStateMachine.isLegal(OPEN, DEPLOYED));
        assertFalse(NegotiationStateMachine.isLegal(CLOSED, OPEN));
        assertFalse(NegotiationStateMachine.isLegal(DEPLOYED, CLOSED));
        assertFalse(NegotiationStateMachine.isLegal(CLOSED, CLOSED));
        assertFalse(NegotiationStateMachine.isLegal(null, OPEN));
    }

    @Test
    public void illegal_transition_is_a_ledger_rejection() {
        LedgerRejectedException e = assertThrows(LedgerRejectedException.class,
                () -> NegotiationStateMachine.requireTransition(CLOSED, CLOSED));

        assertEquals(LedgerRejectedException.Reason.ILLEGAL_TRANSITION, e.getReason());
        assertDoesNotThrow(() -> NegotiationStateMachine.requireTransition(OPEN, CLOSED));
    }

    @Test
    public void bids_and_winner_depend_on_state() {
        assertTrue(NegotiationStateMachine.acceptsBids(OPEN));
        assertFalse(NegotiationStateMachine.acceptsBids(CLOSED));
        assertTrue(NegotiationStateMachine.winnerDecided(CLOSED));
        assertFalse(NegotiationStateMachine.winnerDecided(DEPLOYED));
    }

    @Test
    public void later_states_count_as_reached() {
        assertTrue(NegotiationStateMachine.reached(DEPLOYED, CLOSED));
        assertTrue(NegotiationStateMachine.reached(CLOSED, CLOSED));
        assertFalse(NegotiationStateMachine.reached(OPEN, CLOSED));
        assertFalse(NegotiationStateMachine.reached(null, OPEN));
    }

    @Test
    public void state_codes_round_trip() {
        assertEquals(OPEN, ServiceState.fromCode(0));
        assertEquals(DEPLOYED, ServiceState.fromCode(DEPLOYED.getCode()));
    }
}
