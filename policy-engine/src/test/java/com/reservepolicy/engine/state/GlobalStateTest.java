package com.reservepolicy.engine.state;

import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.common.model.ConfigParameter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GlobalStateTest {

    private static GlobalState withCounter(long counter) {
        GlobalState state = new GlobalState("auth", "oracle", "settle", "vault", "mint",
            0L, 0L, counter);
        state.applyConfig(86_400, 1_000, 50, 15_000, 12_000);
        return state;
    }

    @Test
    @DisplayName("ids are the counter value before the increment")
    void allocatesSequentially() {
        GlobalState state = withCounter(41);
        assertEquals(41L, state.allocateProposalId());
        assertEquals(42L, state.allocateProposalId());
        assertEquals(43L, state.getProposalCounter());
    }

    @Test
    @DisplayName("counter at Long.MAX_VALUE → COUNTER_OVERFLOW, counter unchanged")
    void counterOverflow() {
        GlobalState state = withCounter(Long.MAX_VALUE);

        PolicyEngineException ex = assertThrows(PolicyEngineException.class, state::allocateProposalId);
        assertEquals(PolicyError.COUNTER_OVERFLOW, ex.getError());
        assertEquals(Long.MAX_VALUE, state.getProposalCounter());
    }

    @Test
    @DisplayName("single-parameter update keeps warning above critical")
    void parameterCrossCheck() {
        GlobalState state = withCounter(0);

        PolicyEngineException ex = assertThrows(PolicyEngineException.class,
            () -> state.applyParameter(ConfigParameter.VHR_CRITICAL_BPS, 15_000));
        assertEquals(PolicyError.INVALID_VHR_THRESHOLD, ex.getError());

        state.applyParameter(ConfigParameter.VHR_CRITICAL_BPS, 14_000);
        assertEquals(14_000L, state.configValue(ConfigParameter.VHR_CRITICAL_BPS));
    }

    @Test
    @DisplayName("copy() is detached from the original")
    void copyIsDetached() {
        GlobalState state = withCounter(5);
        GlobalState copy = state.copy();
        copy.allocateProposalId();
        copy.setBreaker(copy.getBreaker().requested(100));

        assertEquals(5L, state.getProposalCounter());
        assertFalse(state.getBreaker().isActive());
        assertEquals(com.reservepolicy.common.model.BreakerPhase.IDLE, state.getBreaker().phase());
    }
}
