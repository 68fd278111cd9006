package com.reservepolicy.engine.substrate;

import java.util.List;
import java.util.Optional;

/**
 * What an engine call sees while it runs: its position in the submission, the
 * staged ledger, and the submission's single time/slot reading.
 */
public final class InvocationContext {

    private final List<SubmissionStep> steps;
    private final int index;
    private final LedgerTransaction ledger;

    InvocationContext(List<SubmissionStep> steps, int index, LedgerTransaction ledger) {
        this.steps  = steps;
        this.index  = index;
        this.ledger = ledger;
    }

    /** The step immediately before this call, if any. */
    public Optional<SubmissionStep> precedingStep() {
        return index == 0 ? Optional.empty() : Optional.of(steps.get(index - 1));
    }

    public String callName() {
        return steps.get(index) instanceof EngineCall<?> call ? call.name() : "unknown";
    }

    public LedgerTransaction ledger() {
        return ledger;
    }

    public long now() {
        return ledger.now();
    }

    public long slot() {
        return ledger.slot();
    }
}
