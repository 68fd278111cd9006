package com.reservepolicy.engine.substrate;

import java.util.List;

/**
 * Ordered steps committed or discarded as a unit.
 */
public record Submission(List<SubmissionStep> steps) {

    public Submission {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("a submission needs at least one step");
        }
        steps = List.copyOf(steps);
    }

    public static Submission of(SubmissionStep... steps) {
        return new Submission(List.of(steps));
    }
}
