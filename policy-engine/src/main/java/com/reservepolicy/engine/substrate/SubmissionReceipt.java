package com.reservepolicy.engine.substrate;

import com.reservepolicy.common.event.GovernanceEvent;

import java.util.List;

/**
 * Result of a committed submission.
 *
 * @param results     return value of each engine call, in call order (may contain nulls)
 * @param events      events staged by the calls, now published
 * @param committedAt engine time shared by every call in the submission
 * @param slot        engine slot shared by every call in the submission
 */
public record SubmissionReceipt(List<Object> results, List<GovernanceEvent> events,
                                long committedAt, long slot) {

    @SuppressWarnings("unchecked")
    public <T> T result(int callIndex) {
        return (T) results.get(callIndex);
    }
}
