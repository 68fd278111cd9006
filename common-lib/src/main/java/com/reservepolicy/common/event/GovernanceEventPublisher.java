package com.reservepolicy.common.event;

import java.util.List;

/**
 * Abstraction for publishing {@link GovernanceEvent}s after a submission commits.
 *
 * <p>Current implementation: {@code JournalGovernanceEventPublisher}, which appends the
 * events to the R2DBC governance journal (fire-and-forget).
 *
 * <p>Implementations MUST be non-blocking and MUST NOT throw: the submission has
 * already committed when they are called, so a publishing failure cannot and must
 * not undo it.
 */
public interface GovernanceEventPublisher {

    void publish(List<GovernanceEvent> events);
}
