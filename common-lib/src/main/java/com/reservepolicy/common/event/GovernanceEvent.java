package com.reservepolicy.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Immutable record of one committed state change.
 *
 * <p>Events are staged inside a submission and only published after the submission
 * commits, so an aborted call never leaves an event behind.
 *
 * @param type       what happened
 * @param actor      authenticated identity that caused it, or {@code null} for derived events
 * @param proposalId affected proposal, or {@code null}
 * @param occurredAt engine time of the submission, unix seconds
 * @param slot       engine slot of the submission
 * @param attributes event-specific details
 */
public record GovernanceEvent(
    @JsonProperty("type")       GovernanceEventType type,
    @JsonProperty("actor")      String actor,
    @JsonProperty("proposalId") Long proposalId,
    @JsonProperty("occurredAt") long occurredAt,
    @JsonProperty("slot")       long slot,
    @JsonProperty("attributes") Map<String, Object> attributes
) {
    public GovernanceEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
