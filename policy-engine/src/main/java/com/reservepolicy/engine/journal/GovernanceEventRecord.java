package com.reservepolicy.engine.journal;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Journal row for one committed governance event.
 *
 * Column mapping (R2DBC snake_case convention):
 *   eventType  → event_type
 *   proposalId → proposal_id
 *   occurredAt → occurred_at   (engine time, unix seconds)
 *   recordedAt → recorded_at   (wall clock of the journal write)
 *
 * attributes: JSON-serialised Map&lt;String, Object&gt;
 */
@Data
@NoArgsConstructor
@Table("governance_events")
public class GovernanceEventRecord {

    @Id
    private Long id;

    private String eventType;

    private String actor;

    private Long proposalId;

    private Long occurredAt;

    private Long slot;

    /** JSON-serialised {@code Map<String, Object>} */
    private String attributes;

    private LocalDateTime recordedAt;
}
