package com.reservepolicy.engine.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reservepolicy.common.event.GovernanceEvent;
import com.reservepolicy.common.event.GovernanceEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Journal-backed {@link GovernanceEventPublisher}.
 *
 * <p>Appends committed events to {@code governance_events} through R2DBC,
 * fire-and-forget. Every batch goes through one sink drained with
 * {@code concatMap}, so rows are written one at a time in the order the
 * substrate hands batches over, which is commit order. A failed journal write
 * is logged and skipped; it never reaches the engine, whose state is already
 * committed.
 */
@Component
public class JournalGovernanceEventPublisher implements GovernanceEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JournalGovernanceEventPublisher.class);

    private final GovernanceEventRepository repository;
    private final ObjectMapper objectMapper;

    private final Sinks.Many<GovernanceEvent> journalSink =
        Sinks.many().unicast().onBackpressureBuffer();

    public JournalGovernanceEventPublisher(GovernanceEventRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        journalSink.asFlux()
            .concatMap(this::append)
            .subscribe(saved -> log.debug("Governance event journaled. id={} type={} proposal={}",
                                          saved.getId(), saved.getEventType(), saved.getProposalId()));
    }

    @Override
    public void publish(List<GovernanceEvent> events) {
        for (GovernanceEvent event : events) {
            Sinks.EmitResult result = journalSink.tryEmitNext(event);
            if (result.isFailure()) {
                log.warn("Governance event dropped from journal. type={} proposal={} result={}",
                         event.type(), event.proposalId(), result);
            }
        }
    }

    private Mono<GovernanceEventRecord> append(GovernanceEvent event) {
        return Mono.fromCallable(() -> toRecord(event))
            .flatMap(repository::save)
            .onErrorResume(err -> {
                log.warn("Governance journal write failed (non-critical). type={} proposal={}",
                         event.type(), event.proposalId(), err);
                return Mono.empty();
            });
    }

    GovernanceEventRecord toRecord(GovernanceEvent event) {
        GovernanceEventRecord record = new GovernanceEventRecord();
        record.setEventType(event.type().name());
        record.setActor(event.actor());
        record.setProposalId(event.proposalId());
        record.setOccurredAt(event.occurredAt());
        record.setSlot(event.slot());
        record.setAttributes(toJson(event));
        record.setRecordedAt(LocalDateTime.now());
        return record;
    }

    private String toJson(GovernanceEvent event) {
        try {
            return objectMapper.writeValueAsString(event.attributes());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise attributes of " + event.type(), e);
        }
    }
}
