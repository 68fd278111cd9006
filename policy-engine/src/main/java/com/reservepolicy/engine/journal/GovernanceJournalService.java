package com.reservepolicy.engine.journal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reservepolicy.common.event.GovernanceEvent;
import com.reservepolicy.common.event.GovernanceEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@Service
public class GovernanceJournalService {

    private static final Logger log = LoggerFactory.getLogger(GovernanceJournalService.class);

    static final int MAX_LIMIT = 500;

    private final GovernanceEventRepository repository;
    private final ObjectMapper objectMapper;

    public GovernanceJournalService(GovernanceEventRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    public Flux<GovernanceEvent> recent(int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return repository.findRecent(bounded)
            .flatMapSequential(this::toEvent)
            .doOnError(e -> log.error("Failed to read recent journal entries. limit={}", bounded, e));
    }

    public Flux<GovernanceEvent> forProposal(long proposalId) {
        return repository.findByProposalIdOrderByIdAsc(proposalId)
            .flatMapSequential(this::toEvent)
            .doOnError(e -> log.error("Failed to read journal for proposal. id={}", proposalId, e));
    }

    public Flux<GovernanceEvent> byType(GovernanceEventType type) {
        return repository.findByEventTypeOrderByIdDesc(type.name())
            .flatMapSequential(this::toEvent);
    }

    private Mono<GovernanceEvent> toEvent(GovernanceEventRecord record) {
        return Mono.fromCallable(() -> new GovernanceEvent(
            GovernanceEventType.valueOf(record.getEventType()),
            record.getActor(),
            record.getProposalId(),
            record.getOccurredAt() == null ? 0L : record.getOccurredAt(),
            record.getSlot() == null ? 0L : record.getSlot(),
            record.getAttributes() == null
                ? Map.of()
                : objectMapper.readValue(record.getAttributes(), new TypeReference<Map<String, Object>>() {})));
    }
}
