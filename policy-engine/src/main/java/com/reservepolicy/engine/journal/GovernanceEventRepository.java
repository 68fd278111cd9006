package com.reservepolicy.engine.journal;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface GovernanceEventRepository extends ReactiveCrudRepository<GovernanceEventRecord, Long> {

    Flux<GovernanceEventRecord> findByProposalIdOrderByIdAsc(Long proposalId);

    Flux<GovernanceEventRecord> findByEventTypeOrderByIdDesc(String eventType);

    @Query("""
        SELECT * FROM governance_events
        ORDER BY id DESC
        LIMIT :limit
        """)
    Flux<GovernanceEventRecord> findRecent(int limit);
}
