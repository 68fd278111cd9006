package com.reservepolicy.engine.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reservepolicy.common.event.GovernanceEvent;
import com.reservepolicy.common.event.GovernanceEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JournalGovernanceEventPublisherTest {

    private GovernanceEventRepository repository;
    private JournalGovernanceEventPublisher publisher;

    @BeforeEach
    void setUp() {
        repository = mock(GovernanceEventRepository.class);
        publisher  = new JournalGovernanceEventPublisher(repository, new ObjectMapper());
    }

    private static GovernanceEvent event(GovernanceEventType type, Long proposalId) {
        return new GovernanceEvent(type, "agent-a", proposalId, 1_700_000_000L, 1_000L, Map.of("stakeAmount", 75));
    }

    @Test
    @DisplayName("events are saved in commit order with JSON attributes")
    void savesInOrder() {
        when(repository.save(any(GovernanceEventRecord.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        publisher.publish(List.of(
            event(GovernanceEventType.PROPOSAL_CREATED, 3L),
            event(GovernanceEventType.VOTE_RECORDED, 3L)));

        ArgumentCaptor<GovernanceEventRecord> captor = ArgumentCaptor.forClass(GovernanceEventRecord.class);
        verify(repository, times(2)).save(captor.capture());
        List<GovernanceEventRecord> saved = captor.getAllValues();
        assertEquals("PROPOSAL_CREATED", saved.get(0).getEventType());
        assertEquals("VOTE_RECORDED", saved.get(1).getEventType());
        assertEquals(3L, saved.get(1).getProposalId());
        assertEquals("{\"stakeAmount\":75}", saved.get(1).getAttributes());
        assertNotNull(saved.get(1).getRecordedAt());
    }

    @Test
    @DisplayName("journal failure never propagates to the caller")
    void failureIsContained() {
        when(repository.save(any(GovernanceEventRecord.class)))
            .thenReturn(Mono.error(new IllegalStateException("connection refused")));

        assertDoesNotThrow(() -> publisher.publish(List.of(event(GovernanceEventType.HEALTH_SIGNAL, null))));
    }

    @Test
    @DisplayName("a failed write is skipped and later batches are still journaled in order")
    void failureDoesNotStopJournal() {
        when(repository.save(any(GovernanceEventRecord.class)))
            .thenReturn(Mono.error(new IllegalStateException("connection refused")))
            .thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        publisher.publish(List.of(event(GovernanceEventType.HEALTH_SIGNAL, null)));
        publisher.publish(List.of(event(GovernanceEventType.PROPOSAL_CREATED, 4L)));
        publisher.publish(List.of(event(GovernanceEventType.PROPOSAL_CREATED, 5L)));

        ArgumentCaptor<GovernanceEventRecord> captor = ArgumentCaptor.forClass(GovernanceEventRecord.class);
        verify(repository, times(3)).save(captor.capture());
        List<GovernanceEventRecord> saved = captor.getAllValues();
        assertEquals("HEALTH_SIGNAL", saved.get(0).getEventType());
        assertEquals(4L, saved.get(1).getProposalId());
        assertEquals(5L, saved.get(2).getProposalId());
    }

    @Test
    @DisplayName("toRecord copies engine time and slot, not wall clock")
    void toRecord() {
        GovernanceEventRecord record = publisher.toRecord(event(GovernanceEventType.ORACLE_UPDATED, null));

        assertEquals(1_700_000_000L, record.getOccurredAt());
        assertEquals(1_000L, record.getSlot());
        assertNull(record.getProposalId());
        assertNull(record.getId());
    }
}
