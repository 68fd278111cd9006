package com.reservepolicy.engine.controller;

import com.reservepolicy.common.event.GovernanceEvent;
import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.engine.journal.GovernanceJournalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/v1/journal")
public class JournalController {

    private static final Logger log = LoggerFactory.getLogger(JournalController.class);

    private final GovernanceJournalService journal;

    public JournalController(GovernanceJournalService journal) {
        this.journal = journal;
    }

    @GetMapping("/events")
    public Flux<GovernanceEvent> recent(@RequestParam(defaultValue = "50") int limit,
                                        @RequestParam(required = false) GovernanceEventType type) {
        log.info("Journal query received. limit={} type={}", limit, type);
        return type == null ? journal.recent(limit) : journal.byType(type).take(Math.max(1, limit));
    }

    @GetMapping("/proposals/{id}")
    public Flux<GovernanceEvent> forProposal(@PathVariable long id) {
        log.info("Journal query received. proposal={}", id);
        return journal.forProposal(id);
    }
}
