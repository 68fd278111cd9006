package com.reservepolicy.engine.controller;

import com.reservepolicy.common.model.ProposalStatus;
import com.reservepolicy.engine.dto.ConfigUpdateRequest;
import com.reservepolicy.engine.dto.CreateProposalRequest;
import com.reservepolicy.engine.dto.InitializeRequest;
import com.reservepolicy.engine.dto.ProposalView;
import com.reservepolicy.engine.dto.ProtocolView;
import com.reservepolicy.engine.dto.SignedRequest;
import com.reservepolicy.engine.dto.VoteRequest;
import com.reservepolicy.engine.dto.VoteView;
import com.reservepolicy.engine.governance.VoteSettlement;
import com.reservepolicy.engine.service.PolicyCommandService;
import com.reservepolicy.engine.service.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/governance")
public class GovernanceController {

    private static final Logger log = LoggerFactory.getLogger(GovernanceController.class);

    private final PolicyCommandService commands;
    private final PolicyEngine engine;

    public GovernanceController(PolicyCommandService commands, PolicyEngine engine) {
        this.commands = commands;
        this.engine   = engine;
    }

    @PostMapping("/initialize")
    public Mono<ResponseEntity<ProtocolView>> initialize(@RequestBody InitializeRequest request) {
        log.info("Initialize request received. vault={} mint={}", request.reserveVault(), request.tokenMint());
        return commands.initialize(request)
            .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
    }

    @PutMapping("/config")
    public Mono<ResponseEntity<ProtocolView>> updateConfig(@RequestBody ConfigUpdateRequest request) {
        log.info("Config update request received");
        return commands.updateConfig(request).map(ResponseEntity::ok);
    }

    @GetMapping("/protocol")
    public Mono<ResponseEntity<ProtocolView>> protocol() {
        return Mono.fromCallable(() -> ProtocolView.from(engine.globalState()))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/proposals")
    public Mono<ResponseEntity<ProposalView>> createProposal(@RequestBody CreateProposalRequest request) {
        log.info("Create proposal request received. type={} period={}s",
                 request.params() == null ? null : request.params().policyType(), request.votingPeriodSeconds());
        return commands.createProposal(request)
            .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
    }

    @GetMapping("/proposals")
    public Flux<ProposalView> proposals(@RequestParam(required = false) ProposalStatus status) {
        return Flux.defer(() -> Flux.fromIterable(engine.proposals(status)))
            .map(ProposalView::from);
    }

    @GetMapping("/proposals/{id}")
    public Mono<ResponseEntity<ProposalView>> proposal(@PathVariable long id) {
        return Mono.fromCallable(() -> ProposalView.from(engine.proposal(id)))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/proposals/{id}/votes")
    public Mono<ResponseEntity<VoteView>> vote(@PathVariable long id, @RequestBody VoteRequest request) {
        log.info("Vote request received. proposal={} prediction={} stake={}",
                 id, request.prediction(), request.stakeAmount());
        return commands.vote(id, request)
            .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
    }

    @GetMapping("/proposals/{id}/votes")
    public Flux<VoteSettlement> votes(@PathVariable long id) {
        return Flux.defer(() -> Flux.fromIterable(engine.settlements(id)));
    }

    @GetMapping("/proposals/{id}/votes/{agent}")
    public Mono<ResponseEntity<VoteSettlement>> vote(@PathVariable long id, @PathVariable String agent) {
        return Mono.fromCallable(() -> engine.settlement(id, agent))
            .map(found -> found.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PostMapping("/proposals/{id}/votes/{agent}/claim")
    public Mono<ResponseEntity<VoteSettlement>> markClaimed(@PathVariable long id, @PathVariable String agent,
                                                            @RequestBody SignedRequest request) {
        log.info("Claim request received. proposal={} voter={}", id, agent);
        return commands.markClaimed(id, agent, request.auth()).map(ResponseEntity::ok);
    }

    @PostMapping("/proposals/{id}/finalize")
    public Mono<ResponseEntity<ProposalView>> finalizeProposal(@PathVariable long id, @RequestBody SignedRequest request) {
        log.info("Finalize request received. proposal={}", id);
        return commands.finalizeProposal(id, request.auth()).map(ResponseEntity::ok);
    }

    @PostMapping("/proposals/{id}/execute")
    public Mono<ResponseEntity<ProposalView>> execute(@PathVariable long id, @RequestBody SignedRequest request) {
        log.info("Execute request received. proposal={}", id);
        return commands.execute(id, request.auth()).map(ResponseEntity::ok);
    }

    @PostMapping("/proposals/{id}/cancel")
    public Mono<ResponseEntity<ProposalView>> cancel(@PathVariable long id, @RequestBody SignedRequest request) {
        log.info("Cancel request received. proposal={}", id);
        return commands.cancel(id, request.auth()).map(ResponseEntity::ok);
    }
}
