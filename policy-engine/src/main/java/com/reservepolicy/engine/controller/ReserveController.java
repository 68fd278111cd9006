package com.reservepolicy.engine.controller;

import com.reservepolicy.common.health.VaultHealthReport;
import com.reservepolicy.engine.dto.RebalanceRequest;
import com.reservepolicy.engine.dto.ReserveAmountRequest;
import com.reservepolicy.engine.dto.SignedRequest;
import com.reservepolicy.engine.dto.VaultView;
import com.reservepolicy.engine.service.PolicyCommandService;
import com.reservepolicy.engine.service.PolicyEngine;
import com.reservepolicy.engine.state.BreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Reserve vault, its health and the circuit breaker.
 */
@RestController
@RequestMapping("/api/v1/reserve")
public class ReserveController {

    private static final Logger log = LoggerFactory.getLogger(ReserveController.class);

    private final PolicyCommandService commands;
    private final PolicyEngine engine;

    public ReserveController(PolicyCommandService commands, PolicyEngine engine) {
        this.commands = commands;
        this.engine   = engine;
    }

    @GetMapping("/vault")
    public Mono<ResponseEntity<VaultView>> vault() {
        return Mono.fromCallable(() -> VaultView.from(engine.vault())).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<VaultHealthReport>> health() {
        return Mono.fromCallable(engine::health).map(ResponseEntity::ok);
    }

    @PostMapping("/deposit")
    public Mono<ResponseEntity<VaultView>> deposit(@RequestBody ReserveAmountRequest request) {
        log.info("Deposit request received. units={}", request.units());
        return commands.deposit(request).map(ResponseEntity::ok);
    }

    @PostMapping("/withdraw")
    public Mono<ResponseEntity<VaultView>> withdraw(@RequestBody ReserveAmountRequest request) {
        log.info("Withdraw request received. units={}", request.units());
        return commands.withdraw(request).map(ResponseEntity::ok);
    }

    @PostMapping("/rebalance")
    public Mono<ResponseEntity<VaultView>> rebalance(@RequestBody RebalanceRequest request) {
        log.info("Rebalance request received");
        return commands.rebalance(request).map(ResponseEntity::ok);
    }

    @GetMapping("/breaker")
    public Mono<ResponseEntity<BreakerState>> breaker() {
        return Mono.fromCallable(engine::breakerState).map(ResponseEntity::ok);
    }

    @PostMapping("/breaker/request")
    public Mono<ResponseEntity<BreakerState>> requestBreaker(@RequestBody SignedRequest request) {
        log.warn("Circuit breaker request received");
        return commands.requestBreaker(request.auth()).map(ResponseEntity::ok);
    }

    @PostMapping("/breaker/activate")
    public Mono<ResponseEntity<BreakerState>> activateBreaker(@RequestBody SignedRequest request) {
        log.warn("Circuit breaker activation received");
        return commands.activateBreaker(request.auth()).map(ResponseEntity::ok);
    }

    @PostMapping("/breaker/deactivate")
    public Mono<ResponseEntity<BreakerState>> deactivateBreaker(@RequestBody SignedRequest request) {
        log.info("Circuit breaker deactivation received");
        return commands.deactivateBreaker(request.auth()).map(ResponseEntity::ok);
    }
}
