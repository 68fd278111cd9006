package com.reservepolicy.engine.controller;

import com.reservepolicy.engine.dto.OracleUpdateRequest;
import com.reservepolicy.engine.dto.OracleView;
import com.reservepolicy.engine.service.PolicyCommandService;
import com.reservepolicy.engine.service.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/oracle")
public class OracleController {

    private static final Logger log = LoggerFactory.getLogger(OracleController.class);

    private final PolicyCommandService commands;
    private final PolicyEngine engine;

    public OracleController(PolicyCommandService commands, PolicyEngine engine) {
        this.commands = commands;
        this.engine   = engine;
    }

    @PostMapping("/readings")
    public Mono<ResponseEntity<OracleView>> update(@RequestBody OracleUpdateRequest request) {
        log.info("Oracle reading received. slot={}", request.reading() == null ? null : request.reading().slot());
        return commands.updateOracle(request).map(ResponseEntity::ok);
    }

    @GetMapping("/current")
    public Mono<ResponseEntity<OracleView>> current() {
        return Mono.fromCallable(() -> OracleView.from(engine.oracle()))
            .map(ResponseEntity::ok);
    }
}
