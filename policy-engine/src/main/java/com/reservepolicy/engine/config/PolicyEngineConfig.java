package com.reservepolicy.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reservepolicy.common.event.GovernanceEventPublisher;
import com.reservepolicy.common.model.StakeWeighting;
import com.reservepolicy.engine.clock.ChainClock;
import com.reservepolicy.engine.clock.SystemChainClock;
import com.reservepolicy.engine.signature.Ed25519SignatureProvider;
import com.reservepolicy.engine.signature.SignatureProvider;
import com.reservepolicy.engine.substrate.ExecutionSubstrate;
import com.reservepolicy.engine.substrate.InMemoryExecutionSubstrate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PolicyEngineConfig {

    @Value("${policy.execution-delay-seconds:172800}")
    private long executionDelaySeconds;

    @Value("${policy.circuit-breaker-delay-seconds:86400}")
    private long circuitBreakerDelaySeconds;

    @Value("${policy.oracle.min-interval-seconds:300}")
    private long minOracleIntervalSeconds;

    @Value("${policy.oracle.min-slot-buffer:100}")
    private long minSlotBuffer;

    @Value("${policy.oracle.max-staleness-seconds:900}")
    private long maxOracleStalenessSeconds;

    @Value("${policy.oracle.max-index-value:1000000000000}")
    private long maxIndexValue;

    @Value("${policy.oracle.max-yield-bps:10000}")
    private long maxYieldBps;

    @Value("${policy.oracle.max-volatility-bps:10000}")
    private long maxVolatilityBps;

    @Value("${policy.oracle.max-tvl-usd:1000000000000000000}")
    private long maxTvlUsd;

    @Value("${policy.voting.min-period-seconds:3600}")
    private long minVotingPeriodSeconds;

    @Value("${policy.voting.max-period-seconds:604800}")
    private long maxVotingPeriodSeconds;

    @Value("${policy.voting.stake-weighting:LINEAR}")
    private StakeWeighting stakeWeighting;

    @Value("${policy.clock.genesis-epoch-millis:0}")
    private long genesisEpochMillis;

    @Value("${policy.clock.slot-millis:400}")
    private long slotMillis;

    @Bean
    public EngineParameters engineParameters() {
        return new EngineParameters(
            executionDelaySeconds,
            circuitBreakerDelaySeconds,
            minOracleIntervalSeconds,
            minSlotBuffer,
            maxOracleStalenessSeconds,
            minVotingPeriodSeconds,
            maxVotingPeriodSeconds,
            maxIndexValue,
            maxYieldBps,
            maxVolatilityBps,
            maxTvlUsd,
            stakeWeighting);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChainClock chainClock(Clock clock) {
        return new SystemChainClock(clock, genesisEpochMillis, slotMillis);
    }

    @Bean
    public ExecutionSubstrate executionSubstrate(ChainClock chainClock, GovernanceEventPublisher publisher) {
        return new InMemoryExecutionSubstrate(chainClock, publisher);
    }

    @Bean
    public SignatureProvider signatureProvider() {
        return new Ed25519SignatureProvider();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
