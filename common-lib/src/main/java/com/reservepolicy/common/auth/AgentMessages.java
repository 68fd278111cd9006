package com.reservepolicy.common.auth;

import com.reservepolicy.common.model.OracleReading;
import com.reservepolicy.common.policy.PolicyParams;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical byte encoding of the message an agent signs for an action.
 *
 * <pre>
 *   RESERVE_POLICY/&lt;ACTION&gt;
 *   agent=&lt;public key&gt;
 *   &lt;field&gt;=&lt;value&gt;        (one line per field, keys sorted)
 *   timestamp=&lt;unix seconds&gt;
 *   nonce=&lt;nonce&gt;
 * </pre>
 *
 * <p>Map-valued fields are rendered with sorted keys so that the encoding does not
 * depend on map iteration order. UTF-8, {@code '\n'} separated, no trailing newline.
 */
public final class AgentMessages {

    public static final String DOMAIN = "RESERVE_POLICY";

    private AgentMessages() {}

    public static byte[] build(AgentAction action, String agent, Map<String, ?> fields,
                               long timestamp, long nonce) {
        StringBuilder sb = new StringBuilder()
            .append(DOMAIN).append('/').append(action.name()).append('\n')
            .append("agent=").append(agent).append('\n');

        Map<String, ?> sorted = fields == null ? Map.of() : new TreeMap<>(fields);
        sorted.forEach((key, value) ->
            sb.append(key).append('=').append(render(value)).append('\n'));

        sb.append("timestamp=").append(timestamp).append('\n')
          .append("nonce=").append(nonce);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] vote(String agent, long proposalId, boolean prediction, long stakeAmount,
                              long timestamp, long nonce) {
        return build(AgentAction.VOTE, agent,
            Map.of("proposalId", proposalId, "prediction", prediction, "stakeAmount", stakeAmount),
            timestamp, nonce);
    }

    public static byte[] createProposal(String agent, PolicyParams params, long votingPeriodSeconds,
                                        long timestamp, long nonce) {
        Map<String, Object> fields = new HashMap<>(params.signingFields());
        fields.put("votingPeriodSeconds", votingPeriodSeconds);
        return build(AgentAction.CREATE_PROPOSAL, agent, fields, timestamp, nonce);
    }

    /** Finalize, execute and cancel sign only the proposal id. */
    public static byte[] proposalAction(AgentAction action, String agent, long proposalId,
                                        long timestamp, long nonce) {
        return build(action, agent, Map.of("proposalId", proposalId), timestamp, nonce);
    }

    public static byte[] markClaimed(String agent, long proposalId, String voter, long timestamp, long nonce) {
        return build(AgentAction.MARK_CLAIMED, agent, Map.of("proposalId", proposalId, "voter", voter),
            timestamp, nonce);
    }

    public static byte[] oracleUpdate(String agent, OracleReading reading, long timestamp, long nonce) {
        return build(AgentAction.UPDATE_ORACLE, agent, Map.of(
                "indexValue", reading.indexValue(),
                "avgYieldBps", reading.avgYieldBps(),
                "volatilityBps", reading.volatilityBps(),
                "tvlUsd", reading.tvlUsd(),
                "readingTimestamp", reading.timestamp(),
                "readingSlot", reading.slot()),
            timestamp, nonce);
    }

    /** Deposit and withdraw sign the unit amount. */
    public static byte[] reserveAmount(AgentAction action, String agent, long units, long timestamp, long nonce) {
        return build(action, agent, Map.of("units", units), timestamp, nonce);
    }

    /** Actions without arguments (circuit breaker transitions). */
    public static byte[] bare(AgentAction action, String agent, long timestamp, long nonce) {
        return build(action, agent, Map.of(), timestamp, nonce);
    }

    private static String render(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> ordered = new TreeMap<>();
            map.forEach((k, v) -> ordered.put(String.valueOf(k), v));
            return ordered.toString();
        }
        return String.valueOf(value);
    }
}
