package com.reservepolicy.engine.state;

/**
 * Storage key of a vote slot. One slot per (proposal, agent); the slot is
 * write-once, which is the whole duplicate-vote protection.
 */
public record VoteKey(long proposalId, String agent) {}
