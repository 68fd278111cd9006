package com.reservepolicy.engine.substrate;

/**
 * Single-writer, run-to-completion host of the engine state.
 *
 * <p>Submissions are serialized. Each one either commits all of its staged writes
 * or none of them; a rejected call aborts the whole submission and rethrows.
 */
public interface ExecutionSubstrate {

    SubmissionReceipt submit(Submission submission);

    LedgerView view();
}
