package com.reservepolicy.engine.substrate;

import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.OracleState;
import com.reservepolicy.engine.state.PolicyProposal;
import com.reservepolicy.engine.state.ReserveVault;
import com.reservepolicy.engine.state.VoteKey;
import com.reservepolicy.engine.state.VoteRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to committed state. Every returned object is a detached copy.
 */
public interface LedgerView {

    Optional<GlobalState> globalState();

    Optional<PolicyProposal> proposal(long id);

    List<PolicyProposal> proposals();

    Optional<VoteRecord> vote(VoteKey key);

    List<VoteRecord> votes(long proposalId);

    OracleState oracle();

    ReserveVault vault();

    long lastNonce(String agent);
}
