package com.reservepolicy.engine.substrate;

import com.reservepolicy.common.event.GovernanceEvent;
import com.reservepolicy.common.event.GovernanceEventType;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.common.exception.PolicyError;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.OracleState;
import com.reservepolicy.engine.state.PolicyProposal;
import com.reservepolicy.engine.state.ReserveVault;
import com.reservepolicy.engine.state.VoteKey;
import com.reservepolicy.engine.state.VoteRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Staged writes of one submission over the committed {@link LedgerStore}.
 *
 * <p>Every accessor returns a staged copy that the caller may mutate freely; the
 * copies replace the committed objects only on {@link #commit()}. A transaction
 * that is dropped without commit leaves no trace.
 */
public final class LedgerTransaction {

    private final LedgerStore store;
    private final long now;
    private final long slot;

    private GlobalState globalState;
    private boolean globalStateCreated;
    private final Map<Long, PolicyProposal> proposals = new LinkedHashMap<>();
    private final Map<VoteKey, VoteRecord> votes = new LinkedHashMap<>();
    private final Map<String, Long> nonces = new HashMap<>();
    private OracleState oracle;
    private ReserveVault vault;
    private final List<GovernanceEvent> events = new ArrayList<>();

    LedgerTransaction(LedgerStore store, long now, long slot) {
        this.store = store;
        this.now   = now;
        this.slot  = slot;
    }

    public long now()  { return now; }
    public long slot() { return slot; }

    // ── global state ─────────────────────────────────────────────────────────

    public boolean isInitialized() {
        return globalState != null || store.globalState != null;
    }

    public GlobalState globalState() {
        if (globalState == null) {
            if (store.globalState == null) {
                throw new PolicyEngineException(PolicyError.NOT_INITIALIZED);
            }
            globalState = store.globalState.copy();
        }
        return globalState;
    }

    public void createGlobalState(GlobalState state) {
        PolicyEngineException.require(!isInitialized(), PolicyError.ALREADY_INITIALIZED);
        this.globalState        = state;
        this.globalStateCreated = true;
    }

    // ── proposals ────────────────────────────────────────────────────────────

    public PolicyProposal proposal(long id) {
        PolicyProposal staged = proposals.get(id);
        if (staged != null) {
            return staged;
        }
        PolicyProposal committed = store.proposals.get(id);
        if (committed == null) {
            throw new PolicyEngineException(PolicyError.PROPOSAL_NOT_FOUND, "id=" + id);
        }
        PolicyProposal copy = committed.copy();
        proposals.put(id, copy);
        return copy;
    }

    public void insertProposal(PolicyProposal proposal) {
        if (proposals.containsKey(proposal.getId()) || store.proposals.containsKey(proposal.getId())) {
            throw new IllegalStateException("proposal id already in use: " + proposal.getId());
        }
        proposals.put(proposal.getId(), proposal);
    }

    // ── votes ────────────────────────────────────────────────────────────────

    public VoteRecord vote(VoteKey key) {
        VoteRecord staged = votes.get(key);
        if (staged != null) {
            return staged;
        }
        VoteRecord committed = store.votes.get(key);
        if (committed == null) {
            throw new PolicyEngineException(PolicyError.VOTE_NOT_FOUND,
                "proposal=" + key.proposalId() + " agent=" + key.agent());
        }
        VoteRecord copy = committed.copy();
        votes.put(key, copy);
        return copy;
    }

    /** Creates the vote slot; an occupied slot is a rejection, never an overwrite. */
    public void insertVote(VoteRecord vote) {
        VoteKey key = vote.key();
        PolicyEngineException.require(!votes.containsKey(key) && !store.votes.containsKey(key),
            PolicyError.DUPLICATE_VOTE, "proposal=" + key.proposalId() + " agent=" + key.agent());
        votes.put(key, vote);
    }

    // ── replay protection ────────────────────────────────────────────────────

    public long lastNonce(String agent) {
        Long staged = nonces.get(agent);
        if (staged != null) {
            return staged;
        }
        return store.nonces.getOrDefault(agent, 0L);
    }

    public void recordNonce(String agent, long nonce) {
        nonces.put(agent, nonce);
    }

    // ── singletons ───────────────────────────────────────────────────────────

    public OracleState oracle() {
        if (oracle == null) {
            oracle = store.oracle.copy();
        }
        return oracle;
    }

    public ReserveVault vault() {
        if (vault == null) {
            vault = store.vault.copy();
        }
        return vault;
    }

    // ── events ───────────────────────────────────────────────────────────────

    public void emit(GovernanceEventType type, String actor, Long proposalId, Map<String, Object> attributes) {
        events.add(new GovernanceEvent(type, actor, proposalId, now, slot, attributes));
    }

    List<GovernanceEvent> events() {
        return List.copyOf(events);
    }

    void commit() {
        if (globalState != null) {
            store.globalState = globalState;
        }
        store.proposals.putAll(proposals);
        store.votes.putAll(votes);
        store.nonces.putAll(nonces);
        if (oracle != null) {
            store.oracle = oracle;
        }
        if (vault != null) {
            store.vault = vault;
        }
    }

    boolean createdGlobalState() {
        return globalStateCreated;
    }
}
