package com.reservepolicy.engine.substrate;

import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.OracleState;
import com.reservepolicy.engine.state.PolicyProposal;
import com.reservepolicy.engine.state.ReserveVault;
import com.reservepolicy.engine.state.VoteKey;
import com.reservepolicy.engine.state.VoteRecord;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Committed state. Only touched under the substrate's lock; objects stored here
 * are never handed out without copying.
 */
final class LedgerStore {

    GlobalState globalState;
    final TreeMap<Long, PolicyProposal> proposals = new TreeMap<>();
    final Map<VoteKey, VoteRecord> votes = new LinkedHashMap<>();
    final Map<String, Long> nonces = new HashMap<>();
    OracleState oracle = new OracleState();
    ReserveVault vault = new ReserveVault();
}
