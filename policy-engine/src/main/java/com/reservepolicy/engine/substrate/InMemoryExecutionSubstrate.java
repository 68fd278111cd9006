package com.reservepolicy.engine.substrate;

import com.reservepolicy.common.event.GovernanceEventPublisher;
import com.reservepolicy.common.exception.PolicyEngineException;
import com.reservepolicy.engine.clock.ChainClock;
import com.reservepolicy.engine.state.GlobalState;
import com.reservepolicy.engine.state.OracleState;
import com.reservepolicy.engine.state.PolicyProposal;
import com.reservepolicy.engine.state.ReserveVault;
import com.reservepolicy.engine.state.VoteKey;
import com.reservepolicy.engine.state.VoteRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Process-local {@link ExecutionSubstrate}.
 *
 * <p>One write lock serializes submissions; the clock is read once per submission
 * so every call in it sees the same time and slot. Reads take the read lock and
 * return copies. Committed events are handed to the publisher after the write
 * lock is released, under a publish lock taken before that release, so batches
 * reach the publisher in commit order. A publisher must not call back into the
 * substrate.
 */
public class InMemoryExecutionSubstrate implements ExecutionSubstrate {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionSubstrate.class);

    private final ChainClock clock;
    private final GovernanceEventPublisher publisher;
    private final LedgerStore store = new LedgerStore();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final ReentrantLock publishLock = new ReentrantLock(true);
    private final LedgerView view = new CommittedView();

    public InMemoryExecutionSubstrate(ChainClock clock, GovernanceEventPublisher publisher) {
        this.clock     = clock;
        this.publisher = publisher;
    }

    @Override
    public SubmissionReceipt submit(Submission submission) {
        SubmissionReceipt receipt;
        lock.writeLock().lock();
        try {
            LedgerTransaction tx = new LedgerTransaction(store, clock.now(), clock.slot());
            List<Object> results = new ArrayList<>();
            List<SubmissionStep> steps = submission.steps();
            try {
                for (int i = 0; i < steps.size(); i++) {
                    if (steps.get(i) instanceof EngineCall<?> call) {
                        results.add(call.action().invoke(new InvocationContext(steps, i, tx)));
                    }
                }
            } catch (PolicyEngineException e) {
                log.warn("Submission rejected. calls={} code={} category={} now={} slot={}",
                         callNames(steps), e.getError(), e.getCategory(), tx.now(), tx.slot());
                throw e;
            } catch (RuntimeException e) {
                log.error("Submission aborted. calls={} now={} slot={}", callNames(steps), tx.now(), tx.slot(), e);
                throw e;
            }
            tx.commit();
            if (tx.createdGlobalState()) {
                log.info("Protocol state created. slot={}", tx.slot());
            }
            receipt = new SubmissionReceipt(Collections.unmodifiableList(results), tx.events(), tx.now(), tx.slot());
            publishLock.lock();
        } finally {
            lock.writeLock().unlock();
        }

        try {
            log.debug("Submission committed. events={} now={} slot={}",
                      receipt.events().size(), receipt.committedAt(), receipt.slot());
            if (!receipt.events().isEmpty()) {
                publisher.publish(receipt.events());
            }
        } finally {
            publishLock.unlock();
        }
        return receipt;
    }

    @Override
    public LedgerView view() {
        return view;
    }

    private static String callNames(List<SubmissionStep> steps) {
        return steps.stream()
            .filter(EngineCall.class::isInstance)
            .map(s -> ((EngineCall<?>) s).name())
            .collect(Collectors.joining(","));
    }

    private final class CommittedView implements LedgerView {

        @Override
        public Optional<GlobalState> globalState() {
            lock.readLock().lock();
            try {
                return Optional.ofNullable(store.globalState).map(GlobalState::copy);
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public Optional<PolicyProposal> proposal(long id) {
            lock.readLock().lock();
            try {
                return Optional.ofNullable(store.proposals.get(id)).map(PolicyProposal::copy);
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public List<PolicyProposal> proposals() {
            lock.readLock().lock();
            try {
                return store.proposals.values().stream().map(PolicyProposal::copy).toList();
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public Optional<VoteRecord> vote(VoteKey key) {
            lock.readLock().lock();
            try {
                return Optional.ofNullable(store.votes.get(key)).map(VoteRecord::copy);
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public List<VoteRecord> votes(long proposalId) {
            lock.readLock().lock();
            try {
                return store.votes.values().stream()
                    .filter(v -> v.getProposalId() == proposalId)
                    .map(VoteRecord::copy)
                    .toList();
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public OracleState oracle() {
            lock.readLock().lock();
            try {
                return store.oracle.copy();
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public ReserveVault vault() {
            lock.readLock().lock();
            try {
                return store.vault.copy();
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public long lastNonce(String agent) {
            lock.readLock().lock();
            try {
                return store.nonces.getOrDefault(agent, 0L);
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
