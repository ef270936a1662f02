package com.careerpath.orchestrator.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory registry of analysis runs, keyed by transition id.
 *
 * This is the only concurrency gate of the pipeline: {@link #tryAcquire}
 * admits at most one in-flight run per transition. Each admission gets a new
 * generation; a run superseded by a forced admission keeps its old
 * {@link RunLease}, and its later writes are dropped. Entries are created on
 * first access and live for the lifetime of the process.
 */
@Component
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, RunState> runs = new HashMap<>();
    private long generations;

    /**
     * Admit a run for this transition.
     *
     * Empty when a run is already IN_PROGRESS and forceRefresh is off.
     * Otherwise the entry moves to IN_PROGRESS / ADMITTED with its data reset,
     * owned by the returned lease.
     */
    public Optional<RunLease> tryAcquire(long transitionId, boolean forceRefresh) {
        lock.writeLock().lock();
        try {
            RunState current = runs.get(transitionId);
            if (current != null && current.inProgress() && !forceRefresh) {
                log.info("Transition {} already in progress (phase={}), not admitting", transitionId, current.phase());
                return Optional.empty();
            }
            if (current != null && current.inProgress()) {
                log.warn("Transition {} force-admitted over an in-flight run (generation={}, phase={})",
                        transitionId, current.generation(), current.phase());
            }
            RunLease lease = new RunLease(transitionId, ++generations);
            runs.put(transitionId, new RunState(transitionId, lease.generation(),
                    RunStatus.IN_PROGRESS, AnalysisPhase.ADMITTED, RunData.EMPTY, Instant.now()));
            return Optional.of(lease);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Merge a patch on behalf of the run holding this lease. Dropped when a
     * later admission owns the entry.
     */
    public void update(RunLease lease, RunPatch patch) {
        lock.writeLock().lock();
        try {
            RunState current = runs.get(lease.transitionId());
            if (current == null || !current.ownedBy(lease)) {
                log.warn("Transition {}: dropping update from superseded run (generation={})",
                        lease.transitionId(), lease.generation());
                return;
            }
            runs.put(lease.transitionId(), apply(current, patch));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Merge a patch into the entry, creating an IDLE entry first if none exists. */
    public void update(long transitionId, RunPatch patch) {
        lock.writeLock().lock();
        try {
            RunState current = runs.get(transitionId);
            if (current == null) {
                current = new RunState(transitionId, 0L, RunStatus.IDLE, AnalysisPhase.ADMITTED,
                        RunData.EMPTY, Instant.now());
            }
            runs.put(transitionId, apply(current, patch));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * The run holding this lease is no longer in flight. An entry it still
     * owns in IN_PROGRESS exited without committing a terminal state and is
     * marked FAILED. A superseded lease leaves the entry alone.
     */
    public void release(RunLease lease) {
        lock.writeLock().lock();
        try {
            RunState current = runs.get(lease.transitionId());
            if (current == null || !current.ownedBy(lease)) {
                return;
            }
            if (current.inProgress()) {
                log.warn("Transition {} released while still in progress (phase={}), marking FAILED",
                        lease.transitionId(), current.phase());
                runs.put(lease.transitionId(), current.with(RunStatus.FAILED, AnalysisPhase.FAILED, current.data()));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<RunState> snapshot(long transitionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(runs.get(transitionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    private static RunState apply(RunState current, RunPatch patch) {
        return current.with(
                patch.status() != null ? patch.status() : current.status(),
                patch.phase()  != null ? patch.phase()  : current.phase(),
                current.data().merge(patch.data()));
    }
}
