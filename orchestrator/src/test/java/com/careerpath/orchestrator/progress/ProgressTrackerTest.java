package com.careerpath.orchestrator.progress;

import com.careerpath.orchestrator.model.GapLevel;
import com.careerpath.orchestrator.stage.SkillGapFinding;
import com.careerpath.orchestrator.stage.Story;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressTrackerTest {

    private final ProgressTracker tracker = new ProgressTracker();

    // ------------------------------------------------------------------
    // Admission
    // ------------------------------------------------------------------

    @Test
    void tryAcquire_secondCallRefusedUntilReleased() {
        RunLease lease = tracker.tryAcquire(7L, false).orElseThrow();
        assertThat(tracker.tryAcquire(7L, false)).isEmpty();

        tracker.update(lease, RunPatch.terminal(RunStatus.COMPLETE, AnalysisPhase.COMPLETE));
        tracker.release(lease);

        assertThat(tracker.tryAcquire(7L, false)).isPresent();
    }

    @Test
    void tryAcquire_forceRefreshAdmitsOverInFlightRun() {
        RunLease first = tracker.tryAcquire(7L, false).orElseThrow();
        RunLease second = tracker.tryAcquire(7L, true).orElseThrow();

        RunState state = tracker.snapshot(7L).orElseThrow();
        assertThat(state.status()).isEqualTo(RunStatus.IN_PROGRESS);
        assertThat(second.generation()).isGreaterThan(first.generation());
        assertThat(state.generation()).isEqualTo(second.generation());
    }

    @Test
    void supersededRun_cannotFinishOrReleaseTheRunThatReplacedIt() {
        RunLease first = tracker.tryAcquire(7L, false).orElseThrow();
        RunLease second = tracker.tryAcquire(7L, true).orElseThrow();
        tracker.update(second, RunPatch.phase(AnalysisPhase.ANALYZING_GAPS));

        tracker.update(first, RunPatch.data(AnalysisPhase.COMPLETE,
                RunData.ofStories(List.of(new Story("Old run", "stale", null, null)))));
        tracker.update(first, RunPatch.terminal(RunStatus.COMPLETE, AnalysisPhase.COMPLETE));
        tracker.release(first);

        RunState state = tracker.snapshot(7L).orElseThrow();
        assertThat(state.status()).isEqualTo(RunStatus.IN_PROGRESS);
        assertThat(state.phase()).isEqualTo(AnalysisPhase.ANALYZING_GAPS);
        assertThat(state.data().stories()).isNull();
        assertThat(tracker.tryAcquire(7L, false)).isEmpty();

        tracker.update(second, RunPatch.terminal(RunStatus.COMPLETE, AnalysisPhase.COMPLETE));
        tracker.release(second);
        assertThat(tracker.snapshot(7L).orElseThrow().status()).isEqualTo(RunStatus.COMPLETE);
    }

    @Test
    void tryAcquire_resetsDataAndPhase() {
        RunLease lease = tracker.tryAcquire(7L, false).orElseThrow();
        tracker.update(lease, RunPatch.data(AnalysisPhase.RESEARCHING,
                RunData.ofStories(List.of(new Story("Blog", "text", null, null)))));
        tracker.update(lease, RunPatch.terminal(RunStatus.COMPLETE, AnalysisPhase.COMPLETE));

        tracker.tryAcquire(7L, false);

        RunState state = tracker.snapshot(7L).orElseThrow();
        assertThat(state.phase()).isEqualTo(AnalysisPhase.ADMITTED);
        assertThat(state.data().stories()).isNull();
    }

    @Test
    void distinctTransitions_doNotBlockEachOther() {
        assertThat(tracker.tryAcquire(1L, false)).isPresent();
        assertThat(tracker.tryAcquire(2L, false)).isPresent();
    }

    // ------------------------------------------------------------------
    // Update / release / snapshot
    // ------------------------------------------------------------------

    @Test
    void update_mergesShallowly() {
        RunLease lease = tracker.tryAcquire(3L, false).orElseThrow();
        List<Story> stories = List.of(new Story("Forum", "content", "https://x.test/1", null));
        List<SkillGapFinding> gaps = List.of(new SkillGapFinding("SQL", GapLevel.HIGH, 80, 2, null));

        tracker.update(lease, RunPatch.data(AnalysisPhase.RESEARCHING, RunData.ofStories(stories)));
        tracker.update(lease, RunPatch.data(AnalysisPhase.ANALYZING_GAPS, RunData.ofSkillGaps(gaps)));

        RunState state = tracker.snapshot(3L).orElseThrow();
        assertThat(state.phase()).isEqualTo(AnalysisPhase.ANALYZING_GAPS);
        assertThat(state.status()).isEqualTo(RunStatus.IN_PROGRESS);
        assertThat(state.data().stories()).isEqualTo(stories);
        assertThat(state.data().skillGaps()).isEqualTo(gaps);
        assertThat(state.data().insights()).isNull();
    }

    @Test
    void update_unknownId_createsIdleEntry() {
        tracker.update(9L, RunPatch.phase(AnalysisPhase.PLANNING));

        RunState state = tracker.snapshot(9L).orElseThrow();
        assertThat(state.status()).isEqualTo(RunStatus.IDLE);
        assertThat(state.phase()).isEqualTo(AnalysisPhase.PLANNING);
        assertThat(state.generation()).isZero();
    }

    @Test
    void release_withoutTerminalState_marksFailed() {
        RunLease lease = tracker.tryAcquire(4L, false).orElseThrow();

        tracker.release(lease);

        RunState state = tracker.snapshot(4L).orElseThrow();
        assertThat(state.status()).isEqualTo(RunStatus.FAILED);
        assertThat(state.phase()).isEqualTo(AnalysisPhase.FAILED);
    }

    @Test
    void release_afterComplete_keepsComplete() {
        RunLease lease = tracker.tryAcquire(4L, false).orElseThrow();
        tracker.update(lease, RunPatch.terminal(RunStatus.COMPLETE, AnalysisPhase.COMPLETE));

        tracker.release(lease);

        assertThat(tracker.snapshot(4L).orElseThrow().status()).isEqualTo(RunStatus.COMPLETE);
    }

    @Test
    void snapshot_unknownId_isEmpty() {
        assertThat(tracker.snapshot(404L)).isEmpty();
    }

    @Test
    void snapshot_isNotAffectedByLaterUpdates() {
        RunLease lease = tracker.tryAcquire(5L, false).orElseThrow();
        RunState before = tracker.snapshot(5L).orElseThrow();

        tracker.update(lease, RunPatch.phase(AnalysisPhase.PLANNING));

        assertThat(before.phase()).isEqualTo(AnalysisPhase.ADMITTED);
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void concurrentAcquire_admitsExactlyOne() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    if (tracker.tryAcquire(42L, false).isPresent()) {
                        admitted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(admitted.get()).isEqualTo(1);
    }
}
