package com.careerpath.orchestrator.pipeline;

import com.careerpath.orchestrator.model.Transition;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs analyses in the background on a fixed worker pool.
 *
 * The pool size caps how many runs talk to the providers at once
 * (careerpath.pipeline.worker-count). Stages of one run stay sequential.
 */
@Component
public class AnalysisDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AnalysisDispatcher.class);

    private final AnalysisOrchestrator orchestrator;
    private final ExecutorService      workers;

    public AnalysisDispatcher(AnalysisOrchestrator orchestrator,
                              @Value("${careerpath.pipeline.worker-count:4}") int workerCount) {
        this.orchestrator = orchestrator;
        this.workers      = Executors.newFixedThreadPool(workerCount, workerThreads());
        log.info("Analysis dispatcher started with {} workers", workerCount);
    }

    /** Queue an analysis of this transition; the future completes with its result. */
    public CompletableFuture<AnalysisResult> dispatch(Transition transition, boolean forceRefresh) {
        long id = transition.getId();
        return CompletableFuture
                .supplyAsync(() -> orchestrator.run(
                        transition.getCurrentRole(),
                        transition.getTargetRole(),
                        id,
                        transition.getExistingSkills(),
                        forceRefresh), workers)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Unhandled error in analysis of transition {}: {}", id, error.getMessage(), error);
                    }
                });
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Analysis workers still busy after 30 s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "analysis-worker-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
