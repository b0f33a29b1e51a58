package com.gillianbc.finsim.service;

import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.exception.SimulationException;
import com.gillianbc.finsim.model.FinancialModel;
import com.gillianbc.finsim.model.result.SimulationResult;
import com.gillianbc.finsim.model.result.TrialFailure;
import com.gillianbc.finsim.model.result.TrialResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntFunction;

/**
 * Handle on a Monte Carlo run in progress. {@link #cancel()} stops trials that have not
 * started yet; trials already completed keep their results.
 */
@Slf4j
public class SimulationRun {

    private final FinancialModel model;
    private final int requestedTrials;
    private final ExecutorService executor;
    private final long awaitTimeoutMinutes;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Map<Integer, TrialResult> results = new ConcurrentSkipListMap<>();
    private final Map<Integer, TrialFailure> failures = new ConcurrentSkipListMap<>();
    private final List<Future<?>> futures = new ArrayList<>();

    SimulationRun(FinancialModel model, int requestedTrials, ExecutorService executor, long awaitTimeoutMinutes) {
        this.model = model;
        this.requestedTrials = requestedTrials;
        this.executor = executor;
        this.awaitTimeoutMinutes = awaitTimeoutMinutes;
    }

    void submit(int trialIndex, IntFunction<TrialResult> trial) {
        futures.add(executor.submit(() -> {
            if (cancelled.get()) {
                return;
            }
            try {
                results.put(trialIndex, trial.apply(trialIndex));
            } catch (SimulationException e) {
                log.warn("Trial {} failed in {}: {}", trialIndex, e.getYear(), e.getMessage());
                failures.put(trialIndex, TrialFailure.of(trialIndex, e));
            } catch (RuntimeException e) {
                log.warn("Trial {} failed unexpectedly", trialIndex, e);
                failures.put(trialIndex, new TrialFailure(trialIndex, null, ErrorCode.INTERNAL_ERROR, String.valueOf(e)));
            }
        }));
    }

    /** Called once every trial has been submitted. */
    void sealed() {
        executor.shutdown();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancelling simulation run after {} completed trial(s)", results.size() + failures.size());
            for (Future<?> future : futures) {
                future.cancel(false);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int completedTrials() {
        return results.size() + failures.size();
    }

    /**
     * Waits for outstanding trials and returns the collected results.
     */
    public SimulationResult await() {
        try {
            if (!executor.awaitTermination(awaitTimeoutMinutes, TimeUnit.MINUTES)) {
                log.warn("Simulation run did not finish within {} minutes, cancelling the rest", awaitTimeoutMinutes);
                cancel();
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            executor.shutdownNow();
            throw new SimulationException(ErrorCode.TRIAL_ABORTED, "interrupted while waiting for trials", e);
        }
        SimulationResult result = new SimulationResult(model.getStartYear(), model.getDuration(), requestedTrials,
                new ArrayList<>(results.values()), new ArrayList<>(failures.values()), cancelled.get());
        log.info("Simulation run finished: {} of {} trials succeeded, {} failed {}, {} skipped",
                result.successfulTrialCount(), requestedTrials, failures.size(), result.failedTrialIndices(),
                result.skippedTrialCount());
        return result;
    }
}
