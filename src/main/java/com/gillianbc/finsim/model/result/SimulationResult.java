package com.gillianbc.finsim.model.result;

import com.gillianbc.finsim.model.Money;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import static com.gillianbc.finsim.model.Money.MATH_CONTEXT;

/**
 * Aggregate of a Monte Carlo run. Only successful trials contribute to the aggregated
 * views; failed trial indices and causes are kept alongside.
 */
@Getter
public class SimulationResult {

    private final int startYear;
    private final int duration;
    private final int requestedTrials;
    private final List<TrialResult> trials;
    private final List<TrialFailure> failures;
    private final boolean cancelled;

    public SimulationResult(int startYear, int duration, int requestedTrials,
                            List<TrialResult> trials, List<TrialFailure> failures, boolean cancelled) {
        this.startYear = startYear;
        this.duration = duration;
        this.requestedTrials = requestedTrials;
        List<TrialResult> sortedTrials = new ArrayList<>(trials);
        sortedTrials.sort(Comparator.comparingInt(TrialResult::getTrialIndex));
        List<TrialFailure> sortedFailures = new ArrayList<>(failures);
        sortedFailures.sort(Comparator.comparingInt(TrialFailure::getTrialIndex));
        this.trials = List.copyOf(sortedTrials);
        this.failures = List.copyOf(sortedFailures);
        this.cancelled = cancelled;
    }

    public int successfulTrialCount() {
        return trials.size();
    }

    public List<Integer> failedTrialIndices() {
        List<Integer> indices = new ArrayList<>(failures.size());
        for (TrialFailure failure : failures) {
            indices.add(failure.getTrialIndex());
        }
        return indices;
    }

    /** Trials never started because the run was cancelled. */
    public int skippedTrialCount() {
        return requestedTrials - trials.size() - failures.size();
    }

    public Set<String> objectNames() {
        return trials.isEmpty() ? Set.of() : trials.get(0).getHistories().keySet();
    }

    public TrialResult trial(int trialIndex) {
        for (TrialResult trial : trials) {
            if (trial.getTrialIndex() == trialIndex) {
                return trial;
            }
        }
        throw new IllegalArgumentException("no successful trial with index " + trialIndex);
    }

    public List<BigDecimal> history(String name, int trialIndex) {
        return trial(trialIndex).history(name);
    }

    /** One value per successful trial, in trial order. */
    public List<BigDecimal> valuesAt(String name, int year) {
        int index = year - startYear;
        if (index < 0 || index >= duration) {
            throw new IllegalArgumentException("year " + year + " is outside the simulation");
        }
        List<BigDecimal> values = new ArrayList<>(trials.size());
        for (TrialResult trial : trials) {
            values.add(trial.history(name).get(index));
        }
        return values;
    }

    public List<BigDecimal> mean(String name) {
        List<BigDecimal> means = new ArrayList<>(duration);
        if (trials.isEmpty()) {
            return means;
        }
        BigDecimal count = BigDecimal.valueOf(trials.size());
        for (int year = startYear; year < startYear + duration; year++) {
            BigDecimal sum = BigDecimal.ZERO;
            for (BigDecimal value : valuesAt(name, year)) {
                sum = sum.add(value, MATH_CONTEXT);
            }
            means.add(Money.round(sum.divide(count, MATH_CONTEXT)));
        }
        return means;
    }

    /**
     * Per-year percentile across successful trials, interpolating linearly between the
     * closest ranks.
     *
     * @param percentile 0 to 100
     */
    public List<BigDecimal> percentile(String name, double percentile) {
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be between 0 and 100");
        }
        List<BigDecimal> result = new ArrayList<>(duration);
        if (trials.isEmpty()) {
            return result;
        }
        for (int year = startYear; year < startYear + duration; year++) {
            List<BigDecimal> sorted = new ArrayList<>(valuesAt(name, year));
            sorted.sort(Comparator.naturalOrder());
            double rank = percentile / 100.0 * (sorted.size() - 1);
            int low = (int) Math.floor(rank);
            int high = (int) Math.ceil(rank);
            BigDecimal fraction = BigDecimal.valueOf(rank - low);
            BigDecimal lowValue = sorted.get(low);
            BigDecimal value = lowValue.add(sorted.get(high).subtract(lowValue).multiply(fraction, MATH_CONTEXT), MATH_CONTEXT);
            result.add(Money.round(value));
        }
        return result;
    }

    public PercentileBand band(String name, double lowerPercentile, double upperPercentile) {
        if (lowerPercentile > upperPercentile) {
            throw new IllegalArgumentException("lower percentile must not exceed upper percentile");
        }
        return new PercentileBand(name, lowerPercentile, upperPercentile,
                percentile(name, lowerPercentile), percentile(name, 50), percentile(name, upperPercentile));
    }
}
