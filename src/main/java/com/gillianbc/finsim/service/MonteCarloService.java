package com.gillianbc.finsim.service;

import com.gillianbc.finsim.config.SimulationProperties;
import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.model.FinancialModel;
import com.gillianbc.finsim.model.result.SimulationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs many independent trials of a model in parallel.
 * <p>
 * Trials share nothing mutable: each works on its own copy of the model, with samplers
 * seeded from the run's base seed and the trial index, so results do not depend on which
 * worker ran a trial or in what order. A trial that fails is reported and the others
 * carry on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonteCarloService {

    private final TrialRunner trialRunner;
    private final TaxService taxService;
    private final SimulationProperties properties;

    public SimulationResult run(FinancialModel model, int numberOfSimulations) {
        return start(model, numberOfSimulations).await();
    }

    public SimulationResult run(FinancialModel model, int numberOfSimulations, long baseSeed) {
        return start(model, numberOfSimulations, baseSeed).await();
    }

    /** Base seed from the model, else {@code finsim.simulation.base-seed}. */
    public SimulationRun start(FinancialModel model, int numberOfSimulations) {
        long baseSeed = model.getSeed() != null ? model.getSeed() : properties.getBaseSeed();
        return start(model, numberOfSimulations, baseSeed);
    }

    /**
     * Validates the model against reference data, then submits every trial.
     *
     * @throws ConfigurationException before any trial runs if the model cannot be simulated
     */
    public SimulationRun start(FinancialModel model, int numberOfSimulations, long baseSeed) {
        if (numberOfSimulations <= 0) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL, "number of simulations must be positive");
        }
        taxService.requireJurisdictions(model);

        int workers = Math.min(properties.effectiveParallelism(), numberOfSimulations);
        ExecutorService executor = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("finsim-trial-"));
        log.info("Starting {} trial(s) of {} years from {} on {} worker(s), base seed {}", numberOfSimulations,
                model.getDuration(), model.getStartYear(), workers, baseSeed);
        if (numberOfSimulations > 1 && !model.hasStochasticGrowth()) {
            log.info("Model has no stochastic growth; all trials will produce identical histories");
        }

        SimulationRun run = new SimulationRun(model, numberOfSimulations, executor, properties.getAwaitTimeoutMinutes());
        for (int i = 0; i < numberOfSimulations; i++) {
            run.submit(i, trialIndex -> trialRunner.runTrial(model, trialIndex, baseSeed));
        }
        run.sealed();
        return run;
    }
}
