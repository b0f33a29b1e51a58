package com.gillianbc.finsim.service;

import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.exception.SimulationException;
import com.gillianbc.finsim.model.FinancialModel;
import com.gillianbc.finsim.model.SeedDerivation;
import com.gillianbc.finsim.model.TrialState;
import com.gillianbc.finsim.model.YearSnapshot;
import com.gillianbc.finsim.model.result.TrialResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one trial: a fresh copy of the model, samplers seeded from (base seed, trial
 * index), then every year from the start year in order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrialRunner {

    private final YearEngine yearEngine;

    /**
     * @throws SimulationException for any failure inside the trial, carrying the year it
     *                             happened in once the first year has started
     */
    public TrialResult runTrial(FinancialModel model, int trialIndex, long baseSeed) {
        long trialSeed = SeedDerivation.derive(baseSeed, trialIndex);
        TrialState state;
        try {
            state = model.newTrial(trialSeed);
        } catch (SimulationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SimulationException(ErrorCode.INTERNAL_ERROR,
                    "trial " + trialIndex + " could not be set up: " + e, e);
        }
        List<YearSnapshot> ledger = new ArrayList<>(model.getDuration());

        int endYear = model.getStartYear() + model.getDuration();
        for (int year = model.getStartYear(); year < endYear; year++) {
            try {
                ledger.add(yearEngine.advanceYear(state, year));
            } catch (SimulationException e) {
                if (e.getYear() != null) {
                    throw e;
                }
                throw new SimulationException(e.getErrorCode(), e.getMessage(), year, e);
            } catch (RuntimeException e) {
                throw new SimulationException(ErrorCode.INTERNAL_ERROR,
                        "trial " + trialIndex + " failed: " + e, year, e);
            }
        }
        log.debug("Trial {} finished {} years with net worth {}", trialIndex, ledger.size(),
                ledger.get(ledger.size() - 1).getNetWorthEnd());
        return TrialResult.of(trialIndex, state, ledger);
    }
}
