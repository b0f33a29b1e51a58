package com.gillianbc.finsim.service;

import com.gillianbc.finsim.FinsimTestSupport;
import com.gillianbc.finsim.config.SimulationProperties;
import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.model.Asset;
import com.gillianbc.finsim.model.FinancialModel;
import com.gillianbc.finsim.model.Revenue;
import com.gillianbc.finsim.model.growth.FixedGrowthRule;
import com.gillianbc.finsim.model.growth.GrowthRule;
import com.gillianbc.finsim.model.growth.GrowthSampler;
import com.gillianbc.finsim.model.growth.HistoricalGrowthRule;
import com.gillianbc.finsim.model.result.SimulationResult;
import com.gillianbc.finsim.model.result.TrialFailure;
import com.gillianbc.finsim.model.result.TrialResult;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.gillianbc.finsim.FinsimTestSupport.amount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class MonteCarloServiceTest {

    private static final int START = 2024;

    private final TaxService taxService = new TaxService(FinsimTestSupport.referenceData());
    private final HistoricalReturnsCatalog catalog = new HistoricalReturnsCatalog(FinsimTestSupport.referenceData());
    private final TrialRunner trialRunner = new TrialRunner(new YearEngine(taxService));

    private MonteCarloService service(int parallelism) {
        SimulationProperties properties = new SimulationProperties();
        properties.setParallelism(parallelism);
        return new MonteCarloService(trialRunner, taxService, properties);
    }

    private FinancialModel retirementModel(int duration) {
        return FinancialModel.builder()
                .startYear(START)
                .duration(duration)
                .revenue(Revenue.builder().name("Salary").initialValue(amount("60000")).jurisdiction("CA").build())
                .asset(Asset.builder().name("Brokerage").initialValue(amount("100000")).growthRule(catalog.historical("stocks")).build())
                .build();
    }

    @Test
    @DisplayName("A thousand trials on historical returns spread out")
    void thousandTrials_haveVariance() {
        SimulationResult result = service(4).run(retirementModel(30), 1000);

        assertEquals(1000, result.successfulTrialCount());
        assertTrue(result.getFailures().isEmpty());
        Set<BigDecimal> finals = new HashSet<>(result.valuesAt("Brokerage", START + 29));
        assertTrue(finals.size() > 1, "final values should differ between trials");
        List<BigDecimal> p10 = result.percentile("Brokerage", 10);
        List<BigDecimal> p90 = result.percentile("Brokerage", 90);
        assertTrue(p10.get(29).compareTo(p90.get(29)) < 0);
    }

    @Test
    @DisplayName("Results depend only on the base seed, not on the worker count")
    void sameSeed_sameResultsAcrossParallelism() {
        FinancialModel model = retirementModel(15);

        SimulationResult serial = service(1).run(model, 40, 7L);
        SimulationResult parallel = service(8).run(model, 40, 7L);

        for (int i = 0; i < 40; i++) {
            assertEquals(serial.trial(i).getHistories(), parallel.trial(i).getHistories());
        }
    }

    @Test
    @DisplayName("Seed on the model is used when none is passed")
    void modelSeed_used() {
        FinancialModel seeded = FinancialModel.builder()
                .startYear(START)
                .duration(10)
                .asset(Asset.builder().name("Brokerage").initialValue(amount("1000")).growthRule(catalog.historical("stocks")).build())
                .seed(7L)
                .build();

        SimulationResult implicit = service(2).run(seeded, 5);
        SimulationResult explicit = service(2).run(seeded, 5, 7L);

        assertEquals(implicit.history("Brokerage", 4), explicit.history("Brokerage", 4));
    }

    @Test
    @DisplayName("Failed trials are reported by index while the rest complete")
    void failingTrials_isolated() {
        FinancialModel model = FinancialModel.builder()
                .startYear(START)
                .duration(1)
                .asset(Asset.builder()
                        .name("Leveraged")
                        .initialValue(amount("1000"))
                        .growthRule(new HistoricalGrowthRule("boom-or-bust", List.of(amount("0.05"), amount("-1.5"))))
                        .build())
                .build();

        SimulationResult result = service(4).run(model, 50, 11L);

        assertTrue(result.successfulTrialCount() > 0);
        assertTrue(result.getFailures().size() > 0);
        assertEquals(50, result.successfulTrialCount() + result.getFailures().size());
        assertEquals(0, result.skippedTrialCount());
        for (TrialFailure failure : result.getFailures()) {
            assertEquals(ErrorCode.NEGATIVE_ASSET_VALUE, failure.getErrorCode());
            assertFalse(failure.getErrorCode().isConfiguration());
            assertEquals(START, failure.getYear());
        }
        for (TrialResult trial : result.getTrials()) {
            assertEquals(0, amount("1050").compareTo(trial.finalValue("Leveraged")));
        }
    }

    private FinancialModel modelGrowingBy(GrowthRule rule) {
        return FinancialModel.builder()
                .startYear(START)
                .duration(3)
                .asset(Asset.builder().name("Fund").initialValue(amount("1000")).growthRule(rule).build())
                .build();
    }

    @Test
    @DisplayName("A growth rule that breaks while a trial is set up is reported as a failure, not skipped")
    void growthRuleFailsAtSetup_countedAsFailure() {
        GrowthRule evenSeedsBreak = new GrowthRule() {
            @Override
            public GrowthSampler newSampler(long seed) {
                if (seed % 2 == 0) {
                    throw new IllegalArgumentException("no sampler for seed " + seed);
                }
                return new FixedGrowthRule(amount("0.05")).newSampler(seed);
            }

            @Override
            public boolean isStochastic() {
                return true;
            }
        };

        SimulationResult result = service(4).run(modelGrowingBy(evenSeedsBreak), 10, 5L);

        assertEquals(10, result.successfulTrialCount() + result.getFailures().size());
        assertEquals(0, result.skippedTrialCount());
        for (TrialFailure failure : result.getFailures()) {
            assertEquals(ErrorCode.INTERNAL_ERROR, failure.getErrorCode());
            assertNull(failure.getYear());
            assertTrue(failure.getMessage().contains("IllegalArgumentException"));
        }
    }

    @Test
    @DisplayName("Any runtime error inside a year fails that trial with the year attached")
    void samplerThrows_everyTrialFailsInFirstYear() {
        GrowthRule broken = new GrowthRule() {
            @Override
            public GrowthSampler newSampler(long seed) {
                return () -> {
                    throw new IllegalStateException("sampler exhausted");
                };
            }

            @Override
            public boolean isStochastic() {
                return true;
            }
        };

        SimulationResult result = service(2).run(modelGrowingBy(broken), 10, 5L);

        assertEquals(0, result.successfulTrialCount());
        assertEquals(10, result.getFailures().size());
        assertEquals(0, result.skippedTrialCount());
        for (TrialFailure failure : result.getFailures()) {
            assertEquals(ErrorCode.INTERNAL_ERROR, failure.getErrorCode());
            assertEquals(START, failure.getYear());
        }
    }

    @Test
    @DisplayName("Unknown jurisdiction fails before any trial runs")
    void unknownJurisdiction_rejectedUpFront() {
        FinancialModel model = FinancialModel.builder()
                .startYear(START)
                .duration(5)
                .revenue(Revenue.builder().name("Salary").initialValue(amount("1000")).jurisdiction("QQ").build())
                .build();

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> service(2).run(model, 10));
        assertEquals(ErrorCode.UNKNOWN_JURISDICTION, ex.getErrorCode());
        assertTrue(ex.getErrorCode().isConfiguration());
    }

    @Test
    @DisplayName("Number of simulations must be positive")
    void zeroSimulations_rejected() {
        assertThrows(ConfigurationException.class, () -> service(2).run(retirementModel(5), 0));
    }

    @Test
    @DisplayName("Cancelling keeps finished trials and accounts for the rest as skipped")
    void cancel_keepsCompletedTrials() {
        SimulationRun run = service(1).start(retirementModel(40), 500, 3L);
        run.cancel();
        SimulationResult result = run.await();

        assertTrue(result.isCancelled());
        assertTrue(run.isCancelled());
        assertEquals(500, result.successfulTrialCount() + result.getFailures().size() + result.skippedTrialCount());
        assertEquals(run.completedTrials(), result.successfulTrialCount() + result.getFailures().size());
    }

    @Test
    @DisplayName("Deterministic model gives identical trials, so every percentile is the same")
    void deterministicModel_percentilesCollapse() {
        FinancialModel model = FinancialModel.builder()
                .startYear(START)
                .duration(3)
                .revenue(Revenue.builder().name("Salary").initialValue(amount("10000")).build())
                .asset(Asset.builder().name("Cash").build())
                .build();

        SimulationResult result = service(2).run(model, 20);

        assertEquals(result.percentile("Cash", 5), result.percentile("Cash", 95));
        assertEquals(result.mean("Cash"), result.percentile("Cash", 50));
        assertEquals(0, amount("30000").compareTo(result.mean("Cash").get(2)));
    }
}
