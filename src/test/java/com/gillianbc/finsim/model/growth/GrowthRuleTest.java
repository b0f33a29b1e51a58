package com.gillianbc.finsim.model.growth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrowthRuleTest {

    private static final List<BigDecimal> SERIES = List.of(
            new BigDecimal("0.10"), new BigDecimal("-0.05"), new BigDecimal("0.20"), new BigDecimal("0.03"));

    private static List<BigDecimal> draw(GrowthSampler sampler, int count) {
        List<BigDecimal> draws = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            draws.add(sampler.nextRate());
        }
        return draws;
    }

    @Test
    @DisplayName("Fixed rule always returns its rate and is not stochastic")
    void fixed_constant() {
        GrowthSampler sampler = FixedGrowthRule.of("0.04").newSampler(123L);
        assertEquals(List.of(new BigDecimal("0.04"), new BigDecimal("0.04")), draw(sampler, 2));
        assertFalse(FixedGrowthRule.NONE.isStochastic());
    }

    @Test
    @DisplayName("Historical draws come from the series")
    void historical_drawsFromSeries() {
        HistoricalGrowthRule rule = new HistoricalGrowthRule("test", SERIES);
        for (BigDecimal rate : draw(rule.newSampler(1L), 200)) {
            assertTrue(SERIES.contains(rate));
        }
    }

    @Test
    @DisplayName("Draws are with replacement, so every value turns up over many years")
    void historical_withReplacement() {
        HistoricalGrowthRule rule = new HistoricalGrowthRule("test", SERIES);
        Set<BigDecimal> seen = new HashSet<>(draw(rule.newSampler(5L), 500));
        assertEquals(new HashSet<>(SERIES), seen);
    }

    @Test
    @DisplayName("Same seed gives the same sequence; a different seed does not")
    void historical_seeded() {
        HistoricalGrowthRule rule = new HistoricalGrowthRule("test", SERIES);
        assertEquals(draw(rule.newSampler(42L), 50), draw(rule.newSampler(42L), 50));
        assertNotEquals(draw(rule.newSampler(42L), 50), draw(rule.newSampler(43L), 50));
    }

    @Test
    @DisplayName("A series with a single distinct value is deterministic")
    void historical_singleValue_notStochastic() {
        assertFalse(new HistoricalGrowthRule("flat", List.of(BigDecimal.ONE, BigDecimal.ONE)).isStochastic());
        assertTrue(new HistoricalGrowthRule("test", SERIES).isStochastic());
    }

    @Test
    @DisplayName("Empty series is rejected")
    void historical_empty_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new HistoricalGrowthRule("empty", List.of()));
    }
}
