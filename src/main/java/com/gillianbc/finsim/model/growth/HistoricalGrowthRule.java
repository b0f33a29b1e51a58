package com.gillianbc.finsim.model.growth;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Growth drawn from a historical series of annual returns.
 * <p>
 * Sampling is i.i.d. with replacement: every year draws one annual return uniformly from
 * the whole series, independently of earlier draws. The reference series hold single
 * annual returns, so there are no multi-year blocks to preserve.
 * <p>
 * Instances come from {@code HistoricalReturnsCatalog}, which rejects unknown categories.
 */
@Getter
public final class HistoricalGrowthRule implements GrowthRule {

    private final String category;
    private final List<BigDecimal> returns;

    public HistoricalGrowthRule(String category, List<BigDecimal> returns) {
        this.category = Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(returns, "returns must not be null");
        if (returns.isEmpty()) {
            throw new IllegalArgumentException("returns for " + category + " must not be empty");
        }
        this.returns = List.copyOf(returns);
    }

    @Override
    public GrowthSampler newSampler(long seed) {
        return new HistoricalGrowthSampler(returns, seed);
    }

    @Override
    public boolean isStochastic() {
        return returns.stream().distinct().count() > 1;
    }

    @Override
    public String toString() {
        return "historical(" + category + ", " + returns.size() + " years)";
    }
}
