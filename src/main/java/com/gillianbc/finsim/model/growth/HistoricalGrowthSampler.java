package com.gillianbc.finsim.model.growth;

import java.math.BigDecimal;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Not thread safe. One sampler belongs to one asset in one trial.
 */
final class HistoricalGrowthSampler implements GrowthSampler {

    private final List<BigDecimal> returns;
    private final SplittableRandom random;

    HistoricalGrowthSampler(List<BigDecimal> returns, long seed) {
        this.returns = returns;
        this.random = new SplittableRandom(seed);
    }

    @Override
    public BigDecimal nextRate() {
        return returns.get(random.nextInt(returns.size()));
    }
}
