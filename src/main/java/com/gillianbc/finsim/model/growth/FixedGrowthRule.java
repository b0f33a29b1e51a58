package com.gillianbc.finsim.model.growth;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

@Getter
@EqualsAndHashCode
public final class FixedGrowthRule implements GrowthRule {

    public static final FixedGrowthRule NONE = new FixedGrowthRule(BigDecimal.ZERO);

    private final BigDecimal rate;

    public FixedGrowthRule(BigDecimal rate) {
        this.rate = Objects.requireNonNull(rate, "rate must not be null");
    }

    public static FixedGrowthRule of(String rate) {
        return new FixedGrowthRule(new BigDecimal(rate));
    }

    @Override
    public GrowthSampler newSampler(long seed) {
        return () -> rate;
    }

    @Override
    public boolean isStochastic() {
        return false;
    }

    @Override
    public String toString() {
        return "fixed(" + rate.toPlainString() + ")";
    }
}
