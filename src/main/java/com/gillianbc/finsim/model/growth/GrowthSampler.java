package com.gillianbc.finsim.model.growth;

import java.math.BigDecimal;

/**
 * Lazy per-year sequence of growth rates. Called once per asset per simulated year.
 */
@FunctionalInterface
public interface GrowthSampler {

    BigDecimal nextRate();
}
