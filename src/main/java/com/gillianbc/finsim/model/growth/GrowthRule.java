package com.gillianbc.finsim.model.growth;

/**
 * Configuration-time description of how an asset grows. A rule is immutable and shared
 * between trials; each trial asks it for its own {@link GrowthSampler}.
 */
public interface GrowthRule {

    /**
     * @param seed trial-specific seed; ignored by deterministic rules
     */
    GrowthSampler newSampler(long seed);

    /** True when successive samples can differ. */
    boolean isStochastic();
}
