package com.gillianbc.finsim.model;

import java.math.BigDecimal;

/**
 * Capability through which scheduled event actions mutate a flow or an asset.
 * Every mutator returns a handle that restores the exact prior setting.
 */
public interface Adjustable {

    String getName();

    BigDecimal getCurrentValue();

    Runnable overrideValue(BigDecimal value);

    /**
     * Replaces the evolution rate (flows) or the growth rule (assets) with a fixed rate.
     */
    Runnable overrideRate(BigDecimal rate);
}
