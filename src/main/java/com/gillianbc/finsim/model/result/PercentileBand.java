package com.gillianbc.finsim.model.result;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-year lower, median and upper percentiles of one object across successful trials.
 */
@Getter
public class PercentileBand {

    private final String name;
    private final double lowerPercentile;
    private final double upperPercentile;
    private final List<BigDecimal> lower;
    private final List<BigDecimal> median;
    private final List<BigDecimal> upper;

    public PercentileBand(String name, double lowerPercentile, double upperPercentile,
                          List<BigDecimal> lower, List<BigDecimal> median, List<BigDecimal> upper) {
        this.name = name;
        this.lowerPercentile = lowerPercentile;
        this.upperPercentile = upperPercentile;
        this.lower = List.copyOf(lower);
        this.median = List.copyOf(median);
        this.upper = List.copyOf(upper);
    }
}
