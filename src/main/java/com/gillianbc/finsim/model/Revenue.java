package com.gillianbc.finsim.model;

import com.gillianbc.finsim.service.TaxService;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Income. A revenue with a jurisdiction is taxable under that jurisdiction's schedule
 * plus the federal one; a revenue without one (gifts, rental held in a wrapper) is not.
 */
@Getter
public class Revenue extends CashFlow {

    private final String jurisdiction;

    @Builder
    public Revenue(String name, BigDecimal initialValue, BigDecimal growthRate, String jurisdiction) {
        super(name, initialValue, growthRate);
        this.jurisdiction = jurisdiction;
    }

    private Revenue(Revenue source) {
        super(source);
        this.jurisdiction = source.jurisdiction;
    }

    public boolean isTaxable() {
        return jurisdiction != null;
    }

    /**
     * Federal plus state liability on {@code grossIncome}. Zero for an untaxed revenue.
     */
    public BigDecimal computeTax(BigDecimal grossIncome, TaxService taxService) {
        if (!isTaxable()) {
            return BigDecimal.ZERO;
        }
        return taxService.computeTax(grossIncome, jurisdiction);
    }

    @Override
    public Revenue copy() {
        return new Revenue(this);
    }
}
