package com.gillianbc.finsim.model;

import lombok.Builder;

import java.math.BigDecimal;

public class Expense extends CashFlow {

    @Builder
    public Expense(String name, BigDecimal initialValue, BigDecimal inflationRate) {
        super(name, initialValue, inflationRate);
    }

    private Expense(Expense source) {
        super(source);
    }

    @Override
    public Expense copy() {
        return new Expense(this);
    }
}
