package com.gillianbc.finsim.model;

public enum TaxTreatment {
    /** Plain store of value, e.g. a current account. */
    NONE,
    /** Growth is tracked separately so gains can be taxed on withdrawal. */
    TAXABLE_ON_GROWTH,
    /** Deposits reduce taxable income in the year they are made (401k style). */
    PRE_TAX;

    public boolean reducesTaxableIncome() {
        return this == PRE_TAX;
    }
}
