package com.gillianbc.finsim.model;

import java.math.BigDecimal;

/**
 * Extra capabilities of a store of value. A null cap means uncapped.
 */
public interface AdjustableHolding extends Adjustable {

    Runnable overrideCapValue(BigDecimal capValue);

    Runnable overrideCapDeposit(BigDecimal capDeposit);

    /**
     * @return amount actually withdrawn, never more than the positive balance
     */
    BigDecimal withdraw(BigDecimal amount);
}
