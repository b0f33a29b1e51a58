package com.gillianbc.finsim.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Arithmetic settings shared by every monetary calculation. Balances are carried at
 * {@link #MATH_CONTEXT} precision; histories and ledgers are rounded to pence/cents.
 */
public final class Money {

    public static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    public static final int SCALE = 2;

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /** value * (1 + rate) */
    public static BigDecimal compound(BigDecimal value, BigDecimal rate) {
        return value.multiply(BigDecimal.ONE.add(rate, MATH_CONTEXT), MATH_CONTEXT);
    }

    public static BigDecimal nonNegative(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO : value;
    }
}
