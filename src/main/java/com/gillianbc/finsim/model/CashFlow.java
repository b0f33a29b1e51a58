package com.gillianbc.finsim.model;

import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.exception.SimulationException;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.gillianbc.finsim.model.Money.MATH_CONTEXT;

/**
 * A periodic cash amount, positive for a revenue and counted against revenues for an
 * expense. The value evolves once a year by {@code rate}.
 */
@Getter
public abstract class CashFlow implements Adjustable {

    private final String name;
    private BigDecimal currentValue;
    private BigDecimal rate;
    private final List<BigDecimal> history;

    protected CashFlow(String name, BigDecimal initialValue, BigDecimal rate) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL, "flow name must not be blank");
        }
        Objects.requireNonNull(initialValue, "initialValue must not be null");
        BigDecimal effectiveRate = rate == null ? BigDecimal.ZERO : rate;
        if (initialValue.signum() < 0) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL,
                    "initial value of " + name + " must be zero or positive");
        }
        if (effectiveRate.compareTo(BigDecimal.ONE.negate()) < 0) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL,
                    "rate of " + name + " must be >= -1");
        }
        this.name = name;
        this.currentValue = initialValue;
        this.rate = effectiveRate;
        this.history = new ArrayList<>();
    }

    /** Trial copy: same parameters, empty history. */
    protected CashFlow(CashFlow source) {
        this.name = source.name;
        this.currentValue = source.currentValue;
        this.rate = source.rate;
        this.history = new ArrayList<>();
    }

    public abstract CashFlow copy();

    /**
     * Records the value used during the year just simulated, then applies the rate for
     * the following year.
     */
    public void evolve() {
        history.add(Money.round(currentValue));
        currentValue = currentValue.multiply(BigDecimal.ONE.add(rate, MATH_CONTEXT), MATH_CONTEXT);
    }

    public List<BigDecimal> getHistory() {
        return Collections.unmodifiableList(history);
    }

    @Override
    public Runnable overrideValue(BigDecimal value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value.signum() < 0) {
            throw new SimulationException(ErrorCode.INTERNAL_ERROR, "flow " + name + " cannot be set to a negative value");
        }
        BigDecimal previous = currentValue;
        currentValue = value;
        return () -> currentValue = previous;
    }

    @Override
    public Runnable overrideRate(BigDecimal newRate) {
        Objects.requireNonNull(newRate, "rate must not be null");
        BigDecimal previous = rate;
        rate = newRate;
        return () -> rate = previous;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ", value " + Money.round(currentValue)
                + ", rate " + rate.toPlainString() + ")";
    }
}
