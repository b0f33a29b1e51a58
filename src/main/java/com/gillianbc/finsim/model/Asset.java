package com.gillianbc.finsim.model;

import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.exception.SimulationException;
import com.gillianbc.finsim.model.growth.FixedGrowthRule;
import com.gillianbc.finsim.model.growth.GrowthRule;
import com.gillianbc.finsim.model.growth.GrowthSampler;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.gillianbc.finsim.model.Money.MATH_CONTEXT;

/**
 * A store of value with a growth rule, optional caps and a tax treatment.
 * <p>
 * Growth and taxation are independent strategies: any {@link GrowthRule} combines with
 * any {@link TaxTreatment}. Only the designated debt account may hold a negative balance.
 * <p>
 * A configured asset is a template. {@link #copyForTrial(long)} produces the mutable
 * instance a single trial works on, with its own sampler and an empty history.
 */
@Getter
public class Asset implements AdjustableHolding {

    private final String name;
    private final TaxTreatment taxTreatment;
    private final boolean debtAllowed;

    private BigDecimal currentValue;
    private GrowthRule growthRule;
    private BigDecimal capValue;
    private BigDecimal capDeposit;

    private GrowthSampler sampler;
    private BigDecimal depositedThisYear = BigDecimal.ZERO;
    /** Contributions still invested; basis for gains on taxable-on-growth assets. */
    private BigDecimal costBasis;
    /** Growth accrued since the start of the trial, tracked for taxable-on-growth assets. */
    private BigDecimal accumulatedGrowth = BigDecimal.ZERO;
    private final List<BigDecimal> history;

    @Builder
    public Asset(String name,
                 BigDecimal initialValue,
                 GrowthRule growthRule,
                 BigDecimal capValue,
                 BigDecimal capDeposit,
                 TaxTreatment taxTreatment) {
        this(name, initialValue, growthRule, capValue, capDeposit, taxTreatment, false);
    }

    private Asset(String name,
                  BigDecimal initialValue,
                  GrowthRule growthRule,
                  BigDecimal capValue,
                  BigDecimal capDeposit,
                  TaxTreatment taxTreatment,
                  boolean debtAllowed) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL, "asset name must not be blank");
        }
        BigDecimal value = initialValue == null ? BigDecimal.ZERO : initialValue;
        if (!debtAllowed && value.signum() < 0) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL,
                    "initial value of " + name + " must be zero or positive");
        }
        if (capValue != null && capValue.signum() < 0) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL, "cap value of " + name + " must be >= 0");
        }
        if (capDeposit != null && capDeposit.signum() < 0) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL, "cap deposit of " + name + " must be >= 0");
        }
        this.name = name;
        this.currentValue = value;
        this.growthRule = growthRule == null ? FixedGrowthRule.NONE : growthRule;
        this.capValue = capValue;
        this.capDeposit = capDeposit;
        this.taxTreatment = taxTreatment == null ? TaxTreatment.NONE : taxTreatment;
        this.debtAllowed = debtAllowed;
        this.costBasis = value.max(BigDecimal.ZERO);
        this.history = new ArrayList<>();
    }

    /**
     * The cash/debt account: uncapped, untaxed, allowed to go negative. Its growth rate is
     * applied to whatever the balance is, so a positive rate is interest earned on cash and
     * interest charged on debt alike.
     */
    public static Asset debtAccount(String name, BigDecimal initialValue, BigDecimal interestRate) {
        return new Asset(name, initialValue,
                new FixedGrowthRule(interestRate == null ? BigDecimal.ZERO : interestRate),
                null, null, TaxTreatment.NONE, true);
    }

    private Asset(Asset source, long seed) {
        this.name = source.name;
        this.taxTreatment = source.taxTreatment;
        this.debtAllowed = source.debtAllowed;
        this.currentValue = source.currentValue;
        this.growthRule = source.growthRule;
        this.capValue = source.capValue;
        this.capDeposit = source.capDeposit;
        this.costBasis = source.costBasis;
        this.history = new ArrayList<>();
        this.sampler = source.growthRule.newSampler(seed);
    }

    public Asset copyForTrial(long seed) {
        return new Asset(this, seed);
    }

    public boolean isCapped() {
        return capValue != null || capDeposit != null;
    }

    /** Resets the per-year deposit allowance. */
    public void startYear() {
        depositedThisYear = BigDecimal.ZERO;
    }

    /**
     * Adds up to {@code min(amount, capDeposit - depositedThisYear, capValue - currentValue)}.
     *
     * @return amount actually deposited; the caller routes the remainder elsewhere
     */
    public BigDecimal deposit(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal accepted = amount;
        if (capDeposit != null) {
            accepted = accepted.min(capDeposit.subtract(depositedThisYear, MATH_CONTEXT));
        }
        if (capValue != null) {
            accepted = accepted.min(capValue.subtract(currentValue, MATH_CONTEXT));
        }
        accepted = Money.nonNegative(accepted);
        if (accepted.signum() == 0) {
            return BigDecimal.ZERO;
        }
        currentValue = currentValue.add(accepted, MATH_CONTEXT);
        depositedThisYear = depositedThisYear.add(accepted, MATH_CONTEXT);
        costBasis = costBasis.add(accepted, MATH_CONTEXT);
        return accepted;
    }

    @Override
    public BigDecimal withdraw(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() <= 0 || currentValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal withdrawn = amount.min(currentValue);
        // basis leaves in proportion to the share of the holding sold
        BigDecimal remainingShare = BigDecimal.ONE.subtract(withdrawn.divide(currentValue, MATH_CONTEXT), MATH_CONTEXT);
        costBasis = costBasis.multiply(remainingShare, MATH_CONTEXT);
        currentValue = currentValue.subtract(withdrawn, MATH_CONTEXT);
        return withdrawn;
    }

    /**
     * Debt account only: moves the balance down by {@code amount}.
     */
    public void accrueDebt(BigDecimal amount) {
        if (!debtAllowed) {
            throw new IllegalStateException(name + " is not the debt account");
        }
        if (amount.signum() > 0) {
            currentValue = currentValue.subtract(amount, MATH_CONTEXT);
        }
    }

    /** Outstanding debt as a positive amount, zero when the balance is not negative. */
    public BigDecimal outstandingDebt() {
        return currentValue.signum() < 0 ? currentValue.negate() : BigDecimal.ZERO;
    }

    /**
     * Applies one year of growth from this trial's sampler.
     *
     * @return the rate applied
     */
    public BigDecimal grow(int year) {
        if (sampler == null) {
            throw new IllegalStateException("asset " + name + " has no sampler; use copyForTrial()");
        }
        BigDecimal rate = sampler.nextRate();
        BigDecimal before = currentValue;
        currentValue = Money.compound(currentValue, rate);
        if (taxTreatment == TaxTreatment.TAXABLE_ON_GROWTH) {
            accumulatedGrowth = accumulatedGrowth.add(currentValue.subtract(before, MATH_CONTEXT), MATH_CONTEXT);
        }
        requireNonNegative(year);
        return rate;
    }

    /** Gain that would be realised if the whole holding were sold now. */
    public BigDecimal unrealizedGain() {
        return currentValue.subtract(costBasis, MATH_CONTEXT);
    }

    /** Appends the end-of-year balance. */
    public void record() {
        history.add(Money.round(currentValue));
    }

    public List<BigDecimal> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /** Used by portfolio rebalancing, which moves value between members without new money. */
    void rebalanceTo(BigDecimal target) {
        currentValue = target;
    }

    void requireNonNegative(int year) {
        if (!debtAllowed && currentValue.signum() < 0) {
            throw new SimulationException(ErrorCode.NEGATIVE_ASSET_VALUE,
                    "asset " + name + " fell to " + Money.round(currentValue) + " in " + year, year);
        }
    }

    @Override
    public Runnable overrideValue(BigDecimal value) {
        Objects.requireNonNull(value, "value must not be null");
        if (!debtAllowed && value.signum() < 0) {
            throw new SimulationException(ErrorCode.NEGATIVE_ASSET_VALUE,
                    "asset " + name + " cannot be set to a negative value");
        }
        BigDecimal previous = currentValue;
        currentValue = value;
        return () -> currentValue = previous;
    }

    @Override
    public Runnable overrideRate(BigDecimal rate) {
        GrowthRule previousRule = growthRule;
        GrowthSampler previousSampler = sampler;
        growthRule = new FixedGrowthRule(rate);
        sampler = growthRule.newSampler(0L);
        return () -> {
            growthRule = previousRule;
            sampler = previousSampler;
        };
    }

    @Override
    public Runnable overrideCapValue(BigDecimal newCap) {
        BigDecimal previous = capValue;
        capValue = newCap;
        return () -> capValue = previous;
    }

    @Override
    public Runnable overrideCapDeposit(BigDecimal newCap) {
        BigDecimal previous = capDeposit;
        capDeposit = newCap;
        return () -> capDeposit = previous;
    }

    @Override
    public String toString() {
        return "Asset(" + name + ", value " + Money.round(currentValue) + ", " + growthRule + ", " + taxTreatment + ")";
    }
}
