package com.gillianbc.finsim.model.event;

import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.model.Adjustable;
import com.gillianbc.finsim.model.AdjustableHolding;
import com.gillianbc.finsim.model.Asset;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One parameter mutation carried by a {@link LifeEvent}. The vocabulary is closed: the
 * concrete operations are the nested subclasses, created through the static factories.
 * <p>
 * {@code duration} policy: null means the mutation is permanent; {@code n} means the
 * prior setting is restored exactly at the start of year {@code fireYear + n}. Changes to
 * an asset's balance are always permanent. Amounts are never negative.
 */
@Getter
public abstract class Action {

    private final String target;
    private final Integer duration;

    protected Action(String target, Integer duration) {
        if (target == null || target.isBlank()) {
            throw new ConfigurationException(ErrorCode.MALFORMED_ACTION, "action target must not be blank");
        }
        if (duration != null && duration <= 0) {
            throw new ConfigurationException(ErrorCode.MALFORMED_ACTION,
                    "duration of action on " + target + " must be positive");
        }
        this.target = target;
        this.duration = duration;
    }

    public static Action setBaseValue(String target, BigDecimal value, Integer duration) {
        return new SetBaseValue(target, value, duration);
    }

    public static Action addToBaseValue(String target, BigDecimal amount, Integer duration) {
        return new AddToBaseValue(target, amount, duration);
    }

    public static Action setGrowthRate(String target, BigDecimal rate, Integer duration) {
        return new SetGrowthRate(target, rate, duration);
    }

    public static Action setCapValue(String target, BigDecimal cap, Integer duration) {
        return new SetCapValue(target, cap, duration);
    }

    public static Action setCapDeposit(String target, BigDecimal cap, Integer duration) {
        return new SetCapDeposit(target, cap, duration);
    }

    public static Action withdraw(String target, BigDecimal amount) {
        return new Withdraw(target, amount);
    }

    public boolean isTemporary() {
        return duration != null;
    }

    /** True for actions that change a deposit or value cap. */
    public boolean isCapChange() {
        return false;
    }

    /**
     * Rejects targets that lack the capability this action needs.
     */
    public void validateTarget(Adjustable candidate) {
        if (!requiredCapability().isInstance(candidate)) {
            throw new ConfigurationException(ErrorCode.MALFORMED_ACTION,
                    describe() + " cannot target " + candidate.getName());
        }
    }

    /**
     * @param debtAccount trial debt account, charged with anything an action spends
     *                    beyond what its target holds
     * @return restore handle when the action is temporary, otherwise null
     */
    public final Runnable apply(Adjustable resolved, Asset debtAccount) {
        Runnable restore = mutate(resolved, debtAccount);
        return isTemporary() ? restore : null;
    }

    protected Class<? extends Adjustable> requiredCapability() {
        return Adjustable.class;
    }

    protected abstract Runnable mutate(Adjustable resolved, Asset debtAccount);

    public abstract String describe();

    @Override
    public String toString() {
        return describe() + (isTemporary() ? " for " + duration + " years" : "");
    }

    static final class SetBaseValue extends Action {
        private final BigDecimal value;

        SetBaseValue(String target, BigDecimal value, Integer duration) {
            super(target, duration);
            this.value = requireAmount(value, target);
        }

        // asset balances are never rolled back
        @Override
        public void validateTarget(Adjustable candidate) {
            super.validateTarget(candidate);
            if (isTemporary() && candidate instanceof AdjustableHolding) {
                throw new ConfigurationException(ErrorCode.MALFORMED_ACTION,
                        "setting the value of asset " + candidate.getName() + " is permanent and takes no duration");
            }
        }

        @Override
        protected Runnable mutate(Adjustable resolved, Asset debtAccount) {
            return resolved.overrideValue(value);
        }

        @Override
        public String describe() {
            return "set " + getTarget() + " to " + value.toPlainString();
        }
    }

    static final class AddToBaseValue extends Action {
        private final BigDecimal amount;

        AddToBaseValue(String target, BigDecimal amount, Integer duration) {
            super(target, duration);
            this.amount = requireAmount(amount, target);
        }

        @Override
        public void validateTarget(Adjustable candidate) {
            super.validateTarget(candidate);
            if (isTemporary() && candidate instanceof AdjustableHolding) {
                throw new ConfigurationException(ErrorCode.MALFORMED_ACTION,
                        "adding to asset " + candidate.getName() + " is a one-off and takes no duration");
            }
        }

        @Override
        protected Runnable mutate(Adjustable resolved, Asset debtAccount) {
            return resolved.overrideValue(resolved.getCurrentValue().add(amount));
        }

        @Override
        public String describe() {
            return "add " + amount.toPlainString() + " to " + getTarget();
        }
    }

    static final class SetGrowthRate extends Action {
        private final BigDecimal rate;

        SetGrowthRate(String target, BigDecimal rate, Integer duration) {
            super(target, duration);
            this.rate = Objects.requireNonNull(rate, "rate must not be null");
            if (rate.compareTo(BigDecimal.ONE.negate()) < 0) {
                throw new ConfigurationException(ErrorCode.MALFORMED_ACTION, "rate for " + target + " must be >= -1");
            }
        }

        @Override
        protected Runnable mutate(Adjustable resolved, Asset debtAccount) {
            return resolved.overrideRate(rate);
        }

        @Override
        public String describe() {
            return "set growth rate of " + getTarget() + " to " + rate.toPlainString();
        }
    }

    static final class SetCapValue extends Action {
        private final BigDecimal cap;

        @Override
        public boolean isCapChange() {
            return true;
        }

        SetCapValue(String target, BigDecimal cap, Integer duration) {
            super(target, duration);
            this.cap = cap == null ? null : requireAmount(cap, target);
        }

        @Override
        protected Class<? extends Adjustable> requiredCapability() {
            return AdjustableHolding.class;
        }

        @Override
        protected Runnable mutate(Adjustable resolved, Asset debtAccount) {
            return ((AdjustableHolding) resolved).overrideCapValue(cap);
        }

        @Override
        public String describe() {
            return "set value cap of " + getTarget() + " to " + (cap == null ? "none" : cap.toPlainString());
        }
    }

    static final class SetCapDeposit extends Action {
        private final BigDecimal cap;

        @Override
        public boolean isCapChange() {
            return true;
        }

        SetCapDeposit(String target, BigDecimal cap, Integer duration) {
            super(target, duration);
            this.cap = cap == null ? null : requireAmount(cap, target);
        }

        @Override
        protected Class<? extends Adjustable> requiredCapability() {
            return AdjustableHolding.class;
        }

        @Override
        protected Runnable mutate(Adjustable resolved, Asset debtAccount) {
            return ((AdjustableHolding) resolved).overrideCapDeposit(cap);
        }

        @Override
        public String describe() {
            return "set deposit cap of " + getTarget() + " to " + (cap == null ? "none" : cap.toPlainString());
        }
    }

    /**
     * Spends {@code amount} out of an asset, e.g. a house deposit. Whatever the asset
     * cannot cover is charged to the debt account.
     */
    static final class Withdraw extends Action {
        private final BigDecimal amount;

        Withdraw(String target, BigDecimal amount) {
            super(target, null);
            this.amount = requireAmount(amount, target);
        }

        @Override
        protected Class<? extends Adjustable> requiredCapability() {
            return AdjustableHolding.class;
        }

        @Override
        protected Runnable mutate(Adjustable resolved, Asset debtAccount) {
            BigDecimal withdrawn = ((AdjustableHolding) resolved).withdraw(amount);
            BigDecimal uncovered = amount.subtract(withdrawn);
            if (uncovered.signum() > 0) {
                debtAccount.accrueDebt(uncovered);
            }
            return null;
        }

        @Override
        public String describe() {
            return "withdraw " + amount.toPlainString() + " from " + getTarget();
        }
    }

    private static BigDecimal requireAmount(BigDecimal amount, String target) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() < 0) {
            throw new ConfigurationException(ErrorCode.MALFORMED_ACTION,
                    "amount for " + target + " must be zero or positive");
        }
        return amount;
    }
}
