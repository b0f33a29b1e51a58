package com.gillianbc.finsim.model;

import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.gillianbc.finsim.model.Money.MATH_CONTEXT;

/**
 * Assets held under a fixed target allocation. Deposits are split pro-rata and the
 * members are rebalanced back to target after each year's growth.
 */
@Getter
public class Portfolio {

    static final BigDecimal ALLOCATION_TOLERANCE = new BigDecimal("1e-9");

    private final String name;
    private final List<Asset> members;
    private final List<BigDecimal> allocations;
    private final TaxTreatment taxTreatment;

    private Portfolio(String name, List<Asset> members, List<BigDecimal> allocations) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL, "portfolio name must not be blank");
        }
        if (members.isEmpty()) {
            throw new ConfigurationException(ErrorCode.INVALID_ALLOCATION, "portfolio " + name + " has no members");
        }
        BigDecimal total = BigDecimal.ZERO;
        for (int i = 0; i < allocations.size(); i++) {
            BigDecimal allocation = allocations.get(i);
            if (allocation.signum() < 0 || allocation.compareTo(BigDecimal.ONE) > 0) {
                throw new ConfigurationException(ErrorCode.INVALID_ALLOCATION,
                        "allocation of " + members.get(i).getName() + " must be between 0 and 1");
            }
            total = total.add(allocation);
        }
        if (total.subtract(BigDecimal.ONE).abs().compareTo(ALLOCATION_TOLERANCE) > 0) {
            throw new ConfigurationException(ErrorCode.INVALID_ALLOCATION,
                    "Total allocation of portfolio " + name + " is " + total.stripTrailingZeros().toPlainString()
                            + " but must sum to 1.",
                    Map.of("portfolio", name, "total", total));
        }
        TaxTreatment treatment = members.get(0).getTaxTreatment();
        for (Asset member : members) {
            if (member.getTaxTreatment() != treatment) {
                throw new ConfigurationException(ErrorCode.INVALID_MODEL,
                        "portfolio " + name + " mixes " + treatment + " and " + member.getTaxTreatment() + " assets");
            }
            if (member.isDebtAllowed()) {
                throw new ConfigurationException(ErrorCode.INVALID_MODEL,
                        "the debt account cannot be a member of portfolio " + name);
            }
        }
        this.name = name;
        this.members = List.copyOf(members);
        this.allocations = List.copyOf(allocations);
        this.taxTreatment = treatment;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Trial copy wired to the trial's own member instances, looked up by name.
     */
    public Portfolio copyWith(Map<String, Asset> trialAssets) {
        List<Asset> copies = new ArrayList<>(members.size());
        for (Asset member : members) {
            copies.add(Objects.requireNonNull(trialAssets.get(member.getName()),
                    "no trial copy of " + member.getName()));
        }
        return new Portfolio(name, copies, allocations);
    }

    public BigDecimal totalValue() {
        BigDecimal total = BigDecimal.ZERO;
        for (Asset member : members) {
            total = total.add(member.getCurrentValue(), MATH_CONTEXT);
        }
        return total;
    }

    /**
     * Splits {@code amount} by allocation. Members that hit a cap keep the excess out.
     *
     * @return amount actually deposited across all members
     */
    public BigDecimal deposit(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        List<BigDecimal> shares = split(amount);
        BigDecimal deposited = BigDecimal.ZERO;
        for (int i = 0; i < members.size(); i++) {
            deposited = deposited.add(members.get(i).deposit(shares.get(i)), MATH_CONTEXT);
        }
        return deposited;
    }

    /**
     * Moves value between members so each holds exactly its target share. Total value is
     * unchanged.
     */
    public void rebalance() {
        List<BigDecimal> targets = split(totalValue());
        for (int i = 0; i < members.size(); i++) {
            members.get(i).rebalanceTo(targets.get(i));
        }
    }

    // last share takes the rounding remainder so the split always sums to the input
    private List<BigDecimal> split(BigDecimal amount) {
        List<BigDecimal> shares = new ArrayList<>(members.size());
        BigDecimal assigned = BigDecimal.ZERO;
        for (int i = 0; i < members.size() - 1; i++) {
            BigDecimal share = amount.multiply(allocations.get(i), MATH_CONTEXT);
            shares.add(share);
            assigned = assigned.add(share, MATH_CONTEXT);
        }
        shares.add(amount.subtract(assigned, MATH_CONTEXT));
        return shares;
    }

    public List<Asset> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public static final class Builder {
        private String name;
        private final List<Asset> members = new ArrayList<>();
        private final List<BigDecimal> allocations = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder member(Asset asset, BigDecimal allocation) {
            members.add(Objects.requireNonNull(asset, "asset must not be null"));
            allocations.add(Objects.requireNonNull(allocation, "allocation must not be null"));
            return this;
        }

        public Builder member(Asset asset, String allocation) {
            return member(asset, new BigDecimal(allocation));
        }

        public Portfolio build() {
            return new Portfolio(name, members, allocations);
        }
    }
}
