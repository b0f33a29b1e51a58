package com.gillianbc.finsim.model;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ledger row for a single simulated year: how the year's cash flow was taxed,
 * invested and carried, plus the closing debt and net worth. Amounts are rounded to 2 dp.
 */
@Getter
public class YearSnapshot {

    private final int year;
    @NonNull private final BigDecimal grossRevenue;
    @NonNull private final BigDecimal totalExpenses;
    /** grossRevenue - totalExpenses */
    @NonNull private final BigDecimal grossFlow;
    @NonNull private final BigDecimal pretaxDeposits;
    /** Taxable revenue less pre-tax deposits: the income tax was computed on. */
    @NonNull private final BigDecimal taxableIncome;
    @NonNull private final BigDecimal taxPaid;
    @NonNull private final BigDecimal debtRepaid;
    @NonNull private final BigDecimal distributed;
    @NonNull private final BigDecimal liquidated;
    /**
     * Surplus no asset could accept and no fallback asset absorbed.
     */
    @NonNull private final BigDecimal unallocated;
    @NonNull private final BigDecimal debtEnd;
    @NonNull private final BigDecimal netWorthEnd;
    @NonNull private final List<String> eventsFired;

    @Builder
    public YearSnapshot(int year,
                        BigDecimal grossRevenue,
                        BigDecimal totalExpenses,
                        BigDecimal grossFlow,
                        BigDecimal pretaxDeposits,
                        BigDecimal taxableIncome,
                        BigDecimal taxPaid,
                        BigDecimal debtRepaid,
                        BigDecimal distributed,
                        BigDecimal liquidated,
                        BigDecimal unallocated,
                        BigDecimal debtEnd,
                        BigDecimal netWorthEnd,
                        @Singular("eventFired") List<String> eventsFired) {
        this.year = year;
        this.grossRevenue = Money.round(Objects.requireNonNull(grossRevenue, "grossRevenue must not be null"));
        this.totalExpenses = Money.round(Objects.requireNonNull(totalExpenses, "totalExpenses must not be null"));
        this.grossFlow = Money.round(Objects.requireNonNull(grossFlow, "grossFlow must not be null"));
        this.pretaxDeposits = Money.round(Objects.requireNonNull(pretaxDeposits, "pretaxDeposits must not be null"));
        this.taxableIncome = Money.round(Objects.requireNonNull(taxableIncome, "taxableIncome must not be null"));
        this.taxPaid = Money.round(Objects.requireNonNull(taxPaid, "taxPaid must not be null"));
        this.debtRepaid = Money.round(Objects.requireNonNull(debtRepaid, "debtRepaid must not be null"));
        this.distributed = Money.round(Objects.requireNonNull(distributed, "distributed must not be null"));
        this.liquidated = Money.round(Objects.requireNonNull(liquidated, "liquidated must not be null"));
        this.unallocated = Money.round(Objects.requireNonNull(unallocated, "unallocated must not be null"));
        this.debtEnd = Money.round(Objects.requireNonNull(debtEnd, "debtEnd must not be null"));
        this.netWorthEnd = Money.round(Objects.requireNonNull(netWorthEnd, "netWorthEnd must not be null"));
        this.eventsFired = List.copyOf(eventsFired);
    }

    /** Cash left after expenses and tax, before it was invested. */
    public BigDecimal netCashFlow() {
        return grossFlow.subtract(taxPaid);
    }
}
