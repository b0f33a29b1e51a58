package com.gillianbc.finsim.service;

import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.exception.SimulationException;
import com.gillianbc.finsim.model.Asset;
import com.gillianbc.finsim.model.CashFlow;
import com.gillianbc.finsim.model.Money;
import com.gillianbc.finsim.model.Portfolio;
import com.gillianbc.finsim.model.Revenue;
import com.gillianbc.finsim.model.TrialState;
import com.gillianbc.finsim.model.YearSnapshot;
import com.gillianbc.finsim.model.event.LifeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.gillianbc.finsim.model.Money.MATH_CONTEXT;

/**
 * Advances one trial by exactly one year.
 * <p>
 * Events for the year fire first, then six phases run in a fixed order:
 * <ol>
 *   <li>balance cash flow (revenues - expenses; a shortfall becomes debt)</li>
 *   <li>deposit into pre-tax assets from the surplus</li>
 *   <li>tax revenues net of pre-tax deposits</li>
 *   <li>repay debt, then distribute what is left across the other assets</li>
 *   <li>grow every asset and rebalance portfolios</li>
 *   <li>record the year and evolve flows (inflation) for the next one</li>
 * </ol>
 * The order decides whether money is taxed before or after being invested and whether debt
 * accrues before or after cash is distributed, so it must not change.
 * <p>
 * Stateless; all mutable state lives in the {@link TrialState} passed in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class YearEngine {

    private final TaxService taxService;

    public YearSnapshot advanceYear(TrialState state, int year) {
        if (state.isComplete()) {
            throw new SimulationException(ErrorCode.INTERNAL_ERROR, "trial already ran all " + state.getDuration() + " years", year);
        }
        if (year != state.nextYear()) {
            throw new SimulationException(ErrorCode.INTERNAL_ERROR,
                    "years advance one at a time: expected " + state.nextYear() + " but got " + year, year);
        }

        List<LifeEvent> fired = state.getScheduler().fire(year, state);
        for (Asset asset : state.allAssets()) {
            asset.startYear();
        }
        Asset debt = state.getDebtAccount();

        // Phase 1: balance cash flow
        BigDecimal grossRevenue = sum(state.getRevenues());
        BigDecimal totalExpenses = sum(state.getExpenses());
        BigDecimal grossFlow = grossRevenue.subtract(totalExpenses, MATH_CONTEXT);
        BigDecimal available = grossFlow;
        if (available.signum() < 0) {
            debt.accrueDebt(available.negate());
            available = BigDecimal.ZERO;
        }
        log.debug("{}: revenues {}, expenses {}, cash flow {}", year, Money.round(grossRevenue),
                Money.round(totalExpenses), Money.round(grossFlow));

        // Phase 2: pre-tax deposits
        BigDecimal pretaxDeposits = BigDecimal.ZERO;
        for (Asset asset : state.getAssets()) {
            if (asset.getTaxTreatment().reducesTaxableIncome()) {
                BigDecimal deposited = asset.deposit(available);
                available = available.subtract(deposited, MATH_CONTEXT);
                pretaxDeposits = pretaxDeposits.add(deposited, MATH_CONTEXT);
            }
        }
        for (Portfolio portfolio : state.getPortfolios()) {
            if (portfolio.getTaxTreatment().reducesTaxableIncome()) {
                BigDecimal deposited = portfolio.deposit(available);
                available = available.subtract(deposited, MATH_CONTEXT);
                pretaxDeposits = pretaxDeposits.add(deposited, MATH_CONTEXT);
            }
        }

        // Phase 3: tax
        BigDecimal taxableIncome = BigDecimal.ZERO;
        BigDecimal taxPaid = BigDecimal.ZERO;
        BigDecimal deductionLeft = pretaxDeposits;
        for (Map.Entry<String, List<Revenue>> group : taxableByJurisdiction(state).entrySet()) {
            BigDecimal income = sum(group.getValue());
            BigDecimal deduction = deductionLeft.min(income);
            deductionLeft = deductionLeft.subtract(deduction, MATH_CONTEXT);
            income = income.subtract(deduction, MATH_CONTEXT);
            taxableIncome = taxableIncome.add(income, MATH_CONTEXT);
            taxPaid = taxPaid.add(group.getValue().get(0).computeTax(income, taxService), MATH_CONTEXT);
        }
        available = available.subtract(taxPaid, MATH_CONTEXT);
        if (available.signum() < 0) {
            debt.accrueDebt(available.negate());
            available = BigDecimal.ZERO;
        }
        log.debug("{}: pre-tax deposits {}, taxable income {}, tax {}", year, Money.round(pretaxDeposits),
                Money.round(taxableIncome), Money.round(taxPaid));

        // Phase 4: repay debt, then distribute
        BigDecimal debtRepaid = available.min(debt.outstandingDebt());
        if (debtRepaid.signum() > 0) {
            debt.deposit(debtRepaid);
            available = available.subtract(debtRepaid, MATH_CONTEXT);
        }
        BigDecimal distributed = BigDecimal.ZERO;
        for (Asset asset : state.getAssets()) {
            if (!asset.getTaxTreatment().reducesTaxableIncome()) {
                BigDecimal deposited = asset.deposit(available);
                available = available.subtract(deposited, MATH_CONTEXT);
                distributed = distributed.add(deposited, MATH_CONTEXT);
            }
        }
        for (Portfolio portfolio : state.getPortfolios()) {
            if (!portfolio.getTaxTreatment().reducesTaxableIncome()) {
                BigDecimal deposited = portfolio.deposit(available);
                available = available.subtract(deposited, MATH_CONTEXT);
                distributed = distributed.add(deposited, MATH_CONTEXT);
            }
        }
        BigDecimal unallocated = BigDecimal.ZERO;
        if (available.signum() > 0) {
            if (state.getFallbackAsset() != null) {
                BigDecimal deposited = state.getFallbackAsset().deposit(available);
                distributed = distributed.add(deposited, MATH_CONTEXT);
                available = available.subtract(deposited, MATH_CONTEXT);
            }
            unallocated = available;
            if (unallocated.signum() > 0) {
                log.debug("{}: {} could not be deposited anywhere", year, Money.round(unallocated));
            }
        }
        BigDecimal liquidated = BigDecimal.ZERO;
        for (Asset asset : state.getLiquidationOrder()) {
            BigDecimal owed = debt.outstandingDebt();
            if (owed.signum() == 0) {
                break;
            }
            BigDecimal withdrawn = asset.withdraw(owed);
            debt.deposit(withdrawn);
            liquidated = liquidated.add(withdrawn, MATH_CONTEXT);
        }
        if (liquidated.signum() > 0) {
            log.debug("{}: sold {} of assets to repay debt", year, Money.round(liquidated));
        }

        // Phase 5: growth
        for (Asset asset : state.allAssets()) {
            asset.grow(year);
        }
        for (Portfolio portfolio : state.getPortfolios()) {
            portfolio.rebalance();
        }

        // Phase 6: record and evolve flows
        for (CashFlow flow : state.allFlows()) {
            flow.evolve();
        }
        BigDecimal netWorth = BigDecimal.ZERO;
        for (Asset asset : state.allAssets()) {
            asset.record();
            netWorth = netWorth.add(asset.getCurrentValue(), MATH_CONTEXT);
        }
        state.completeYear();

        YearSnapshot.YearSnapshotBuilder snapshot = YearSnapshot.builder()
                .year(year)
                .grossRevenue(grossRevenue)
                .totalExpenses(totalExpenses)
                .grossFlow(grossFlow)
                .pretaxDeposits(pretaxDeposits)
                .taxableIncome(taxableIncome)
                .taxPaid(taxPaid)
                .debtRepaid(debtRepaid)
                .distributed(distributed)
                .liquidated(liquidated)
                .unallocated(unallocated)
                .debtEnd(debt.outstandingDebt())
                .netWorthEnd(netWorth);
        for (LifeEvent event : fired) {
            snapshot.eventFired(event.getName());
        }
        return snapshot.build();
    }

    // taxable revenues grouped by jurisdiction, in declaration order
    private static Map<String, List<Revenue>> taxableByJurisdiction(TrialState state) {
        Map<String, List<Revenue>> groups = new LinkedHashMap<>();
        for (Revenue revenue : state.getRevenues()) {
            if (revenue.isTaxable()) {
                groups.computeIfAbsent(revenue.getJurisdiction(), j -> new ArrayList<>()).add(revenue);
            }
        }
        return groups;
    }

    private static BigDecimal sum(List<? extends CashFlow> flows) {
        BigDecimal total = BigDecimal.ZERO;
        for (CashFlow flow : flows) {
            total = total.add(flow.getCurrentValue(), MATH_CONTEXT);
        }
        return total;
    }
}
