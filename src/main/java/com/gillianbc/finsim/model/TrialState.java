package com.gillianbc.finsim.model;

import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.exception.SimulationException;
import com.gillianbc.finsim.model.event.ActionTargets;
import com.gillianbc.finsim.model.event.EventScheduler;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one trial mutates. Built from a {@link FinancialModel} by deep copy, never
 * shared with another trial.
 */
@Getter
public class TrialState implements ActionTargets {

    private final int startYear;
    private final int duration;
    private final long seed;
    private final List<Revenue> revenues = new ArrayList<>();
    private final List<Expense> expenses = new ArrayList<>();
    private final List<Asset> assets = new ArrayList<>();
    private final List<Portfolio> portfolios = new ArrayList<>();
    private final Asset debtAccount;
    private final Asset fallbackAsset;
    private final List<Asset> liquidationOrder = new ArrayList<>();
    private final EventScheduler scheduler;
    private final Map<String, Adjustable> byName = new LinkedHashMap<>();
    private int completedYears;

    TrialState(FinancialModel model, long seed) {
        this.startYear = model.getStartYear();
        this.duration = model.getDuration();
        this.seed = seed;

        for (Revenue revenue : model.getRevenues()) {
            revenues.add(register(revenue.copy()));
        }
        for (Expense expense : model.getExpenses()) {
            expenses.add(register(expense.copy()));
        }

        List<Asset> templates = model.allAssets();
        Map<String, Asset> assetCopies = new LinkedHashMap<>();
        for (int i = 0; i < templates.size(); i++) {
            Asset copy = register(templates.get(i).copyForTrial(SeedDerivation.derive(seed, i)));
            assetCopies.put(copy.getName(), copy);
        }
        for (Asset asset : model.getAssets()) {
            assets.add(assetCopies.get(asset.getName()));
        }
        for (Portfolio portfolio : model.getPortfolios()) {
            portfolios.add(portfolio.copyWith(assetCopies));
        }
        this.debtAccount = assetCopies.get(model.getDebtAccount().getName());
        this.fallbackAsset = model.getFallbackAsset() == null ? null : assetCopies.get(model.getFallbackAsset());
        for (String name : model.getLiquidationOrder()) {
            liquidationOrder.add(assetCopies.get(name));
        }

        this.scheduler = new EventScheduler(startYear, duration);
        scheduler.schedule(model.getEvents());
    }

    private <T extends Adjustable> T register(T item) {
        byName.put(item.getName(), item);
        return item;
    }

    @Override
    public Adjustable resolve(String name, int year) {
        Adjustable target = byName.get(name);
        if (target == null) {
            throw new SimulationException(ErrorCode.UNKNOWN_TARGET, "no flow or asset named " + name, year);
        }
        return target;
    }

    /** Standalone assets, portfolio members and the debt account. */
    public List<Asset> allAssets() {
        List<Asset> all = new ArrayList<>(assets);
        for (Portfolio portfolio : portfolios) {
            all.addAll(portfolio.getMembers());
        }
        all.add(debtAccount);
        return all;
    }

    public List<CashFlow> allFlows() {
        List<CashFlow> flows = new ArrayList<>(revenues);
        flows.addAll(expenses);
        return flows;
    }

    public int nextYear() {
        return startYear + completedYears;
    }

    public boolean isComplete() {
        return completedYears >= duration;
    }

    /** Called by the engine once a year has been fully applied. */
    public void completeYear() {
        completedYears++;
    }

    public Map<String, Adjustable> getByName() {
        return Collections.unmodifiableMap(byName);
    }
}
