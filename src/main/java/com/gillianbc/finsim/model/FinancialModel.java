package com.gillianbc.finsim.model;

import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.model.event.Action;
import com.gillianbc.finsim.model.event.EventScheduler;
import com.gillianbc.finsim.model.event.LifeEvent;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated configuration of one person's finances. Immutable from the engine's point of
 * view: trials never run on these instances, only on copies made by {@link #newTrial}.
 * <p>
 * Distribution order for surplus cash is the declared order of {@code assets} (pre-tax
 * ones excluded) followed by {@code portfolios}.
 */
@Getter
public class FinancialModel {

    public static final String DEFAULT_DEBT_ACCOUNT = "Debt";

    private final int startYear;
    private final int duration;
    private final List<Revenue> revenues;
    private final List<Expense> expenses;
    private final List<Asset> assets;
    private final List<Portfolio> portfolios;
    private final List<LifeEvent> events;
    private final Asset debtAccount;
    /** Uncapped asset that absorbs surplus nothing else accepts; null means report it. */
    private final String fallbackAsset;
    /** Assets drawn down, in order, to clear debt left at the end of the distribution phase. */
    private final List<String> liquidationOrder;
    /** Base seed for Monte Carlo runs; null defers to the configured default. */
    private final Long seed;

    @Builder
    public FinancialModel(int startYear,
                          int duration,
                          @Singular List<Revenue> revenues,
                          @Singular List<Expense> expenses,
                          @Singular List<Asset> assets,
                          @Singular List<Portfolio> portfolios,
                          @Singular List<LifeEvent> events,
                          Asset debtAccount,
                          String fallbackAsset,
                          @Singular("liquidate") List<String> liquidationOrder,
                          Long seed) {
        if (duration <= 0) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL, "duration must be positive");
        }
        this.startYear = startYear;
        this.duration = duration;
        this.revenues = List.copyOf(revenues);
        this.expenses = List.copyOf(expenses);
        this.assets = List.copyOf(assets);
        this.portfolios = List.copyOf(portfolios);
        this.events = List.copyOf(events);
        this.debtAccount = debtAccount != null
                ? debtAccount
                : Asset.debtAccount(DEFAULT_DEBT_ACCOUNT, BigDecimal.ZERO, BigDecimal.ZERO);
        this.fallbackAsset = fallbackAsset;
        this.liquidationOrder = List.copyOf(liquidationOrder);
        this.seed = seed;
        validate();
    }

    private void validate() {
        if (!debtAccount.isDebtAllowed()) {
            throw new ConfigurationException(ErrorCode.INVALID_MODEL,
                    "debt account " + debtAccount.getName() + " must be created with Asset.debtAccount()");
        }
        for (Asset asset : assets) {
            if (asset.isDebtAllowed()) {
                throw new ConfigurationException(ErrorCode.INVALID_MODEL,
                        "only the designated debt account may go negative, not " + asset.getName());
            }
        }

        Map<String, Adjustable> byName = namedObjects();

        if (fallbackAsset != null) {
            Adjustable fallback = byName.get(fallbackAsset);
            if (!(fallback instanceof Asset)) {
                throw new ConfigurationException(ErrorCode.INVALID_MODEL, "fallback asset " + fallbackAsset + " not found");
            }
            if (((Asset) fallback).isCapped()) {
                throw new ConfigurationException(ErrorCode.INVALID_MODEL, "fallback asset " + fallbackAsset + " must be uncapped");
            }
        }
        for (String name : liquidationOrder) {
            Adjustable candidate = byName.get(name);
            if (!(candidate instanceof Asset) || ((Asset) candidate).isDebtAllowed()) {
                throw new ConfigurationException(ErrorCode.INVALID_MODEL,
                        "liquidation order names " + name + ", which is not an investment asset");
            }
        }

        new EventScheduler(startYear, duration).schedule(events);
        for (LifeEvent event : events) {
            for (Action action : event.getActions()) {
                Adjustable target = byName.get(action.getTarget());
                if (target == null) {
                    throw new ConfigurationException(ErrorCode.MALFORMED_ACTION,
                            "event " + event.getName() + " targets unknown object " + action.getTarget(),
                            Map.of("event", event.getName(), "target", action.getTarget()));
                }
                action.validateTarget(target);
                if (action.isCapChange() && (target == debtAccount || action.getTarget().equals(fallbackAsset))) {
                    throw new ConfigurationException(ErrorCode.MALFORMED_ACTION,
                            "event " + event.getName() + " would cap " + action.getTarget() + ", which must stay uncapped");
                }
            }
        }
    }

    // every flow and asset by name, rejecting duplicates
    private Map<String, Adjustable> namedObjects() {
        Map<String, Adjustable> byName = new LinkedHashMap<>();
        List<Adjustable> all = new ArrayList<>();
        all.addAll(revenues);
        all.addAll(expenses);
        all.addAll(assets);
        for (Portfolio portfolio : portfolios) {
            all.addAll(portfolio.getMembers());
        }
        all.add(debtAccount);
        for (Adjustable item : all) {
            if (byName.putIfAbsent(item.getName(), item) != null) {
                throw new ConfigurationException(ErrorCode.INVALID_MODEL, "duplicate name " + item.getName());
            }
        }
        return byName;
    }

    /** Every asset in seed-derivation order: standalone, portfolio members, debt account. */
    public List<Asset> allAssets() {
        List<Asset> all = new ArrayList<>(assets);
        for (Portfolio portfolio : portfolios) {
            all.addAll(portfolio.getMembers());
        }
        all.add(debtAccount);
        return all;
    }

    public boolean hasStochasticGrowth() {
        return allAssets().stream().anyMatch(asset -> asset.getGrowthRule().isStochastic());
    }

    /**
     * Fresh, private copy of every object for one trial. Each asset's sampler is seeded from
     * {@code trialSeed} and the asset's position in {@link #allAssets()}.
     */
    public TrialState newTrial(long trialSeed) {
        return new TrialState(this, trialSeed);
    }
}
