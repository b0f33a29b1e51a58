package com.gillianbc.finsim.model.result;

import com.gillianbc.finsim.model.Asset;
import com.gillianbc.finsim.model.CashFlow;
import com.gillianbc.finsim.model.TrialState;
import com.gillianbc.finsim.model.YearSnapshot;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one completed trial: every object's per-year history (index 0 is the start
 * year) and the per-year ledger.
 */
@Getter
public class TrialResult {

    private final int trialIndex;
    private final long seed;
    private final Map<String, List<BigDecimal>> histories;
    private final List<YearSnapshot> ledger;

    public TrialResult(int trialIndex, long seed, Map<String, List<BigDecimal>> histories, List<YearSnapshot> ledger) {
        this.trialIndex = trialIndex;
        this.seed = seed;
        Map<String, List<BigDecimal>> copy = new LinkedHashMap<>();
        histories.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.histories = Collections.unmodifiableMap(copy);
        this.ledger = List.copyOf(ledger);
    }

    public static TrialResult of(int trialIndex, TrialState state, List<YearSnapshot> ledger) {
        Map<String, List<BigDecimal>> histories = new LinkedHashMap<>();
        for (CashFlow flow : state.allFlows()) {
            histories.put(flow.getName(), flow.getHistory());
        }
        for (Asset asset : state.allAssets()) {
            histories.put(asset.getName(), asset.getHistory());
        }
        return new TrialResult(trialIndex, state.getSeed(), histories, ledger);
    }

    public List<BigDecimal> history(String name) {
        List<BigDecimal> values = histories.get(name);
        if (values == null) {
            throw new IllegalArgumentException("no flow or asset named " + name);
        }
        return values;
    }

    public BigDecimal finalValue(String name) {
        List<BigDecimal> values = history(name);
        return values.get(values.size() - 1);
    }
}
