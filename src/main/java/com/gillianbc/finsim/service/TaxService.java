package com.gillianbc.finsim.service;

import com.gillianbc.finsim.config.ReferenceDataProperties;
import com.gillianbc.finsim.config.TaxBracket;
import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.model.FinancialModel;
import com.gillianbc.finsim.model.Revenue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.gillianbc.finsim.model.Money.MATH_CONTEXT;

/**
 * Progressive income tax: federal schedule plus the schedule of the revenue's state.
 * <p>
 * A schedule is an ordered list of (threshold, rate) rows. Liability is the sum over rows
 * of {@code rate * (min(income, nextThreshold) - threshold)} for every row whose threshold
 * lies below the income, i.e. full bands below the income plus the marginal rate on the
 * remainder. States listed as levying no income tax contribute zero.
 * <p>
 * Schedules are validated once at construction and are read-only afterwards, so the
 * service is safe to share between trial threads.
 */
@Slf4j
@Service
public class TaxService {

    private final List<TaxBracket> federal;
    private final Map<String, List<TaxBracket>> states = new LinkedHashMap<>();
    private final Set<String> noIncomeTaxStates = new LinkedHashSet<>();

    public TaxService(ReferenceDataProperties referenceData) {
        Objects.requireNonNull(referenceData, "referenceData must not be null");
        this.federal = validated("federal", referenceData.getFederal());
        referenceData.getStates().forEach((state, brackets) ->
                states.put(normalise(state), validated(state, brackets)));
        referenceData.getNoIncomeTaxStates().forEach(state -> noIncomeTaxStates.add(normalise(state)));
        log.info("Tax schedules loaded from reference data {}: federal {} brackets, {} state schedules, {} untaxed states",
                referenceData.getVersion(), federal.size(), states.size(), noIncomeTaxStates.size());
    }

    /**
     * Federal plus state liability on {@code income}.
     *
     * @throws ConfigurationException for a jurisdiction with no schedule
     */
    public BigDecimal computeTax(BigDecimal income, String jurisdiction) {
        Objects.requireNonNull(income, "income must not be null");
        BigDecimal stateTax = stateTax(income, jurisdiction);
        return federalTax(income).add(stateTax, MATH_CONTEXT);
    }

    public BigDecimal federalTax(BigDecimal income) {
        return liability(income, federal);
    }

    public BigDecimal stateTax(BigDecimal income, String jurisdiction) {
        List<TaxBracket> schedule = stateSchedule(jurisdiction);
        return schedule == null ? BigDecimal.ZERO : liability(income, schedule);
    }

    /** Combined federal and state rate applying to the next unit of income. */
    public BigDecimal marginalRate(BigDecimal income, String jurisdiction) {
        List<TaxBracket> schedule = stateSchedule(jurisdiction);
        BigDecimal stateRate = schedule == null ? BigDecimal.ZERO : marginal(income, schedule);
        return marginal(income, federal).add(stateRate);
    }

    public boolean isKnownJurisdiction(String jurisdiction) {
        if (jurisdiction == null) {
            return false;
        }
        String key = normalise(jurisdiction);
        return states.containsKey(key) || noIncomeTaxStates.contains(key);
    }

    /**
     * Fails before any trial starts if a taxable revenue names a jurisdiction without a
     * schedule.
     */
    public void requireJurisdictions(FinancialModel model) {
        for (Revenue revenue : model.getRevenues()) {
            if (revenue.isTaxable()) {
                stateSchedule(revenue.getJurisdiction());
            }
        }
    }

    // null for a state without income tax
    private List<TaxBracket> stateSchedule(String jurisdiction) {
        if (!isKnownJurisdiction(jurisdiction)) {
            throw new ConfigurationException(ErrorCode.UNKNOWN_JURISDICTION,
                    "no tax schedule for jurisdiction " + jurisdiction,
                    Map.of("jurisdiction", String.valueOf(jurisdiction)));
        }
        return states.get(normalise(jurisdiction));
    }

    static BigDecimal liability(BigDecimal income, List<TaxBracket> schedule) {
        if (income.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal tax = BigDecimal.ZERO;
        for (int i = 0; i < schedule.size(); i++) {
            BigDecimal lower = schedule.get(i).getThreshold();
            if (income.compareTo(lower) <= 0) {
                break;
            }
            BigDecimal upper = i + 1 < schedule.size() ? schedule.get(i + 1).getThreshold() : null;
            BigDecimal top = upper == null ? income : income.min(upper);
            tax = tax.add(top.subtract(lower).multiply(schedule.get(i).getRate(), MATH_CONTEXT), MATH_CONTEXT);
        }
        return tax;
    }

    private static BigDecimal marginal(BigDecimal income, List<TaxBracket> schedule) {
        BigDecimal rate = BigDecimal.ZERO;
        for (TaxBracket bracket : schedule) {
            if (income.compareTo(bracket.getThreshold()) < 0) {
                break;
            }
            rate = bracket.getRate();
        }
        return rate;
    }

    private static List<TaxBracket> validated(String name, List<TaxBracket> brackets) {
        if (brackets == null || brackets.isEmpty()) {
            throw new ConfigurationException(ErrorCode.INVALID_REFERENCE_DATA, "tax schedule " + name + " is empty");
        }
        BigDecimal previous = null;
        for (TaxBracket bracket : brackets) {
            if (bracket.getThreshold() == null || bracket.getRate() == null) {
                throw new ConfigurationException(ErrorCode.INVALID_REFERENCE_DATA,
                        "tax schedule " + name + " has an incomplete bracket");
            }
            if (previous == null && bracket.getThreshold().signum() != 0) {
                throw new ConfigurationException(ErrorCode.INVALID_REFERENCE_DATA,
                        "tax schedule " + name + " must start at threshold 0");
            }
            if (previous != null && bracket.getThreshold().compareTo(previous) <= 0) {
                throw new ConfigurationException(ErrorCode.INVALID_REFERENCE_DATA,
                        "tax schedule " + name + " thresholds must increase");
            }
            if (bracket.getRate().signum() < 0 || bracket.getRate().compareTo(BigDecimal.ONE) > 0) {
                throw new ConfigurationException(ErrorCode.INVALID_REFERENCE_DATA,
                        "tax schedule " + name + " has a rate outside 0..1");
            }
            previous = bracket.getThreshold();
        }
        return brackets.stream()
                .map(bracket -> new TaxBracket(bracket.getThreshold(), bracket.getRate()))
                .toList();
    }

    private static String normalise(String jurisdiction) {
        return jurisdiction.trim().toUpperCase(Locale.ROOT);
    }
}
