package com.gillianbc.finsim.service;

import com.gillianbc.finsim.config.ReferenceDataProperties;
import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.model.growth.HistoricalGrowthRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.gillianbc.finsim.model.Money.MATH_CONTEXT;

/**
 * Historical annual return series by growth category (stocks, bonds, ...), and the
 * factory for growth rules that sample from them.
 */
@Slf4j
@Service
public class HistoricalReturnsCatalog {

    private final Map<String, HistoricalGrowthRule> rules = new LinkedHashMap<>();

    public HistoricalReturnsCatalog(ReferenceDataProperties referenceData) {
        referenceData.getHistoricalReturns().forEach((category, returns) -> {
            if (returns == null || returns.isEmpty()) {
                throw new ConfigurationException(ErrorCode.INVALID_REFERENCE_DATA,
                        "historical return series " + category + " is empty");
            }
            for (BigDecimal annual : returns) {
                if (annual == null || annual.compareTo(BigDecimal.ONE.negate()) < 0) {
                    throw new ConfigurationException(ErrorCode.INVALID_REFERENCE_DATA,
                            "historical return series " + category + " contains a return below -100%");
                }
            }
            String key = normalise(category);
            rules.put(key, new HistoricalGrowthRule(key, returns));
        });
        log.info("Historical return series loaded from reference data {}: {}", referenceData.getVersion(), rules.keySet());
    }

    /**
     * @throws ConfigurationException when the category has no series
     */
    public HistoricalGrowthRule historical(String category) {
        HistoricalGrowthRule rule = category == null ? null : rules.get(normalise(category));
        if (rule == null) {
            throw new ConfigurationException(ErrorCode.UNKNOWN_GROWTH_CATEGORY,
                    "no historical returns for growth category " + category,
                    Map.of("category", String.valueOf(category), "known", rules.keySet()));
        }
        return rule;
    }

    public Set<String> categories() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    /** Arithmetic mean of the category's annual returns. */
    public BigDecimal meanReturn(String category) {
        List<BigDecimal> returns = historical(category).getReturns();
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal annual : returns) {
            sum = sum.add(annual);
        }
        return sum.divide(BigDecimal.valueOf(returns.size()), MATH_CONTEXT);
    }

    private static String normalise(String category) {
        return category.trim().toLowerCase(Locale.ROOT);
    }
}
