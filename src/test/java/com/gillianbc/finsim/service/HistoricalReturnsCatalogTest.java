package com.gillianbc.finsim.service;

import com.gillianbc.finsim.FinsimTestSupport;
import com.gillianbc.finsim.config.ReferenceDataProperties;
import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.model.growth.HistoricalGrowthRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.gillianbc.finsim.FinsimTestSupport.amount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HistoricalReturnsCatalogTest {

    private final HistoricalReturnsCatalog catalog = new HistoricalReturnsCatalog(FinsimTestSupport.referenceData());

    @Test
    @DisplayName("Shipped reference data has fifty years of stock and bond returns")
    void categories_shippedData() {
        assertTrue(catalog.categories().containsAll(List.of("stocks", "bonds")));
        assertEquals(50, catalog.historical("stocks").getReturns().size());
        assertEquals(50, catalog.historical("bonds").getReturns().size());
    }

    @Test
    @DisplayName("Category lookup ignores case")
    void historical_mixedCase_found() {
        HistoricalGrowthRule rule = catalog.historical("Stocks");
        assertEquals("stocks", rule.getCategory());
        assertTrue(rule.isStochastic());
    }

    @Test
    @DisplayName("Unknown category is a configuration error")
    void historical_unknownCategory_throws() {
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> catalog.historical("gold"));
        assertEquals(ErrorCode.UNKNOWN_GROWTH_CATEGORY, ex.getErrorCode());
    }

    @Test
    @DisplayName("Mean return is the arithmetic mean of the series")
    void meanReturn_smallSeries() {
        ReferenceDataProperties data = new ReferenceDataProperties();
        data.setHistoricalReturns(Map.of("test", List.of(amount("0.10"), amount("-0.05"), amount("0.04"))));
        HistoricalReturnsCatalog small = new HistoricalReturnsCatalog(data);
        assertEquals(0, amount("0.03").compareTo(small.meanReturn("test")));
    }

    @Test
    @DisplayName("Returns below -100% are rejected")
    void constructor_returnBelowMinusOne_throws() {
        ReferenceDataProperties data = new ReferenceDataProperties();
        data.setHistoricalReturns(Map.of("bad", List.of(amount("0.05"), amount("-1.2"))));
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> new HistoricalReturnsCatalog(data));
        assertEquals(ErrorCode.INVALID_REFERENCE_DATA, ex.getErrorCode());
    }

    @Test
    @DisplayName("Empty series are rejected")
    void constructor_emptySeries_throws() {
        ReferenceDataProperties data = new ReferenceDataProperties();
        data.setHistoricalReturns(Map.of("empty", List.of()));
        assertThrows(ConfigurationException.class, () -> new HistoricalReturnsCatalog(data));
    }
}
