package com.gillianbc.finsim.service;

import com.gillianbc.finsim.FinsimTestSupport;
import com.gillianbc.finsim.config.ReferenceDataProperties;
import com.gillianbc.finsim.config.TaxBracket;
import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import com.gillianbc.finsim.model.FinancialModel;
import com.gillianbc.finsim.model.Revenue;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.gillianbc.finsim.FinsimTestSupport.amount;
import static com.gillianbc.finsim.FinsimTestSupport.assertAmount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class TaxServiceTest {

    private final TaxService service = new TaxService(FinsimTestSupport.referenceData());

    @Test
    @DisplayName("Federal tax on 70,000 sums the 10%, 12% and 22% bands")
    void federalTax_seventyThousand_sumsBands() {
        // 11000*0.10 + 33725*0.12 + 25275*0.22 = 1100 + 4047 + 5560.50
        assertAmount("10707.50", service.federalTax(amount("70000")));
    }

    @Test
    @DisplayName("Massachusetts adds a flat 5% on top of federal tax")
    void computeTax_massachusetts_addsFlatStateRate() {
        assertAmount("14207.50", service.computeTax(amount("70000"), "MA"));
    }

    @Test
    @DisplayName("States without income tax contribute nothing")
    void computeTax_texas_federalOnly() {
        assertAmount("10707.50", service.computeTax(amount("70000"), "TX"));
        assertAmount("0", service.stateTax(amount("70000"), "TX"));
    }

    @Test
    @DisplayName("Progressive state schedule is applied band by band (California, 50,000)")
    void stateTax_california_progressive() {
        // 93.25 + 255.64 + 511.40 + 812.58 + 125.20
        assertAmount("1798.07", service.stateTax(amount("50000"), "CA"));
    }

    @Test
    @DisplayName("Income inside a zero-rate first band is not taxed (Ohio, 20,000)")
    void stateTax_ohioZeroBand_noTax() {
        assertAmount("0", service.stateTax(amount("20000"), "OH"));
    }

    @Test
    @DisplayName("Zero and negative income owe no tax")
    void computeTax_nonPositiveIncome_zero() {
        assertAmount("0", service.computeTax(BigDecimal.ZERO, "MA"));
        assertAmount("0", service.computeTax(amount("-500"), "MA"));
    }

    @Test
    @DisplayName("Jurisdiction codes are case insensitive")
    void computeTax_lowerCaseJurisdiction_matches() {
        assertEquals(service.computeTax(amount("70000"), "MA"), service.computeTax(amount("70000"), " ma "));
    }

    @Test
    @DisplayName("Unknown jurisdiction is a configuration error")
    void computeTax_unknownJurisdiction_throws() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> service.computeTax(amount("70000"), "ZZ"));
        assertEquals(ErrorCode.UNKNOWN_JURISDICTION, ex.getErrorCode());
        assertEquals("ZZ", ex.getDetails().get("jurisdiction"));
    }

    @Test
    @DisplayName("Marginal rate combines federal and state brackets")
    void marginalRate_seventyThousandMassachusetts() {
        assertEquals(0, amount("0.27").compareTo(service.marginalRate(amount("70000"), "MA")));
    }

    @Test
    @DisplayName("Known jurisdictions include untaxed states; null is never known")
    void isKnownJurisdiction() {
        assertTrue(service.isKnownJurisdiction("CA"));
        assertTrue(service.isKnownJurisdiction("FL"));
        assertFalse(service.isKnownJurisdiction("ZZ"));
        assertFalse(service.isKnownJurisdiction(null));
    }

    @Test
    @DisplayName("A model with a taxable revenue in an unknown state is rejected up front")
    void requireJurisdictions_unknownState_throws() {
        FinancialModel model = FinancialModel.builder()
                .startYear(2024)
                .duration(1)
                .revenue(Revenue.builder().name("Salary").initialValue(amount("1000")).jurisdiction("XX").build())
                .build();
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> service.requireJurisdictions(model));
        assertEquals(ErrorCode.UNKNOWN_JURISDICTION, ex.getErrorCode());
    }

    @Test
    @DisplayName("A schedule that does not start at zero is invalid reference data")
    void constructor_scheduleNotStartingAtZero_throws() {
        ReferenceDataProperties data = new ReferenceDataProperties();
        data.setFederal(List.of(new TaxBracket(amount("100"), amount("0.1"))));
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> new TaxService(data));
        assertEquals(ErrorCode.INVALID_REFERENCE_DATA, ex.getErrorCode());
    }

    @Test
    @DisplayName("Thresholds must strictly increase")
    void constructor_decreasingThresholds_throws() {
        ReferenceDataProperties data = new ReferenceDataProperties();
        data.setFederal(List.of(
                new TaxBracket(amount("0"), amount("0.1")),
                new TaxBracket(amount("5000"), amount("0.2")),
                new TaxBracket(amount("5000"), amount("0.3"))));
        assertThrows(ConfigurationException.class, () -> new TaxService(data));
    }

    @Test
    @DisplayName("Rates above 100% are rejected")
    void constructor_rateAboveOne_throws() {
        ReferenceDataProperties data = new ReferenceDataProperties();
        data.setFederal(List.of(new TaxBracket(amount("0"), amount("1.5"))));
        assertThrows(ConfigurationException.class, () -> new TaxService(data));
    }
}
