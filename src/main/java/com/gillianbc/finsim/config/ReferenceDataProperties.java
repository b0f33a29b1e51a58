package com.gillianbc.finsim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Versioned reference data consumed by the engine: marginal tax schedules and historical
 * annual return series.
 *
 * <p>Properties prefix: {@code finsim.reference.*}. The defaults shipped in
 * {@code application.yml} are the 2023 US federal schedule, a handful of state schedules
 * and annual US equity and treasury bond returns. Any Spring property source can replace
 * them.
 */
@Data
@ConfigurationProperties(prefix = "finsim.reference")
public class ReferenceDataProperties {

    /** Label of the reference data set, logged when the services start. */
    private String version = "unversioned";

    private List<TaxBracket> federal = new ArrayList<>();

    /** State schedules keyed by jurisdiction code (e.g. MA, CA). */
    private Map<String, List<TaxBracket>> states = new LinkedHashMap<>();

    /** Jurisdictions that levy no state income tax. */
    private Set<String> noIncomeTaxStates = new LinkedHashSet<>();

    /** Annual returns as fractions (0.05 = 5%), keyed by growth category. */
    private Map<String, List<BigDecimal>> historicalReturns = new LinkedHashMap<>();
}
