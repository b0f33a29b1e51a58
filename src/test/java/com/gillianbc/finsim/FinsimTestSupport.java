package com.gillianbc.finsim;

import com.gillianbc.finsim.config.ReferenceDataProperties;
import com.gillianbc.finsim.model.Money;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Reference data bound from the shipped {@code application.yml}, for tests that build
 * services by hand instead of starting a Spring context.
 */
public final class FinsimTestSupport {

    private static ReferenceDataProperties referenceData;

    private FinsimTestSupport() {
    }

    public static synchronized ReferenceDataProperties referenceData() {
        if (referenceData == null) {
            try {
                List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                        .load("application", new ClassPathResource("application.yml"));
                referenceData = new Binder(ConfigurationPropertySources.from(sources))
                        .bind("finsim.reference", ReferenceDataProperties.class)
                        .get();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return referenceData;
    }

    public static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    /** Compares at 2 dp so tests read like the ledger. */
    public static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(new BigDecimal(expected).setScale(Money.SCALE), Money.round(actual));
    }
}
