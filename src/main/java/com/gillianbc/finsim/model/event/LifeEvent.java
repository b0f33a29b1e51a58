package com.gillianbc.finsim.model.event;

import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * A scheduled, one-time set of parameter mutations (retirement, buying a house, ...).
 * Immutable; whether it has fired is tracked per trial by the scheduler.
 */
@Getter
public class LifeEvent {

    private final String name;
    private final int year;
    private final YearBasis yearBasis;
    private final List<Action> actions;

    @Builder
    public LifeEvent(String name, int year, YearBasis yearBasis, @Singular List<Action> actions) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException(ErrorCode.MALFORMED_ACTION, "event name must not be blank");
        }
        if (actions == null || actions.isEmpty()) {
            throw new ConfigurationException(ErrorCode.MALFORMED_ACTION, "event " + name + " has no actions");
        }
        this.name = name;
        this.year = year;
        this.yearBasis = yearBasis == null ? YearBasis.ABSOLUTE : yearBasis;
        this.actions = List.copyOf(actions);
    }

    public int resolveYear(int startYear) {
        return yearBasis == YearBasis.RELATIVE ? startYear + year : year;
    }

    @Override
    public String toString() {
        return "LifeEvent(" + name + ", " + yearBasis.name().toLowerCase() + " year " + year + ", " + actions + ")";
    }
}
