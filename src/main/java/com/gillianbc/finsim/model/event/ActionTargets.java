package com.gillianbc.finsim.model.event;

import com.gillianbc.finsim.model.Adjustable;
import com.gillianbc.finsim.model.Asset;

/**
 * The trial-scoped objects an action can reach.
 */
public interface ActionTargets {

    /**
     * @throws com.gillianbc.finsim.exception.SimulationException when no object has that name
     */
    Adjustable resolve(String name, int year);

    Asset getDebtAccount();
}
