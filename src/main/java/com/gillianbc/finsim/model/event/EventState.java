package com.gillianbc.finsim.model.event;

/** One-way: UNFIRED to FIRED, exactly once per trial. */
public enum EventState {
    UNFIRED,
    FIRED
}
