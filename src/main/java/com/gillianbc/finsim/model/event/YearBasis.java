package com.gillianbc.finsim.model.event;

public enum YearBasis {
    /** Calendar year, e.g. 2030. */
    ABSOLUTE,
    /** Offset from the simulation start year; 0 is the first simulated year. */
    RELATIVE
}
