package com.gillianbc.finsim.model;

/**
 * Deterministic seed derivation, so a trial's draws depend only on (base seed, trial
 * index) and not on which worker runs it or when.
 */
public final class SeedDerivation {

    private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

    private SeedDerivation() {
    }

    public static long derive(long baseSeed, long index) {
        return mix64(baseSeed + GOLDEN_GAMMA * (index + 1));
    }

    // SplitMix64 finaliser
    private static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
