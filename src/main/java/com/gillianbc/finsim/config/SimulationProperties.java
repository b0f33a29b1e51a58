package com.gillianbc.finsim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Monte Carlo run settings.
 *
 * <p>Properties prefix: {@code finsim.simulation.*}
 * <ul>
 *   <li>parallelism: worker threads for trials, 0 means one per available processor</li>
 *   <li>baseSeed: seed used when a run does not supply its own</li>
 *   <li>awaitTimeoutMinutes: how long {@code SimulationRun.await()} waits for the pool</li>
 * </ul>
 */
@Data
@ConfigurationProperties(prefix = "finsim.simulation")
public class SimulationProperties {

    private int parallelism = 0;
    private long baseSeed = 42L;
    private long awaitTimeoutMinutes = 60;

    public int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }
}
