package com.example.edgechasing.detection;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs of a simulation run.
 *
 * @param runBudget       how long each process keeps running its pass loop
 * @param requestTimeout  wait after which an unsatisfied request is suspected to be deadlocked
 * @param usageTime       hold time after which a granted resource is given back
 * @param passInterval    sleep between two passes of a process
 */
public record SimulationSettings(Duration runBudget, Duration requestTimeout, Duration usageTime, Duration passInterval) {

    public SimulationSettings {
        requirePositive(runBudget, "runBudget");
        requirePositive(requestTimeout, "requestTimeout");
        requirePositive(usageTime, "usageTime");
        requirePositive(passInterval, "passInterval");
    }

    public static SimulationSettings defaults() {
        return new SimulationSettings(Duration.ofSeconds(60), Duration.ofSeconds(5),
                Duration.ofSeconds(10), Duration.ofSeconds(5));
    }

    /**
     * Defaults overridden by -Dsim.runMillis, -Dsim.requestTimeoutMillis,
     * -Dsim.usageMillis and -Dsim.passIntervalMillis.
     */
    public static SimulationSettings fromSystemProperties() {
        SimulationSettings d = defaults();
        return new SimulationSettings(
                millis("sim.runMillis", d.runBudget()),
                millis("sim.requestTimeoutMillis", d.requestTimeout()),
                millis("sim.usageMillis", d.usageTime()),
                millis("sim.passIntervalMillis", d.passInterval()));
    }

    private static Duration millis(String property, Duration fallback) {
        return Duration.ofMillis(Long.getLong(property, fallback.toMillis()));
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive but was " + d);
        }
    }
}
