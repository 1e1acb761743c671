package com.keystone.core.engine;

/**
 * Sampling temperature for the next Plan call on a node, escalating with each rejection.
 */
public record TemperatureSchedule(double base, double step, double cap) {

    public TemperatureSchedule {
        if (base < 0 || step < 0 || cap < base) {
            throw new IllegalArgumentException(
                    "Invalid temperature schedule base=" + base + " step=" + step + " cap=" + cap);
        }
    }

    public static TemperatureSchedule from(OrchestratorProperties.Temperature config) {
        return new TemperatureSchedule(config.getBase(), config.getStep(), config.getCap());
    }

    /**
     * @param attempts rejected attempts so far
     */
    public double forAttempt(int attempts) {
        return Math.min(base + Math.max(0, attempts) * step, cap);
    }
}
