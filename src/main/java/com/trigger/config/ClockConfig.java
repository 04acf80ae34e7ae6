package com.trigger.config;

/**
 * Built-in clock configuration.
 *
 * @param enabled        Whether time and date variables are published
 * @param intervalMillis Publishing period
 */
public record ClockConfig(
        boolean enabled,
        long intervalMillis
) {
    public static ClockConfig defaults() {
        return new ClockConfig(true, 1000);
    }

    /**
     * Clock switched off, for tests that drive variables by hand.
     */
    public static ClockConfig disabled() {
        return new ClockConfig(false, 1000);
    }
}
