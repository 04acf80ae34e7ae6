package com.trigger.config;

/**
 * Rule batch dispatch configuration.
 *
 * @param maxInFlightBatches Maximum number of rule batches running at once, 0 for no limit
 */
public record DispatchConfig(
        int maxInFlightBatches
) {
    public static DispatchConfig unbounded() {
        return new DispatchConfig(0);
    }

    public boolean isBounded() {
        return maxInFlightBatches > 0;
    }
}
