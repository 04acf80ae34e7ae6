package com.trigger.config;

/**
 * Top-level engine configuration.
 *
 * @param name     Engine instance name (used in logs)
 * @param rules    Where rule files are discovered
 * @param store    Variable store backing
 * @param clock    Built-in clock settings
 * @param dispatch Rule batch dispatch settings
 */
public record EngineConfig(
        String name,
        RulesConfig rules,
        StoreConfig store,
        ClockConfig clock,
        DispatchConfig dispatch
) {
    /**
     * Default configuration: rules from {@code ./rules}, in-memory store, clock on, unbounded dispatch.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(
                "default",
                RulesConfig.defaults(),
                StoreConfig.memory(),
                ClockConfig.defaults(),
                DispatchConfig.unbounded()
        );
    }
}
