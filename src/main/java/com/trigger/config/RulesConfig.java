package com.trigger.config;

/**
 * Rule discovery configuration.
 *
 * @param directory Directory scanned for rule files
 * @param suffix    File name suffix selecting rule files
 */
public record RulesConfig(
        String directory,
        String suffix
) {
    public static final String DEFAULT_DIRECTORY = "./rules";
    public static final String DEFAULT_SUFFIX = ".rule";

    public static RulesConfig defaults() {
        return new RulesConfig(DEFAULT_DIRECTORY, DEFAULT_SUFFIX);
    }
}
