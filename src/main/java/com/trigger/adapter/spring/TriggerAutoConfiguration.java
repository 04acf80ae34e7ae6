package com.trigger.adapter.spring;

import com.trigger.config.ConfigLoader;
import com.trigger.config.EngineConfig;
import com.trigger.config.StoreConfig;
import com.trigger.rule.RuleManager;
import com.trigger.store.FileKeyValueStore;
import com.trigger.store.InMemoryKeyValueStore;
import com.trigger.store.KeyValueStore;
import com.trigger.variable.VariableManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Spring Boot auto-configuration for the trigger engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "trigger", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TriggerProperties.class)
public class TriggerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TriggerAutoConfiguration.class);

    private RuleManager ruleManager;

    @Bean
    @ConditionalOnMissingBean
    public EngineConfig engineConfig(TriggerProperties properties) {
        log.info("Loading engine configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore(EngineConfig config) {
        StoreConfig store = config.store();
        log.info("Creating {} variable store", store.type());
        return switch (store.type()) {
            case FILE -> new FileKeyValueStore(Paths.get(store.path()));
            case MEMORY -> new InMemoryKeyValueStore();
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public VariableManager variableManager(KeyValueStore store) {
        return new VariableManager(store);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleManager ruleManager(EngineConfig config, VariableManager variables, TriggerProperties properties) {
        log.info("Creating RuleManager: {}", config.name());
        this.ruleManager = new RuleManager(config, variables);
        if (properties.isAutoStart()) {
            ruleManager.start();
        }
        return this.ruleManager;
    }

    @PreDestroy
    public void shutdown() {
        if (ruleManager != null && !ruleManager.isShutdown()) {
            log.info("Shutting down RuleManager");
            ruleManager.shutdown();
        }
    }
}
