package com.gurukul.karmaLedger.config;

import com.gurukul.karmaLedger.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Loads the static karma tables once at process start and exposes them as a bean.
 *
 * A missing or malformed table is a startup failure: the engine has no sensible
 * behaviour without its multipliers and reward map.
 */
@Slf4j
@Configuration
public class KarmaConfigLoader {

    public static final String DEFAULT_RESOURCE = "karma/karma-config.json";

    @Bean
    public KarmaConfig karmaConfig(@Value("${karma.config.resource:" + DEFAULT_RESOURCE + "}") String resource) {
        return load(resource);
    }

    /**
     * Reads and validates a karma config from the classpath.
     *
     * @param resource classpath location of the JSON tables
     * @return immutable karma config
     * @throws IllegalStateException if the resource cannot be read or is incomplete
     */
    public static KarmaConfig load(String resource) {
        KarmaConfig config;
        try {
            config = JsonFileLoader.loadAsObject(resource, KarmaConfig.class);
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Failed to load karma config from " + resource, e);
        }
        validate(config, resource);
        log.info("Karma config loaded - resource: {}, severities: {}, paapActions: {}, rewards: {}, practices: {}",
                resource,
                config.severityMultipliers().size(),
                config.paapActions().size(),
                config.rewardMap().size(),
                config.correctivePractices().size());
        return config;
    }

    private static void validate(KarmaConfig config, String resource) {
        if (config == null) {
            throw new IllegalStateException("Karma config is empty: " + resource);
        }
        if (!config.severityMultipliers().containsKey(config.fallbackSeverity())) {
            throw new IllegalStateException("Fallback severity '" + config.fallbackSeverity()
                    + "' has no multiplier in " + resource);
        }
        if (config.roleLadder().isEmpty()) {
            throw new IllegalStateException("Role ladder is empty in " + resource);
        }
    }
}
