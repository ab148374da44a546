package in.ashwanthkumar.akbot.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads the JSON config and validates every instance before anything runs.
 */
@Slf4j
public class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static BotConfig load(File file) {
        if (!file.isFile()) {
            throw new ConfigurationException("Config file " + file.getAbsolutePath() + " doesn't exist");
        }
        BotConfig config;
        try {
            config = MAPPER.readValue(file, BotConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read config " + file.getAbsolutePath() + ": " + e.getMessage(), e);
        }
        log.info("Loaded {} strategies from {}", config.getStrategies().size(), file);
        return validate(config);
    }

    public static BotConfig parse(String json) {
        try {
            return validate(MAPPER.readValue(json, BotConfig.class));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed config: " + e.getOriginalMessage(), e);
        }
    }

    static BotConfig validate(BotConfig config) {
        if (config.getStrategies() == null || config.getStrategies().isEmpty()) {
            throw new ConfigurationException("No strategies configured");
        }
        Set<String> names = new HashSet<>();
        StrategyFactory factory = new StrategyFactory(config);
        for (StrategySettings settings : config.getStrategies()) {
            factory.validate(settings);
            if (!names.add(settings.getName())) {
                throw new ConfigurationException("Duplicate strategy name " + settings.getName());
            }
        }
        for (String name : config.getConsoleAllowList()) {
            if (!names.contains(name)) {
                log.warn("Console allow list names unknown strategy {}", name);
            }
        }
        return config;
    }
}
