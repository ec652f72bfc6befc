package me.christianrobert.trylower.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.trylower.transformation.context.LoweringOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String UNREACHABLE_HANDLER_FATAL = "lowering.unreachable-handler-fatal";
    public static final String PARALLELISM = "lowering.parallelism";
    public static final String INCLUDE_DEBUG_TREE = "lowering.include-debug-tree";
    public static final String TEMP_PREFIX = "lowering.temp-prefix";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(UNREACHABLE_HANDLER_FATAL, false);
        configuration.put(PARALLELISM, Runtime.getRuntime().availableProcessors());
        configuration.put(INCLUDE_DEBUG_TREE, false);
        configuration.put(TEMP_PREFIX, LoweringOptions.DEFAULT_TEMP_PREFIX);

        log.debug("Lowering settings initialized: {}", configuration);
    }

    /**
     * Gets a copy of every setting, defaults included.
     */
    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as an integer.
     * Accepts numbers and numeric strings; anything else yields null.
     *
     * @param key Configuration key
     * @return Integer value, or null if missing or not numeric
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number", key, value);
                return null;
            }
        }
        return null;
    }

    /**
     * Snapshots the lowering settings for one run.
     */
    public LoweringOptions getLoweringOptions() {
        Boolean fatal = getConfigValueAsBoolean(UNREACHABLE_HANDLER_FATAL);
        Boolean debugTree = getConfigValueAsBoolean(INCLUDE_DEBUG_TREE);
        String prefix = getConfigValueAsString(TEMP_PREFIX);
        return new LoweringOptions(
                Boolean.TRUE.equals(fatal),
                Boolean.TRUE.equals(debugTree),
                prefix != null && !prefix.trim().isEmpty() ? prefix : LoweringOptions.DEFAULT_TEMP_PREFIX);
    }

    /**
     * Gets the worker count for batch lowering, never less than one.
     */
    public int getParallelism() {
        Integer parallelism = getConfigValueAsInteger(PARALLELISM);
        if (parallelism == null || parallelism < 1) {
            return 1;
        }
        return parallelism;
    }

    /**
     * Applies a batch of settings, e.g. from the host compiler's command line.
     * Entries with a null key or value are skipped.
     */
    public void updateConfiguration(Map<String, Object> settings) {
        if (settings == null || settings.isEmpty()) {
            return;
        }
        log.info("Applying {} lowering setting(s)", settings.size());
        settings.forEach((key, value) -> {
            if (key == null || value == null) {
                log.warn("Ignoring lowering setting with missing key or value: {} = {}", key, value);
                return;
            }
            Object previous = configuration.put(key, value);
            log.debug("Setting {} = {} (previously {})", key, value, previous);
        });
    }

    public void setConfigValue(String key, Object value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Setting key and value cannot be null");
        }
        Object previous = configuration.put(key, value);
        log.debug("Setting {} = {} (previously {})", key, value, previous);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting lowering settings to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
