package me.christianrobert.trylower.config.service;

import me.christianrobert.trylower.transformation.context.LoweringOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaultsProduceDefaultOptions() {
        LoweringOptions options = configService.getLoweringOptions();

        assertFalse(options.isUnreachableHandlerFatal());
        assertFalse(options.isIncludeDebugTree());
        assertEquals(LoweringOptions.DEFAULT_TEMP_PREFIX, options.getTempPrefix());
        assertTrue(configService.getParallelism() >= 1);
    }

    @Test
    void stringValuesAreConverted() {
        configService.updateConfiguration(Map.of(
                ConfigService.UNREACHABLE_HANDLER_FATAL, "true",
                ConfigService.PARALLELISM, " 3 "));

        assertTrue(configService.getLoweringOptions().isUnreachableHandlerFatal());
        assertEquals(3, configService.getParallelism());
    }

    @Test
    void invalidParallelismFallsBackToOne() {
        configService.setConfigValue(ConfigService.PARALLELISM, "many");
        assertEquals(1, configService.getParallelism());

        configService.setConfigValue(ConfigService.PARALLELISM, 0);
        assertEquals(1, configService.getParallelism());
    }

    @Test
    void blankTempPrefixFallsBackToDefault() {
        configService.setConfigValue(ConfigService.TEMP_PREFIX, "  ");

        assertEquals(LoweringOptions.DEFAULT_TEMP_PREFIX, configService.getLoweringOptions().getTempPrefix());
    }

    @Test
    void resetRestoresDefaults() {
        configService.setConfigValue(ConfigService.INCLUDE_DEBUG_TREE, true);
        configService.setConfigValue("custom.key", "x");

        configService.resetToDefaults();

        assertFalse(configService.hasConfigKey("custom.key"));
        assertEquals(Boolean.FALSE, configService.getConfigValueAsBoolean(ConfigService.INCLUDE_DEBUG_TREE));
        assertEquals(4, configService.getAllConfiguration().size());
    }
}
