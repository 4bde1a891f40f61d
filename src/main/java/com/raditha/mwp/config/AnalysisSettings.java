package com.raditha.mwp.config;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.raditha.mwp.choice.ReductionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads analysis configuration from YAML (mwp.yml) with CLI overrides.
 * 
 * Configuration priority: CLI arguments > mwp.yml > defaults
 */
public class AnalysisSettings {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisSettings.class);

    static final String CONFIG_KEY = "mwp_analysis";
    static final String DEFAULT_RESOURCE = "mwp.yml";

    private static final YAMLMapper mapper = new YAMLMapper();

    private AnalysisSettings() {
    }

    /**
     * Read the {@code mwp_analysis} section of a YAML file, or of the
     * {@code mwp.yml} classpath resource when no file is given.
     *
     * @param configFile YAML file, may be null
     * @return the section, empty when the file has none
     * @throws IOException if the file cannot be read or parsed
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> loadSection(File configFile) throws IOException {
        Map<String, Object> root;
        if (configFile != null) {
            root = mapper.readValue(configFile, Map.class);
        } else {
            try (InputStream in = AnalysisSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) {
                    logger.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                    return Map.of();
                }
                root = mapper.readValue(in, Map.class);
            }
        }
        if (root == null) {
            return Map.of();
        }
        Object section = root.get(CONFIG_KEY);
        if (section instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) section;
            return config;
        }
        return Map.of();
    }

    /**
     * Build the configuration from a YAML section, applying CLI overrides where provided.
     *
     * @param yaml                 the {@code mwp_analysis} section
     * @param maxIterationsCLI     CLI fixpoint iteration limit (0 = use YAML/default)
     * @param strategyCLI          CLI reduction strategy (null = use YAML/default)
     * @param presetCLI            CLI preset name (null = use YAML/default)
     * @param noEvaluateCLI        CLI request to skip evaluation
     * @param stopOnInfinityCLI    CLI request to stop at unconditional infinity
     * @param noSaveCLI            CLI request to skip saving
     * @return Complete analysis configuration
     */
    public static AnalysisConfig loadConfig(Map<String, Object> yaml, int maxIterationsCLI, String strategyCLI,
                                            String presetCLI, boolean noEvaluateCLI, boolean stopOnInfinityCLI,
                                            boolean noSaveCLI) {
        String preset = presetCLI != null ? presetCLI : getString(yaml, "preset", null);
        AnalysisConfig base = preset != null ? fromPreset(preset) : AnalysisConfig.defaults();

        // Build custom config (CLI overrides YAML overrides preset/defaults)
        int limit = maxIterationsCLI != 0 ? maxIterationsCLI
                : getInt(yaml, "fixpoint_iteration_limit", base.fixpointIterationLimit());
        String strategy = strategyCLI != null ? strategyCLI : getString(yaml, "reduction", null);
        ReductionStrategy reduction = strategy != null ? ReductionStrategy.fromString(strategy) : base.reduction();
        boolean evaluate = !noEvaluateCLI && getBoolean(yaml, "evaluate", base.evaluate());
        boolean stopOnInfinity = stopOnInfinityCLI || getBoolean(yaml, "stop_on_infinity", base.stopOnInfinity());
        boolean save = !noSaveCLI && getBoolean(yaml, "save_result", base.saveResult());
        String outputDirectory = getString(yaml, "output_directory", base.outputDirectory());

        AnalysisConfig config = new AnalysisConfig(limit, reduction, evaluate, stopOnInfinity, save, outputDirectory);
        logger.debug("Analysis configuration: {}", config);
        return config;
    }

    public static AnalysisConfig fromPreset(String preset) {
        return switch (preset) {
            case "fast" -> AnalysisConfig.fast();
            case "thorough" -> AnalysisConfig.thorough();
            case "default" -> AnalysisConfig.defaults();
            default -> throw new IllegalArgumentException(
                    "Unknown preset: " + preset + ". Valid presets: default, fast, thorough");
        };
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
