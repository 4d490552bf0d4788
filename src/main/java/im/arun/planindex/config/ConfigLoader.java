package im.arun.planindex.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "planindex.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final PlanIndexConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private PlanIndexConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), PlanIndexConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, PlanIndexConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new PlanIndexConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new PlanIndexConfig();
        }
    }

    public PlanIndexConfig load() {
        return load(null);
    }

    public PlanIndexConfig load(Map<String, Object> userOptions) {
        PlanIndexConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "dpi":
                        config.setDpi(toInt(value));
                        break;
                    case "iou_threshold":
                    case "iouThreshold":
                        config.setIouThreshold(toDouble(value));
                        break;
                    case "max_pairing_distance_px":
                    case "maxPairingDistancePx":
                        config.setMaxPairingDistancePx(toInt(value));
                        break;
                    case "relation_tolerance_px":
                    case "relationTolerancePx":
                        config.setRelationTolerancePx(toInt(value));
                        break;
                    case "bucket_size_px":
                    case "bucketSizePx":
                        config.setBucketSizePx(toInt(value));
                        break;
                    case "paired_confidence_boost":
                    case "pairedConfidenceBoost":
                        config.setPairedConfidenceBoost(toDouble(value));
                        break;
                    case "use_fallback":
                    case "useFallback":
                        config.setUseFallback(parseBoolean(value));
                        break;
                    case "fallback_endpoint":
                    case "fallbackEndpoint":
                        config.setFallbackEndpoint(value == null ? null : value.toString());
                        break;
                    case "fallback_timeout_seconds":
                    case "fallbackTimeoutSeconds":
                        config.setFallbackTimeoutSeconds(toInt(value));
                        break;
                    case "fallback_max_retries":
                    case "fallbackMaxRetries":
                        config.setFallbackMaxRetries(toInt(value));
                        break;
                    case "write_run_log":
                    case "writeRunLog":
                        config.setWriteRunLog(parseBoolean(value));
                        break;
                    case "extraction_threads":
                    case "extractionThreads":
                        config.setExtractionThreads(toInt(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (RuntimeException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private int toInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().strip());
    }

    private double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString().strip());
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private PlanIndexConfig copyConfig(PlanIndexConfig source) {
        PlanIndexConfig copy = new PlanIndexConfig();
        copy.setDpi(source.getDpi());
        copy.setIouThreshold(source.getIouThreshold());
        copy.setMaxPairingDistancePx(source.getMaxPairingDistancePx());
        copy.setRelationTolerancePx(source.getRelationTolerancePx());
        copy.setBucketSizePx(source.getBucketSizePx());
        copy.setPairedConfidenceBoost(source.getPairedConfidenceBoost());
        copy.setUseFallback(source.isUseFallback());
        copy.setFallbackEndpoint(source.getFallbackEndpoint());
        copy.setFallbackTimeoutSeconds(source.getFallbackTimeoutSeconds());
        copy.setFallbackMaxRetries(source.getFallbackMaxRetries());
        copy.setWriteRunLog(source.isWriteRunLog());
        copy.setExtractionThreads(source.getExtractionThreads());
        return copy;
    }
}
