package im.arun.docoutline.config;

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

/**
 * Loads {@link OutlineConfig} from YAML and merges command-line overrides on top.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String DEFAULT_RESOURCE = "config.yaml";

    private final ObjectMapper yamlMapper;
    private final OutlineConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private OutlineConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), OutlineConfig.class);
                }
                logger.warn("Configuration file {} not found, trying classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, OutlineConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new OutlineConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new OutlineConfig();
        }
    }

    /**
     * Returns a fresh copy of the loaded configuration with the given overrides applied.
     * Unknown keys are logged and ignored.
     *
     * @param userOptions override values keyed by option name, may be null
     * @return merged configuration
     */
    public OutlineConfig load(Map<String, Object> userOptions) {
        OutlineConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            try {
                switch (key) {
                    case "embedding_url":
                    case "embeddingUrl":
                        config.getRanking().setEmbeddingUrl(value.toString());
                        break;
                    case "embedding_model":
                    case "embeddingModel":
                        config.getRanking().setEmbeddingModel(value.toString());
                        break;
                    case "api_key":
                    case "apiKey":
                        config.getRanking().setApiKey(value.toString());
                        break;
                    case "top_sections":
                    case "topSections":
                        config.getRanking().setTopSections(parseInt(value));
                        break;
                    case "trace":
                        config.getTrace().setEnabled(parseBoolean(value));
                        break;
                    case "trace_directory":
                    case "traceDirectory":
                        config.getTrace().setDirectory(value.toString());
                        break;
                    case "ocr":
                        config.getOcr().setEnabled(parseBoolean(value));
                        break;
                    case "tessdata_path":
                    case "tessdataPath":
                        config.getOcr().setTessdataPath(value.toString());
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

    public OutlineConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    private int parseInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().trim());
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

    private OutlineConfig copyConfig(OutlineConfig source) {
        return yamlMapper.convertValue(source, OutlineConfig.class);
    }
}
