package im.arun.lcms.config;

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
 * Loads {@link LcmsConfig} from YAML. An explicit file wins over {@code lcms.yaml} on the
 * classpath; with neither, defaults are used.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "lcms.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final LcmsConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private LcmsConfig loadDefaultConfig(String configPath) {
        try {
            // Explicit file first
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), LcmsConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, LcmsConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new LcmsConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new LcmsConfig();
        }
    }

    public LcmsConfig load() {
        return load(null);
    }

    public LcmsConfig load(Map<String, Object> userOptions) {
        LcmsConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        // Merge user options into config
        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "root_name":
                case "rootName":
                    if (value instanceof String) config.setRootName((String) value);
                    break;
                case "confirm_removals":
                case "confirmRemovals":
                    config.setConfirmRemovals(parseBoolean(value));
                    break;
                case "history_file":
                case "historyFile":
                    if (value instanceof String) config.setHistoryFile((String) value);
                    break;
                case "prompt":
                    if (value instanceof String) config.setPrompt((String) value);
                    break;
                case "keyword_case_sensitive":
                case "keywordCaseSensitive":
                    config.setKeywordCaseSensitive(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
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

    private LcmsConfig copyConfig(LcmsConfig source) {
        LcmsConfig copy = new LcmsConfig();
        copy.setRootName(source.getRootName());
        copy.setConfirmRemovals(source.isConfirmRemovals());
        copy.setHistoryFile(source.getHistoryFile());
        copy.setPrompt(source.getPrompt());
        copy.setKeywordCaseSensitive(source.isKeywordCaseSensitive());
        return copy;
    }
}
