package im.arun.pyfmt.config;

import com.fasterxml.jackson.core.type.TypeReference;
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
    private static final String DEFAULT_RESOURCE = "pyfmt.yaml";
    private static final TypeReference<Map<String, Object>> VALUES = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final FormatterConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private FormatterConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return readYaml(yamlMapper.readValue(path.toFile(), VALUES));
                }
                logger.warn("Config file {} not found, falling back to defaults", configPath);
            }

            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
            if (resourceStream != null) {
                try (resourceStream) {
                    return readYaml(yamlMapper.readValue(resourceStream, VALUES));
                }
            }

            logger.debug("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new FormatterConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new FormatterConfig();
        }
    }

    private FormatterConfig readYaml(Map<String, Object> values) {
        FormatterConfig config = new FormatterConfig();
        if (values != null) {
            merge(config, values);
        }
        return config;
    }

    public FormatterConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    /**
     * Defaults overlaid with {@code userOptions}; keys may be snake_case or camelCase.
     *
     * @throws IllegalArgumentException when the merged configuration is invalid
     */
    public FormatterConfig load(Map<String, Object> userOptions) {
        FormatterConfig config = copyConfig(defaultConfig);
        if (userOptions != null && !userOptions.isEmpty()) {
            merge(config, userOptions);
        }
        config.validate();
        return config;
    }

    private void merge(FormatterConfig config, Map<String, Object> options) {
        options.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "max_line_length":
                case "maxLineLength":
                    config.setMaxLineLength(parseInt(key, value));
                    break;
                case "quote":
                    config.setQuote(value.toString());
                    break;
                case "tab":
                    config.setTab(parseTab(value));
                    break;
                case "ast_suffix":
                case "astSuffix":
                    config.setAstSuffix(value.toString());
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });
    }

    private int parseInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " expects an integer, got " + value, e);
        }
    }

    /**
     * A number means that many spaces; {@code \t} written out is a tab.
     */
    static String parseTab(Object value) {
        if (value instanceof Number) {
            return " ".repeat(((Number) value).intValue());
        }
        String text = value.toString();
        if (text.matches("\\d+")) {
            return " ".repeat(Integer.parseInt(text));
        }
        return text.replace("\\t", "\t");
    }

    private FormatterConfig copyConfig(FormatterConfig source) {
        FormatterConfig copy = new FormatterConfig();
        copy.setMaxLineLength(source.getMaxLineLength());
        copy.setQuote(source.getQuote());
        copy.setTab(source.getTab());
        copy.setAstSuffix(source.getAstSuffix());
        return copy;
    }
}
