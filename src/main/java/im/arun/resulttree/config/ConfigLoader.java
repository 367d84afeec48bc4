package im.arun.resulttree.config;

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
    static final String DEFAULT_RESOURCE = "result-tree.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ResultTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ResultTreeConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return validated(yamlMapper.readValue(path.toFile(), ResultTreeConfig.class), configPath);
                }
                logger.warn("Config file not found: {}", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return validated(yamlMapper.readValue(resourceStream, ResultTreeConfig.class), DEFAULT_RESOURCE);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new ResultTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ResultTreeConfig();
        }
    }

    private ResultTreeConfig validated(ResultTreeConfig loaded, String source) {
        ResultTreeConfig defaults = new ResultTreeConfig();
        if (loaded.getMaxDepth() <= 0) {
            logger.warn("Ignoring invalid limit for maxDepth in {}: {}", source, loaded.getMaxDepth());
            loaded.setMaxDepth(defaults.getMaxDepth());
        }
        if (loaded.getMaxStringLength() <= 0) {
            logger.warn("Ignoring invalid limit for maxStringLength in {}: {}", source, loaded.getMaxStringLength());
            loaded.setMaxStringLength(defaults.getMaxStringLength());
        }
        if (loaded.getMaxEnumerableLength() <= 0) {
            logger.warn("Ignoring invalid limit for maxEnumerableLength in {}: {}", source, loaded.getMaxEnumerableLength());
            loaded.setMaxEnumerableLength(defaults.getMaxEnumerableLength());
        }
        if (loaded.getScriptClassPrefix() == null || loaded.getScriptClassPrefix().isEmpty()) {
            logger.warn("Ignoring empty scriptClassPrefix in {}", source);
            loaded.setScriptClassPrefix(defaults.getScriptClassPrefix());
        }
        return loaded;
    }

    public ResultTreeConfig load() {
        return load(null);
    }

    public ResultTreeConfig load(Map<String, Object> userOptions) {
        ResultTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "max_depth":
                case "maxDepth":
                    Integer depth = parseLimit(key, value);
                    if (depth != null) config.setMaxDepth(depth);
                    break;
                case "max_string_length":
                case "maxStringLength":
                    Integer length = parseLimit(key, value);
                    if (length != null) config.setMaxStringLength(length);
                    break;
                case "max_enumerable_length":
                case "maxEnumerableLength":
                    Integer count = parseLimit(key, value);
                    if (count != null) config.setMaxEnumerableLength(count);
                    break;
                case "script_class_prefix":
                case "scriptClassPrefix":
                    if (value instanceof String && !((String) value).isEmpty()) {
                        config.setScriptClassPrefix((String) value);
                    } else {
                        logger.warn("Ignoring empty or non-text value for {}", key);
                    }
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private Integer parseLimit(String key, Object value) {
        Integer limit = null;
        if (value instanceof Integer) {
            limit = (Integer) value;
        } else if (value instanceof String) {
            try {
                limit = Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric value for {}: {}", key, value);
                return null;
            }
        }
        if (limit == null || limit <= 0) {
            logger.warn("Ignoring invalid limit for {}: {}", key, value);
            return null;
        }
        return limit;
    }

    private ResultTreeConfig copyConfig(ResultTreeConfig source) {
        ResultTreeConfig copy = new ResultTreeConfig();
        copy.setMaxDepth(source.getMaxDepth());
        copy.setMaxStringLength(source.getMaxStringLength());
        copy.setMaxEnumerableLength(source.getMaxEnumerableLength());
        copy.setScriptClassPrefix(source.getScriptClassPrefix());
        return copy;
    }
}
