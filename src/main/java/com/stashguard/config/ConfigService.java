package com.stashguard.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads and validates the service configuration file.
 *
 * A missing file means all defaults. Relative paths in the file resolve against the file's
 * directory.
 */
public class ConfigService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_FILE_NAME = "stashguard.json";

    public static final ConfigSchema SCHEMA = new ConfigSchema(Map.of(
        "bindHost", ConfigSchema.text("0.0.0.0"),
        "port", ConfigSchema.wholeNumber(8080, 1, 65535),
        "storageDirectory", ConfigSchema.text("data"),
        "tokensFile", ConfigSchema.text("tokens.json")
    ));

    /**
     * Loads configuration from a file.
     *
     * @param configFile the JSON config file, which need not exist
     * @return the validated configuration
     * @throws ConfigLoadException if the file exists but cannot be read or is not a JSON object
     * @throws ConfigValidationException if a field is invalid
     */
    public ServiceConfig load(Path configFile) throws ConfigLoadException, ConfigValidationException {
        Map<String, Object> config = new HashMap<>();

        if (Files.exists(configFile)) {
            try {
                JsonNode root = MAPPER.readTree(Files.readString(configFile));
                if (root == null || !root.isObject()) {
                    throw new ConfigLoadException("Config file must contain a JSON object: " + configFile, null);
                }
                Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (!SCHEMA.hasField(field.getKey())) {
                        LOGGER.warn("Ignoring unknown config field '{}' in {}", field.getKey(), configFile);
                        continue;
                    }
                    config.put(field.getKey(), convertJsonNode(field.getValue()));
                }
                LOGGER.debug("Read config from {}", configFile);
            } catch (IOException e) {
                throw new ConfigLoadException("Failed to load config from '" + configFile + "'", e);
            }
        } else {
            LOGGER.info("No config file at {}, using defaults", configFile);
        }

        SCHEMA.validate(config);

        Path baseDir = configFile.toAbsolutePath().getParent();
        ServiceConfig loaded = new ServiceConfig(
            (String) config.get("bindHost"),
            ((Number) config.get("port")).intValue(),
            baseDir.resolve((String) config.get("storageDirectory")),
            baseDir.resolve((String) config.get("tokensFile"))
        );
        LOGGER.info("Loaded config: {}", loaded);
        return loaded;
    }

    /**
     * Converts a scalar JsonNode; nested values are kept as their node so type checks fail on them.
     */
    private Object convertJsonNode(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        } else if (node.isNumber()) {
            if (node.isInt()) {
                return node.asInt();
            } else if (node.isLong()) {
                return node.asLong();
            } else {
                return node.asDouble();
            }
        } else if (node.isBoolean()) {
            return node.asBoolean();
        } else if (node.isNull()) {
            return null;
        }
        return node;
    }
}
