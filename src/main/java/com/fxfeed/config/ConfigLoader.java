package com.fxfeed.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads application configuration from a classpath YAML file
 * Selected environment variables override file values
 */
@Slf4j
public class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "application.yml";

    static final String ENV_COMMON_URL = "FEEDS_COMMON_CURRENCIES_URL";
    static final String ENV_OTHER_URL = "FEEDS_OTHER_CURRENCIES_URL";
    static final String ENV_HTTP_PORT = "HTTP_PORT";

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {};

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    ConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public JsonObject load() {
        return load(DEFAULT_RESOURCE);
    }

    public JsonObject load(String resource) {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            Map<String, Object> values = yamlMapper.readValue(is, CONFIG_TYPE);
            JsonObject config = values == null ? new JsonObject() : new JsonObject(values);
            applyEnvironmentOverrides(config);
            log.info("Loaded configuration from {}", resource);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentOverrides(JsonObject config) {
        String commonUrl = environment.get(ENV_COMMON_URL);
        if (commonUrl != null && !commonUrl.isBlank()) {
            section(config, "feeds").put(FeedRatesConfig.COMMON_URL_KEY, commonUrl);
        }
        String otherUrl = environment.get(ENV_OTHER_URL);
        if (otherUrl != null && !otherUrl.isBlank()) {
            section(config, "feeds").put(FeedRatesConfig.OTHER_URL_KEY, otherUrl);
        }
        String port = environment.get(ENV_HTTP_PORT);
        if (port != null && !port.isBlank()) {
            try {
                section(config, "http").put("port", Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException(ENV_HTTP_PORT + " is not a valid port: " + port, e);
            }
        }
    }

    private static JsonObject section(JsonObject config, String name) {
        JsonObject section = config.getJsonObject(name);
        if (section == null) {
            section = new JsonObject();
            config.put(name, section);
        }
        return section;
    }
}
