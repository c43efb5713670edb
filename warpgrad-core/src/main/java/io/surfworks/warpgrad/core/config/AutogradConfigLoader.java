package io.surfworks.warpgrad.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.warpgrad.core.error.NaNPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves {@link AutogradConfig} as JSON.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>Config file ({@code ~/.config/warpgrad/autograd.json} or an explicit path)</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>Missing fields keep their default. A file that cannot be parsed is
 * logged and ignored.
 */
public final class AutogradConfigLoader {

    private static final Logger LOGGER = Logger.getLogger(AutogradConfigLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private AutogradConfigLoader() {
    }

    public static AutogradConfig load() {
        return load(AutogradConfig.configFile());
    }

    public static AutogradConfig load(Path configFile) {
        AutogradConfig config = AutogradConfig.defaults();
        if (!Files.exists(configFile)) {
            return config;
        }
        try {
            return fromJson(JSON.readTree(configFile.toFile()), config);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, "Ignoring unreadable config file {0}: {1}",
                    new Object[]{configFile, e.getMessage()});
            return config;
        }
    }

    /**
     * Loads a configuration from a classpath resource.
     */
    public static AutogradConfig loadResource(String resource) {
        AutogradConfig config = AutogradConfig.defaults();
        try (InputStream in = AutogradConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                LOGGER.log(Level.FINE, "Config resource {0} not found, using defaults", resource);
                return config;
            }
            return fromJson(JSON.readTree(in), config);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, "Ignoring unreadable config resource {0}: {1}",
                    new Object[]{resource, e.getMessage()});
            return config;
        }
    }

    public static void save(AutogradConfig config) throws IOException {
        save(config, AutogradConfig.configFile());
    }

    public static void save(AutogradConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("enableBackprop", config.enableBackprop());
        root.put("train", config.train());
        root.put("typeCheck", config.typeCheck());
        root.put("debug", config.debug());
        root.put("nanPolicy", config.nanPolicy().name().toLowerCase(Locale.ROOT));

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    static AutogradConfig fromJson(JsonNode root, AutogradConfig base) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("config root must be a JSON object");
        }
        AutogradConfig config = base
                .withEnableBackprop(getBooleanOrDefault(root, "enableBackprop", base.enableBackprop()))
                .withTrain(getBooleanOrDefault(root, "train", base.train()))
                .withTypeCheck(getBooleanOrDefault(root, "typeCheck", base.typeCheck()))
                .withDebug(getBooleanOrDefault(root, "debug", base.debug()));
        if (root.has("nanPolicy")) {
            config = config.withNanPolicy(
                    NaNPolicy.valueOf(root.get("nanPolicy").asText().toUpperCase(Locale.ROOT)));
        }
        return config;
    }

    private static boolean getBooleanOrDefault(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.asBoolean() : defaultValue;
    }
}
