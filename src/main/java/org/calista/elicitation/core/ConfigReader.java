package org.calista.elicitation.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.elicitation.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ConfigReader reads the config as a JsonNode to detect missing fields,
 * logs a warning per missing value (default applies), binds to {@link AdaptiveSettings},
 * overlays {@code ADAPTIVE_*} environment variables and validates in one step.
 */
public final class ConfigReader {

    private static final Logger log = LoggerFactory.getLogger(ConfigReader.class);

    public static final String DEFAULT_RESOURCE = "config/adaptive.json";

    private ConfigReader() {}

    /**
     * Reads {@code configFile}; when it does not exist the bundled defaults are used.
     */
    public static AdaptiveConfig load(FileIO io, Path configFile, ObjectMapper mapper, Map<String, String> env) {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        if (!io.exists(configFile)) {
            log.warn("Config file {} not found. Using bundled defaults ({}).", configFile, DEFAULT_RESOURCE);
            return loadClasspath(DEFAULT_RESOURCE, mapper, env);
        }
        try {
            return read(io.readString(configFile), configFile.toString(), mapper, env);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config " + configFile + ": " + e.getMessage(), e);
        }
    }

    public static AdaptiveConfig loadClasspath(String resource, ObjectMapper mapper, Map<String, String> env) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream in = ConfigReader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new ConfigurationException("Config resource not found: " + resource, null);
            return read(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource, mapper, env);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config resource " + resource + ": " + e.getMessage(), e);
        }
    }

    public static AdaptiveConfig read(String json, String source, ObjectMapper mapper, Map<String, String> env) {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(mapper, "mapper");

        AdaptiveSettings settings;
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || root.isNull() || root.isMissingNode()) {
                log.warn("Config {} is empty. Falling back to defaults.", source);
                settings = new AdaptiveSettings();
            } else if (!root.isObject()) {
                throw new ConfigurationException(List.of("config root must be a JSON object: " + source));
            } else {
                settings = mapper.treeToValue(root, AdaptiveSettings.class);
                if (settings == null) settings = new AdaptiveSettings();
                warnMissing(root, source);
            }
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed config " + source + ": " + e.getOriginalMessage(), e);
        }

        List<String> envErrors = new ArrayList<>();
        settings.applyEnv(env, envErrors);
        if (!envErrors.isEmpty()) throw new ConfigurationException(envErrors);

        AdaptiveConfig cfg = AdaptiveConfig.of(settings);
        log.info("Adaptive config loaded from {}: {}", source, cfg);
        return cfg;
    }

    /**
     * Warns for fields ABSENT in JSON. Missing sections are reported once and their children skipped.
     */
    static List<String> warnMissing(JsonNode root, String source) {
        List<String> missing = new ArrayList<>();
        walk(new AdaptiveSettings(), "", root, missing, source);
        return missing;
    }

    private static void walk(Object template, String base, JsonNode root, List<String> missing, String source) {
        for (Field f : template.getClass().getDeclaredFields()) {
            int m = f.getModifiers();
            if (Modifier.isStatic(m) || Modifier.isTransient(m) || f.isSynthetic()) continue;

            String pointer = base + "/" + jsonNameOf(f);
            Object def = valueOf(template, f);
            boolean section = !isScalar(f.getType());

            if (root.at(pointer).isMissingNode()) {
                missing.add(pointer);
                if (section) {
                    log.warn("Config {} missing section {} -> fallback to defaults", source, pointer);
                } else {
                    log.warn("Config {} missing field {} -> fallback to default: {}", source, pointer, def);
                }
                continue;
            }
            if (section && def != null) walk(def, pointer, root, missing, source);
        }
    }

    private static String jsonNameOf(Field f) {
        JsonProperty jp = f.getAnnotation(JsonProperty.class);
        if (jp != null && !jp.value().isBlank()) return jp.value();
        return f.getName();
    }

    private static Object valueOf(Object obj, Field f) {
        try {
            return f.get(obj);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("config field not public: " + f, e);
        }
    }

    private static boolean isScalar(Class<?> t) {
        return t.isPrimitive()
                || t.isEnum()
                || t == String.class
                || Number.class.isAssignableFrom(t)
                || t == Boolean.class
                || Collection.class.isAssignableFrom(t);
    }
}
