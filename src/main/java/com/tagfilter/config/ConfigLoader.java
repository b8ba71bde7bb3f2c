package com.tagfilter.config;

import com.tagfilter.exception.ConfigurationException;
import com.tagfilter.expression.Normalization;
import com.tagfilter.filter.ElementFilterExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads tag filter configuration from YAML files.
 * <pre>
 * tagfilter:
 *   name: osm-quests
 *   version: "1.0"
 *   filters:
 *     - name: residential-roads
 *       expression: "ways with highway = residential"
 *       normalization: expand
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static TagFilterConfig load(String path) {
        log.info("Loading tag filter configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     *
     * @param inputStream YAML document
     * @return Parsed configuration
     */
    public static TagFilterConfig parseYaml(InputStream inputStream) {
        Object document;
        try {
            document = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML configuration: " + e.getMessage(), e);
        }

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMap(document, "Configuration");

        // Get the tagfilter section (could be at root or under 'tagfilter' key)
        Map<String, Object> section = root.containsKey("tagfilter")
                ? asMap(root.get("tagfilter"), "Section 'tagfilter'")
                : root;

        String name = getString(section, "name", "default");
        String version = getString(section, "version", "1.0");
        List<FilterConfig> filters = parseFilters(section.get("filters"));

        if (filters.isEmpty()) {
            log.warn("No filters configured in '{}'", name);
        }

        TagFilterConfig config = new TagFilterConfig(name, version, filters);
        log.info("Loaded tag filter configuration: {} v{} with {} filters", name, version, filters.size());
        return config;
    }

    private static List<FilterConfig> parseFilters(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'filters' must be a YAML list");
        }

        List<FilterConfig> filters = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> map = asMap(list.get(i), "Filter entry " + i);
            String name = getString(map, "name", "filter-" + i);
            if (!names.add(name)) {
                throw new ConfigurationException("Duplicate filter name '" + name + "'");
            }
            filters.add(parseFilter(map, name));
        }
        return filters;
    }

    private static FilterConfig parseFilter(Map<String, Object> map, String name) {
        String expression = getString(map, "expression", null);
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Filter '" + name + "' requires an expression");
        }

        Normalization normalization = parseNormalization(map, name);
        ElementFilterExpression filter = FilterExpressionParser.parse(expression);

        log.debug("Parsed filter '{}': {} (normalization: {})", name, filter, normalization);
        return new FilterConfig(name, filter, normalization);
    }

    private static Normalization parseNormalization(Map<String, Object> map, String name) {
        String value = getString(map, "normalization", null);
        if (value == null || value.isBlank()) {
            return Normalization.FLATTEN;
        }
        try {
            return Normalization.fromName(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Filter '" + name + "' has unknown normalization '" + value
                    + "', expected one of none, flatten, expand", e);
        }
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException(what + " must be a YAML mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
