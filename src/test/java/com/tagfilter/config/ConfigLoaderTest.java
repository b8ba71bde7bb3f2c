package com.tagfilter.config;

import com.tagfilter.exception.ConfigurationException;
import com.tagfilter.expression.Normalization;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for loading filter configuration from YAML.
 */
class ConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load a configuration from the classpath")
    void loadsFromClasspath() {
        TagFilterConfig config = ConfigLoader.load("classpath:test-filters.yaml");

        assertEquals("test-filters", config.name());
        assertEquals("2.1", config.version());
        assertEquals(List.of("residential", "unnamed-roads", "named-or-numbered", "benches"),
                config.filters().stream().map(FilterConfig::name).toList());

        FilterConfig unnamed = config.getFilter("unnamed-roads").orElseThrow();
        assertEquals(Normalization.NONE, unnamed.normalization());
        assertEquals(Normalization.EXPAND, config.getFilter("named-or-numbered").orElseThrow().normalization());
        assertEquals(Normalization.FLATTEN, config.getFilter("benches").orElseThrow().normalization());
        assertEquals("nodes with amenity=bench", config.getFilter("benches").orElseThrow().filter().toString());
        assertTrue(config.getFilter("missing").isEmpty());
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void missingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:no-such-file.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/no/such/dir/filters.yaml"));
    }

    @Test
    @DisplayName("Section may sit at the document root and names get defaults")
    void rootLevelSectionWithDefaults() {
        TagFilterConfig config = ConfigLoader.parseYaml(yaml("""
                filters:
                  - expression: "nodes with amenity = bench"
                  - expression: "ways"
                    normalization: Expand
                """));

        assertEquals("default", config.name());
        assertEquals("1.0", config.version());
        assertEquals("filter-0", config.filters().get(0).name());
        assertEquals("filter-1", config.filters().get(1).name());
        assertEquals(Normalization.EXPAND, config.filters().get(1).normalization());
    }

    @Test
    @DisplayName("A configuration without filters is allowed")
    void noFilters() {
        TagFilterConfig config = ConfigLoader.parseYaml(yaml("""
                tagfilter:
                  name: empty
                """));

        assertEquals("empty", config.name());
        assertTrue(config.filters().isEmpty());
    }

    @Test
    @DisplayName("Should reject invalid configurations")
    void rejectsInvalidConfigurations() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("- just\n- a list\n")));

        ConfigurationException duplicate = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("""
                        filters:
                          - name: a
                            expression: nodes
                          - name: a
                            expression: ways
                        """)));
        assertTrue(duplicate.getMessage().contains("Duplicate filter name 'a'"));

        ConfigurationException missing = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("""
                        filters:
                          - name: a
                        """)));
        assertTrue(missing.getMessage().contains("requires an expression"));

        ConfigurationException normalization = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("""
                        filters:
                          - name: a
                            expression: nodes
                            normalization: simplify
                        """)));
        assertTrue(normalization.getMessage().contains("unknown normalization 'simplify'"));
    }

    @ParameterizedTest
    @DisplayName("Malformed document shapes are configuration errors")
    @ValueSource(strings = {
            "tagfilter:\n",
            "tagfilter: foo\n",
            "filters: nope\n",
            "filters:\n  - just-a-string\n",
            "tagfilter:\n  filters:\n    name: a\n"
    })
    void rejectsMalformedShapes(String text) {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml(text)));
    }

    @Test
    @DisplayName("YAML syntax errors keep their cause")
    void syntaxErrorKeepsCause() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(yaml("filters: [")));

        assertTrue(e.getMessage().startsWith("Invalid YAML configuration"));
        assertInstanceOf(YAMLException.class, e.getCause());
    }

    @Test
    @DisplayName("Invalid filter expressions fail loading")
    void invalidExpression() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("""
                filters:
                  - name: broken
                    expression: "nodes with (name"
                """)));
    }
}
