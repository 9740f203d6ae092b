/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.arazzo.config;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Configuration for reading and writing Arazzo descriptions.
 * Values come from built-in defaults, then an {@code arazzo.properties} resource on the
 * classpath, then {@code arazzo.*} system properties.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class ArazzoConfiguration {
    private static final Logger logger = Logger.getLogger(ArazzoConfiguration.class.getName());
    
    public static final String SUPPORTED_VERSIONS = "arazzo.versions.supported";
    public static final String WARN_UNKNOWN_FIELDS = "arazzo.parse.warn.unknown.fields";
    public static final String YAML_ALLOW_DUPLICATE_KEYS = "arazzo.yaml.allow.duplicate.keys";
    public static final String YAML_MAX_ALIASES = "arazzo.yaml.max.aliases";
    public static final String YAML_INDENT = "arazzo.yaml.indent";
    public static final String JSON_PRETTY_PRINT = "arazzo.json.pretty.print";
    
    // Default configuration values
    private static final String DEFAULT_SUPPORTED_VERSIONS = "1.0";
    private static final int DEFAULT_YAML_MAX_ALIASES = 50;
    private static final int DEFAULT_YAML_INDENT = 2;
    
    // major.minor.patch with an optional pre-release or build suffix
    private static final Pattern VERSION_PATTERN = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)([-+][0-9A-Za-z.\\-+]*)?$");
    private static final Pattern VERSION_LINE_PATTERN = Pattern.compile("^\\d+\\.\\d+$");
    
    private final Properties properties;
    
    public ArazzoConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromClasspath();
        loadConfigurationFromSystemProperties();
    }
    
    public ArazzoConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }
    
    /**
     * Returns the accepted {@code major.minor} version lines, e.g. {@code [1.0]}.
     * Malformed entries are skipped with a warning.
     */
    public List<String> getSupportedVersions() {
        String value = getStringProperty(SUPPORTED_VERSIONS, DEFAULT_SUPPORTED_VERSIONS);
        List<String> lines = new ArrayList<>();
        for (String part : value.split(",")) {
            String line = part.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (VERSION_LINE_PATTERN.matcher(line).matches()) {
                lines.add(line);
            } else {
                logger.warning("Ignoring invalid version line in " + SUPPORTED_VERSIONS + ": " + line);
            }
        }
        return Collections.unmodifiableList(lines);
    }
    
    /**
     * Checks a document's declared version against the supported version lines. Any patch
     * release of a supported line is accepted.
     */
    public boolean isSupportedVersion(String version) {
        if (version == null) {
            return false;
        }
        Matcher matcher = VERSION_PATTERN.matcher(version.trim());
        if (!matcher.matches()) {
            return false;
        }
        String line = new BigInteger(matcher.group(1)) + "." + new BigInteger(matcher.group(2));
        return getSupportedVersions().contains(line);
    }
    
    public boolean isWarnOnUnknownFields() {
        return getBooleanProperty(WARN_UNKNOWN_FIELDS, false);
    }
    
    public boolean isYamlDuplicateKeysAllowed() {
        return getBooleanProperty(YAML_ALLOW_DUPLICATE_KEYS, false);
    }
    
    public int getYamlMaxAliases() {
        return getIntProperty(YAML_MAX_ALIASES, DEFAULT_YAML_MAX_ALIASES);
    }
    
    public int getYamlIndent() {
        return getIntProperty(YAML_INDENT, DEFAULT_YAML_INDENT);
    }
    
    public boolean isJsonPrettyPrint() {
        return getBooleanProperty(JSON_PRETTY_PRINT, true);
    }
    
    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }
    
    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }
    
    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }
    
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }
    
    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value + 
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }
    
    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }
    
    private void loadDefaultConfiguration() {
        properties.setProperty(SUPPORTED_VERSIONS, DEFAULT_SUPPORTED_VERSIONS);
        properties.setProperty(WARN_UNKNOWN_FIELDS, "false");
        properties.setProperty(YAML_ALLOW_DUPLICATE_KEYS, "false");
        properties.setProperty(YAML_MAX_ALIASES, String.valueOf(DEFAULT_YAML_MAX_ALIASES));
        properties.setProperty(YAML_INDENT, String.valueOf(DEFAULT_YAML_INDENT));
        properties.setProperty(JSON_PRETTY_PRINT, "true");
    }
    
    private void loadConfigurationFromClasspath() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream("arazzo.properties")) {
            if (input != null) {
                properties.load(input);
                logger.fine("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }
    
    private void loadConfigurationFromSystemProperties() {
        // Override with system properties that start with "arazzo."
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("arazzo."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }
    
    @Override
    public String toString() {
        return "ArazzoConfiguration{" +
                "supportedVersions=" + getSupportedVersions() +
                ", warnOnUnknownFields=" + isWarnOnUnknownFields() +
                ", yamlIndent=" + getYamlIndent() +
                ", jsonPrettyPrint=" + isJsonPrettyPrint() +
                '}';
    }
}
