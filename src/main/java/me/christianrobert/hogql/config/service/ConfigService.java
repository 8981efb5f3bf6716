package me.christianrobert.hogql.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.hogql.util.ReservedKeywords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runtime-editable parser settings, held in memory.
 *
 * <p>Known keys:
 * <ul>
 *   <li>{@value #RESERVED_KEYWORDS} - comma-separated words rejected as aliases</li>
 *   <li>{@value #RESERVED_KEYWORDS_CASE_SENSITIVE} - whether alias matching is case-sensitive</li>
 *   <li>{@value #MAX_QUERY_LENGTH} - longest accepted source text, in characters</li>
 *   <li>{@value #INCLUDE_PARSE_TREE} - default for the REST {@code showParseTree} flag</li>
 * </ul>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String RESERVED_KEYWORDS = "hogql.reserved-keywords";
    public static final String RESERVED_KEYWORDS_CASE_SENSITIVE = "hogql.reserved-keywords.case-sensitive";
    public static final String MAX_QUERY_LENGTH = "hogql.max-query-length";
    public static final String INCLUDE_PARSE_TREE = "hogql.include-parse-tree";

    public static final int DEFAULT_MAX_QUERY_LENGTH = 65536;

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(RESERVED_KEYWORDS, String.join(",", ReservedKeywords.DEFAULTS));
        configuration.put(RESERVED_KEYWORDS_CASE_SENSITIVE, false);
        configuration.put(MAX_QUERY_LENGTH, DEFAULT_MAX_QUERY_LENGTH);
        configuration.put(INCLUDE_PARSE_TREE, false);

        log.info("Configuration service initialized with default values");
    }

    public static Collection<String> knownKeys() {
        return Arrays.asList(RESERVED_KEYWORDS, RESERVED_KEYWORDS_CASE_SENSITIVE, MAX_QUERY_LENGTH, INCLUDE_PARSE_TREE);
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as an integer. Numbers and numeric strings are accepted.
     *
     * @return the value, or null if missing or not numeric
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value for {} is not an integer: {}", key, value);
                return null;
            }
        }
        return null;
    }

    /**
     * Gets a configuration value as a list of strings.
     * Supports comma-separated values ("select,from,where") and JSON arrays.
     * Trims whitespace and filters out empty strings.
     */
    public List<String> getConfigValueAsStringList(String key) {
        Object raw = configuration.get(key);
        if (raw instanceof Collection) {
            return ((Collection<?>) raw).stream()
                    .map(String::valueOf)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList());
        }
        String value = getConfigValueAsString(key);
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }

        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Builds the reserved alias set from the current settings.
     */
    public ReservedKeywords getReservedKeywords() {
        Boolean caseSensitive = getConfigValueAsBoolean(RESERVED_KEYWORDS_CASE_SENSITIVE);
        return new ReservedKeywords(getConfigValueAsStringList(RESERVED_KEYWORDS),
                Boolean.TRUE.equals(caseSensitive));
    }

    public int getMaxQueryLength() {
        Integer value = getConfigValueAsInteger(MAX_QUERY_LENGTH);
        return value != null && value > 0 ? value : DEFAULT_MAX_QUERY_LENGTH;
    }

    public boolean isIncludeParseTree() {
        return Boolean.TRUE.equals(getConfigValueAsBoolean(INCLUDE_PARSE_TREE));
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
