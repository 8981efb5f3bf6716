package me.christianrobert.hogql.config.service;

import me.christianrobert.hogql.util.ReservedKeywords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaults() {
        assertEquals(ConfigService.DEFAULT_MAX_QUERY_LENGTH, configService.getMaxQueryLength());
        assertFalse(configService.isIncludeParseTree());
        assertEquals(List.of("true", "false", "null", "team_id"),
                configService.getConfigValueAsStringList(ConfigService.RESERVED_KEYWORDS));
        assertTrue(configService.hasConfigKey(ConfigService.RESERVED_KEYWORDS_CASE_SENSITIVE));
    }

    @Test
    void defaultReservedKeywordsIgnoreCase() {
        ReservedKeywords keywords = configService.getReservedKeywords();

        assertFalse(keywords.isCaseSensitive());
        assertTrue(keywords.isReserved("Team_Id"));
        assertTrue(keywords.isReserved("NULL"));
        assertFalse(keywords.isReserved("select"));
    }

    @Test
    void caseSensitiveMatchingCanBeEnabled() {
        configService.setConfigValue(ConfigService.RESERVED_KEYWORDS_CASE_SENSITIVE, true);

        ReservedKeywords keywords = configService.getReservedKeywords();

        assertTrue(keywords.isReserved("team_id"));
        assertFalse(keywords.isReserved("TEAM_ID"));
    }

    @Test
    void reservedKeywordsFollowSettings() {
        // Given
        configService.updateConfiguration(Map.of(
                ConfigService.RESERVED_KEYWORDS, " join , on ,",
                ConfigService.RESERVED_KEYWORDS_CASE_SENSITIVE, "false"));

        // When
        ReservedKeywords keywords = configService.getReservedKeywords();

        // Then
        assertFalse(keywords.isCaseSensitive());
        assertTrue(keywords.isReserved("JOIN"));
        assertTrue(keywords.isReserved("on"));
        assertFalse(keywords.isReserved("team_id"));
    }

    @Test
    void reservedKeywordsAcceptJsonArrays() {
        configService.setConfigValue(ConfigService.RESERVED_KEYWORDS, List.of("limit", " "));

        assertEquals(List.of("limit"), configService.getConfigValueAsStringList(ConfigService.RESERVED_KEYWORDS));
    }

    @Test
    void integerValuesFromStrings() {
        configService.setConfigValue(ConfigService.MAX_QUERY_LENGTH, " 100 ");

        assertEquals(100, configService.getMaxQueryLength());
    }

    @Test
    void invalidMaxLengthFallsBackToDefault() {
        configService.setConfigValue(ConfigService.MAX_QUERY_LENGTH, "lots");
        assertEquals(ConfigService.DEFAULT_MAX_QUERY_LENGTH, configService.getMaxQueryLength());

        configService.setConfigValue(ConfigService.MAX_QUERY_LENGTH, -1);
        assertEquals(ConfigService.DEFAULT_MAX_QUERY_LENGTH, configService.getMaxQueryLength());
    }

    @Test
    void booleanValues() {
        configService.setConfigValue(ConfigService.INCLUDE_PARSE_TREE, "true");
        assertTrue(configService.isIncludeParseTree());

        configService.setConfigValue(ConfigService.INCLUDE_PARSE_TREE, 1);
        assertNull(configService.getConfigValueAsBoolean(ConfigService.INCLUDE_PARSE_TREE));
        assertFalse(configService.isIncludeParseTree());
    }

    @Test
    void resetRestoresDefaults() {
        configService.setConfigValue(ConfigService.MAX_QUERY_LENGTH, 10);
        configService.setConfigValue("custom", "x");

        configService.resetToDefaults();

        assertEquals(ConfigService.DEFAULT_MAX_QUERY_LENGTH, configService.getMaxQueryLength());
        assertFalse(configService.hasConfigKey("custom"));
    }

    @Test
    void getAllConfigurationIsACopy() {
        Map<String, Object> all = configService.getAllConfiguration();
        all.clear();

        assertTrue(configService.hasConfigKey(ConfigService.MAX_QUERY_LENGTH));
    }
}
