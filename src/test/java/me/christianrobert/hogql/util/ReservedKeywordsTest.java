package me.christianrobert.hogql.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReservedKeywordsTest {

    @Test
    void defaultsRejectTheFourKeywords() {
        ReservedKeywords keywords = ReservedKeywords.defaults();

        assertTrue(keywords.isReserved("true"));
        assertTrue(keywords.isReserved("false"));
        assertTrue(keywords.isReserved("null"));
        assertTrue(keywords.isReserved("team_id"));
        assertFalse(keywords.isReserved("select"));
        assertFalse(keywords.isReserved("events"));
    }

    @Test
    void defaultsIgnoreCase() {
        ReservedKeywords keywords = ReservedKeywords.defaults();

        assertFalse(keywords.isCaseSensitive());
        assertTrue(keywords.isReserved("TEAM_ID"));
        assertTrue(keywords.isReserved("True"));
    }

    @Test
    void caseSensitiveMatchingIsExact() {
        ReservedKeywords keywords = new ReservedKeywords(List.of("team_id"), true);

        assertTrue(keywords.isReserved("team_id"));
        assertFalse(keywords.isReserved("TEAM_ID"));
    }

    @Test
    void caseInsensitiveMatching() {
        ReservedKeywords keywords = new ReservedKeywords(List.of("Select", " from "), false);

        assertTrue(keywords.isReserved("SELECT"));
        assertTrue(keywords.isReserved("From"));
        assertFalse(keywords.isReserved("where"));
    }

    @Test
    void blankEntriesAreIgnored() {
        ReservedKeywords keywords = new ReservedKeywords(List.of("a", " ", ""), true);

        assertEquals(1, keywords.getKeywords().size());
    }

    @Test
    void nullAliasIsNeverReserved() {
        assertFalse(ReservedKeywords.defaults().isReserved(null));
    }

    @Test
    void nullKeywordsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ReservedKeywords(null, true));
    }
}
