package me.christianrobert.hogql.util;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Words that may not be used as column or table aliases.
 *
 * <p>The defaults are {@code true}, {@code false}, {@code null} and {@code team_id}, matched
 * case-insensitively, so {@code AS TEAM_ID} and {@code AS `True`} are rejected as well.
 */
public final class ReservedKeywords {

    public static final Set<String> DEFAULTS = Collections.unmodifiableSet(
            new LinkedHashSet<>(java.util.Arrays.asList("true", "false", "null", "team_id")));

    private final Set<String> keywords;
    private final boolean caseSensitive;

    public ReservedKeywords(Collection<String> keywords, boolean caseSensitive) {
        if (keywords == null) {
            throw new IllegalArgumentException("Reserved keywords cannot be null");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String keyword : keywords) {
            String trimmed = keyword.trim();
            if (!trimmed.isEmpty()) {
                normalized.add(caseSensitive ? trimmed : trimmed.toLowerCase(Locale.ROOT));
            }
        }
        this.keywords = Collections.unmodifiableSet(normalized);
        this.caseSensitive = caseSensitive;
    }

    public static ReservedKeywords defaults() {
        return new ReservedKeywords(DEFAULTS, false);
    }

    public boolean isReserved(String alias) {
        if (alias == null) {
            return false;
        }
        return keywords.contains(caseSensitive ? alias : alias.toLowerCase(Locale.ROOT));
    }

    public Set<String> getKeywords() {
        return keywords;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    @Override
    public String toString() {
        return "ReservedKeywords{keywords=" + keywords + ", caseSensitive=" + caseSensitive + "}";
    }
}
