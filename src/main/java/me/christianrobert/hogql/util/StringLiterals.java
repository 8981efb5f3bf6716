package me.christianrobert.hogql.util;

import me.christianrobert.hogql.context.ParsingException;

/**
 * Unquoting and unescaping of string literals, quoted identifiers and placeholders.
 *
 * <p>Supported delimiters:
 * <ul>
 *   <li>{@code 'text'} - doubled {@code ''} or {@code \'} for a quote</li>
 *   <li>{@code "text"} - doubled {@code ""} or {@code \"}</li>
 *   <li>{@code `text`} - doubled {@code ``} or {@code \`}</li>
 *   <li>{@code {text}} - doubled {@code {{} or {@code \{}</li>
 * </ul>
 * After the delimiter-specific step the common backslash escapes are translated.
 */
public final class StringLiterals {

    private StringLiterals() {
    }

    public static String parseString(String text) {
        if (text == null || text.length() < 2) {
            throw invalid(text);
        }
        char first = text.charAt(0);
        char last = text.charAt(text.length() - 1);
        String body = text.substring(1, text.length() - 1);

        if (first == '\'' && last == '\'') {
            body = body.replace("''", "'").replace("\\'", "'");
        } else if (first == '"' && last == '"') {
            body = body.replace("\"\"", "\"").replace("\\\"", "\"");
        } else if (first == '`' && last == '`') {
            body = body.replace("``", "`").replace("\\`", "`");
        } else if (first == '{' && last == '}') {
            body = body.replace("{{", "{").replace("\\{", "{");
        } else {
            throw invalid(text);
        }
        return replaceCommonEscapes(body);
    }

    /**
     * Unquotes an identifier if it is back-quoted or double-quoted; other identifiers pass through verbatim.
     */
    public static String parseIdentifier(String text) {
        if (isQuoted(text, '`') || isQuoted(text, '"')) {
            return parseString(text);
        }
        return text;
    }

    static String replaceCommonEscapes(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 == text.length()) {
                sb.append(c);
                continue;
            }
            char next = text.charAt(++i);
            switch (next) {
                case 'a': sb.append('\u0007'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case 'n': sb.append('\n'); break;
                case 'r': sb.append('\r'); break;
                case 't': sb.append('\t'); break;
                case 'v': sb.append('\u000B'); break;
                case '0': break;
                case '\\': sb.append('\\'); break;
                default:
                    // unknown escapes are kept as written
                    sb.append('\\').append(next);
            }
        }
        return sb.toString();
    }

    private static boolean isQuoted(String text, char quote) {
        return text != null
                && text.length() >= 2
                && text.charAt(0) == quote
                && text.charAt(text.length() - 1) == quote;
    }

    private static ParsingException invalid(String text) {
        return new ParsingException("Invalid string literal, must start and end with the same quote type: " + text);
    }
}
