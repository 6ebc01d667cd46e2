package com.stratum.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits a migration script into individual SQL statements.
 *
 * <p>JDBC drivers differ in whether a single {@code execute} call accepts several statements, so
 * the executor runs scripts statement by statement on one connection inside one transaction. The
 * splitter breaks on {@code ;} except inside:
 *
 * <ul>
 *   <li>single-quoted literals and double-quoted identifiers (doubled quotes are escapes, as are
 *       backslashes in PostgreSQL {@code E'...'} literals)
 *   <li>{@code --} line comments and {@code /* *}{@code /} block comments
 *   <li>PostgreSQL dollar-quoted bodies ({@code $$ ... $$}, {@code $tag$ ... $tag$})
 *   <li>the {@code BEGIN ... END} body of a {@code CREATE TRIGGER} statement
 * </ul>
 *
 * <p>Statements made only of comments and whitespace are dropped. Text after the last {@code ;} is
 * returned as a final statement.
 */
public final class SqlScriptSplitter {

    // Words that may sit between CREATE and TRIGGER.
    private static final Set<String> TRIGGER_MODIFIERS =
            Set.of("OR", "REPLACE", "TEMP", "TEMPORARY", "CONSTRAINT");

    private SqlScriptSplitter() {
        // utility class
    }

    public static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean meaningful = false;
        String firstWord = null;
        boolean triggerPrefix = false;
        boolean trigger = false;
        int blockDepth = 0;

        int length = script.length();
        int i = 0;
        while (i < length) {
            char c = script.charAt(i);
            char next = i + 1 < length ? script.charAt(i + 1) : '\0';

            if (c == '-' && next == '-') {
                int end = script.indexOf('\n', i);
                end = end < 0 ? length : end;
                current.append(script, i, end);
                i = end;
                continue;
            }
            if (c == '/' && next == '*') {
                int close = script.indexOf("*/", i + 2);
                int end = close < 0 ? length : close + 2;
                current.append(script, i, end);
                i = end;
                continue;
            }
            if (c == '\'' || c == '"') {
                int end = skipQuoted(script, i, c, c == '\'' && isEscapeStringPrefix(script, i));
                current.append(script, i, end);
                meaningful = true;
                i = end;
                continue;
            }
            if (c == '$') {
                String tag = dollarTag(script, i);
                if (tag != null) {
                    int close = script.indexOf(tag, i + tag.length());
                    int end = close < 0 ? length : close + tag.length();
                    current.append(script, i, end);
                    meaningful = true;
                    i = end;
                    continue;
                }
            }
            if (Character.isLetter(c) || c == '_') {
                int end = i;
                while (end < length && isWordPart(script.charAt(end))) {
                    end++;
                }
                String word = script.substring(i, end);
                String upper = word.toUpperCase(Locale.ROOT);
                if (firstWord == null) {
                    firstWord = upper;
                    triggerPrefix = upper.equals("CREATE");
                } else if (triggerPrefix) {
                    if (upper.equals("TRIGGER")) {
                        trigger = true;
                        triggerPrefix = false;
                    } else if (!TRIGGER_MODIFIERS.contains(upper)) {
                        triggerPrefix = false;
                    }
                }
                if (trigger) {
                    if (upper.equals("BEGIN") || (blockDepth > 0 && upper.equals("CASE"))) {
                        blockDepth++;
                    } else if (blockDepth > 0 && upper.equals("END")) {
                        blockDepth--;
                    }
                }
                current.append(word);
                meaningful = true;
                i = end;
                continue;
            }
            if (c == ';' && blockDepth == 0) {
                if (meaningful) {
                    statements.add(current.toString().trim());
                }
                current.setLength(0);
                meaningful = false;
                firstWord = null;
                triggerPrefix = false;
                trigger = false;
                i++;
                continue;
            }

            current.append(c);
            if (!Character.isWhitespace(c)) {
                meaningful = true;
            }
            i++;
        }

        if (meaningful) {
            statements.add(current.toString().trim());
        }
        return List.copyOf(statements);
    }

    /** Returns the index just past the closing quote, or the end of input if unterminated. */
    private static int skipQuoted(String script, int start, char quote, boolean backslashEscapes) {
        int i = start + 1;
        while (i < script.length()) {
            if (backslashEscapes && script.charAt(i) == '\\') {
                i += 2;
                continue;
            }
            if (script.charAt(i) == quote) {
                if (i + 1 < script.length() && script.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return script.length();
    }

    /** Whether the quote at {@code quoteIndex} opens an {@code E'...'} escape string. */
    private static boolean isEscapeStringPrefix(String script, int quoteIndex) {
        if (quoteIndex < 1) {
            return false;
        }
        char prefix = script.charAt(quoteIndex - 1);
        return (prefix == 'E' || prefix == 'e')
                && (quoteIndex < 2 || !isWordPart(script.charAt(quoteIndex - 2)));
    }

    /** Returns the dollar-quote tag starting at {@code start} (e.g. {@code $body$}), or null. */
    private static String dollarTag(String script, int start) {
        int i = start + 1;
        if (i < script.length() && script.charAt(i) == '$') {
            return "$$";
        }
        if (i >= script.length()
                || !(Character.isLetter(script.charAt(i)) || script.charAt(i) == '_')) {
            return null;
        }
        while (i < script.length() && isWordPart(script.charAt(i))) {
            i++;
        }
        if (i < script.length() && script.charAt(i) == '$') {
            return script.substring(start, i + 1);
        }
        return null;
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
