package com.aquiferai.pipeline.service;

import org.springframework.lang.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers for query strings returned by the model.
 */
public final class CypherText {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[a-zA-Z]*\\s*\\n?(.*?)```", Pattern.DOTALL);
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^'\\\\]|\\\\.)*'|\"(?:[^\"\\\\]|\\\\.)*\"");

    private CypherText() {
    }

    /**
     * Returns the content of the first markdown code block, or the trimmed input when there is none.
     */
    public static String stripCodeFences(@Nullable String raw) {
        if (raw == null) {
            return "";
        }
        Matcher matcher = FENCED_BLOCK.matcher(raw);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int newline = trimmed.indexOf('\n');
            trimmed = newline >= 0 ? trimmed.substring(newline + 1) : trimmed.substring(3);
        }
        if (trimmed.endsWith("```")) {
            trimmed = trimmed.substring(0, trimmed.length() - 3);
        }
        return trimmed.trim();
    }

    /**
     * Replaces string literal contents with blanks so structural checks ignore them.
     */
    public static String maskStringLiterals(String query) {
        Matcher matcher = STRING_LITERAL.matcher(query);
        StringBuilder masked = new StringBuilder();
        while (matcher.find()) {
            String literal = matcher.group();
            char quote = literal.charAt(0);
            matcher.appendReplacement(masked, Matcher.quoteReplacement(quote + " ".repeat(literal.length() - 2) + quote));
        }
        matcher.appendTail(masked);
        return masked.toString();
    }

    /**
     * Collapses whitespace; used to compare query texts across healing attempts.
     */
    public static String normalize(@Nullable String query) {
        if (query == null) {
            return "";
        }
        return query.trim().replaceAll("\\s+", " ");
    }
}
