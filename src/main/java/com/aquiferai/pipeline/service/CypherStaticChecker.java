package com.aquiferai.pipeline.service;

import com.aquiferai.graph.SchemaVocabulary;
import com.aquiferai.pipeline.model.ValidationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural and schema checks run before a query reaches the graph store.
 */
@Component
@Slf4j
public class CypherStaticChecker {

    private static final Map<Character, Character> CLOSERS = Map.of(')', '(', ']', '[', '}', '{');
    private static final Pattern READ_WRITE_CLAUSE = Pattern.compile("\\b(MATCH|CREATE|MERGE)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RESULT_CLAUSE = Pattern.compile("\\bRETURN\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIMIT_CLAUSE = Pattern.compile("\\bLIMIT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NODE_LABELS = Pattern.compile(
            "\\(\\s*(?:[A-Za-z_][A-Za-z0-9_]*)?\\s*((?::\\s*`?[A-Za-z_][A-Za-z0-9_]*`?\\s*)+)");
    private static final Pattern REL_TYPES = Pattern.compile(
            "\\[\\s*(?:[A-Za-z_][A-Za-z0-9_]*)?\\s*:\\s*(!?`?[A-Za-z_][A-Za-z0-9_]*`?(?:\\s*\\|\\s*:?`?[A-Za-z_][A-Za-z0-9_]*`?)*)");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final List<MalformedPattern> MALFORMED_PATTERNS = List.of(
            new MalformedPattern(Pattern.compile("\\(\\s*:\\s*\\)"), "Empty label in node pattern"),
            new MalformedPattern(Pattern.compile("\\[\\s*:\\s*]"), "Empty relationship type"),
            new MalformedPattern(Pattern.compile(",\\s*,"), "Consecutive commas"),
            new MalformedPattern(Pattern.compile(",\\s*(?:RETURN|WHERE|LIMIT|ORDER\\s+BY)\\b", Pattern.CASE_INSENSITIVE),
                    "Dangling comma before clause"),
            new MalformedPattern(Pattern.compile("\\bRETURN\\s*(?:;\\s*)?$", Pattern.CASE_INSENSITIVE), "RETURN clause without items"),
            new MalformedPattern(Pattern.compile("\\bWHERE\\s+(?:RETURN|WITH|LIMIT)\\b", Pattern.CASE_INSENSITIVE),
                    "WHERE clause without a predicate"),
            new MalformedPattern(Pattern.compile("-\\s*>\\s*<\\s*-|<\\s*-\\s*-\\s*>"), "Conflicting relationship direction")
    );

    /**
     * Runs the syntax checks first and the schema checks second.
     *
     * @return null when the query passes both
     */
    @Nullable
    public CheckFailure check(String query, SchemaVocabulary vocabulary) {
        CheckFailure syntax = checkSyntax(query);
        if (syntax != null) {
            return syntax;
        }
        return checkSchema(query, vocabulary);
    }

    @Nullable
    public CheckFailure checkSyntax(String query) {
        if (!StringUtils.hasText(query)) {
            return new CheckFailure(ValidationStatus.SYNTAX_ERROR, "Query is empty");
        }
        String masked = CypherText.maskStringLiterals(query);
        String grouping = checkGrouping(masked);
        if (grouping != null) {
            return new CheckFailure(ValidationStatus.SYNTAX_ERROR, grouping);
        }
        if (!READ_WRITE_CLAUSE.matcher(masked).find()) {
            return new CheckFailure(ValidationStatus.SYNTAX_ERROR, "Missing MATCH, CREATE or MERGE clause");
        }
        if (!RESULT_CLAUSE.matcher(masked).find()) {
            return new CheckFailure(ValidationStatus.SYNTAX_ERROR, "Missing RETURN clause");
        }
        for (MalformedPattern malformed : MALFORMED_PATTERNS) {
            if (malformed.pattern().matcher(masked.trim()).find()) {
                return new CheckFailure(ValidationStatus.SYNTAX_ERROR, malformed.message());
            }
        }
        if (!LIMIT_CLAUSE.matcher(masked).find()) {
            log.warn("Query has no LIMIT clause: {}", CypherText.normalize(query));
        }
        return null;
    }

    @Nullable
    public CheckFailure checkSchema(String query, SchemaVocabulary vocabulary) {
        String masked = CypherText.maskStringLiterals(query);
        Set<String> unknownLabels = new LinkedHashSet<>();
        for (String label : referencedEntityKinds(masked)) {
            if (!vocabulary.knowsEntityKind(label)) {
                unknownLabels.add(label);
            }
        }
        Set<String> unknownTypes = new LinkedHashSet<>();
        for (String type : referencedRelationshipKinds(masked)) {
            if (!vocabulary.knowsRelationshipKind(type)) {
                unknownTypes.add(type);
            }
        }
        if (unknownLabels.isEmpty() && unknownTypes.isEmpty()) {
            return null;
        }
        StringBuilder message = new StringBuilder();
        if (!unknownLabels.isEmpty()) {
            message.append("Unknown entity kinds: ").append(String.join(", ", unknownLabels))
                    .append(". Known: ").append(String.join(", ", vocabulary.entityKinds())).append('.');
        }
        if (!unknownTypes.isEmpty()) {
            if (!message.isEmpty()) {
                message.append(' ');
            }
            message.append("Unknown relationship kinds: ").append(String.join(", ", unknownTypes))
                    .append(". Known: ").append(String.join(", ", vocabulary.relationshipKinds())).append('.');
        }
        return new CheckFailure(ValidationStatus.SCHEMA_ERROR, message.toString());
    }

    Set<String> referencedEntityKinds(String maskedQuery) {
        Set<String> labels = new LinkedHashSet<>();
        Matcher matcher = NODE_LABELS.matcher(maskedQuery);
        while (matcher.find()) {
            collectNames(matcher.group(1), labels);
        }
        return labels;
    }

    Set<String> referencedRelationshipKinds(String maskedQuery) {
        Set<String> types = new LinkedHashSet<>();
        Matcher matcher = REL_TYPES.matcher(maskedQuery);
        while (matcher.find()) {
            collectNames(matcher.group(1), types);
        }
        return types;
    }

    private static void collectNames(String fragment, Set<String> target) {
        Matcher names = NAME.matcher(fragment);
        while (names.find()) {
            target.add(names.group());
        }
    }

    @Nullable
    private static String checkGrouping(String maskedQuery) {
        Deque<Character> open = new ArrayDeque<>();
        for (int i = 0; i < maskedQuery.length(); i++) {
            char c = maskedQuery.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                open.push(c);
            } else if (CLOSERS.containsKey(c)) {
                if (open.isEmpty() || !open.peek().equals(CLOSERS.get(c))) {
                    return "Unbalanced grouping symbol '" + c + "' at position " + i;
                }
                open.pop();
            }
        }
        if (!open.isEmpty()) {
            return "Unclosed grouping symbol '" + open.peek() + "'";
        }
        return null;
    }

    public record CheckFailure(ValidationStatus status, String message) {
    }

    private record MalformedPattern(Pattern pattern, String message) {
    }
}
