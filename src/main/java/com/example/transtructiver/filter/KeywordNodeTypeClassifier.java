package com.example.transtructiver.filter;

import com.google.common.base.Splitter;

import java.util.List;

/**
 * Keyword based classification of node types.
 * <ul>
 *     <li>{@link MatchMode#SUBSTRING}: a keyword matches when it occurs anywhere in the type
 *     name, so {@code expression_statement} and {@code subexpression} both contain
 *     {@code expression}.</li>
 *     <li>{@link MatchMode#TOKEN}: a keyword matches only one whole {@code _}-separated segment
 *     of the type name, so {@code expression_statement} matches but {@code subexpression}
 *     does not.</li>
 * </ul>
 */
public class KeywordNodeTypeClassifier implements NodeTypeClassifier {

    public enum MatchMode { SUBSTRING, TOKEN }

    public static final List<String> BODY_KEYWORDS = List.of("block", "suite", "compound");

    public static final List<String> MEANINGFUL_KEYWORDS = List.of(
            "expression", "statement", "definition", "declaration", "assignment", "block", "suite");

    public static final List<String> TRIVIAL_KEYWORDS = List.of("return", "break", "continue", "empty");

    private static final Splitter SEGMENTS = Splitter.on('_').omitEmptyStrings();

    private final MatchMode mode;

    public KeywordNodeTypeClassifier(MatchMode mode) {
        this.mode = mode;
    }

    public static KeywordNodeTypeClassifier substring() {
        return new KeywordNodeTypeClassifier(MatchMode.SUBSTRING);
    }

    public static KeywordNodeTypeClassifier token() {
        return new KeywordNodeTypeClassifier(MatchMode.TOKEN);
    }

    public MatchMode getMode() {
        return mode;
    }

    @Override
    public boolean isBody(String type) {
        return matchesAny(type, BODY_KEYWORDS);
    }

    @Override
    public boolean isMeaningful(String type) {
        return matchesAny(type, MEANINGFUL_KEYWORDS);
    }

    @Override
    public boolean isTrivial(String type) {
        return matchesAny(type, TRIVIAL_KEYWORDS);
    }

    private boolean matchesAny(String type, List<String> keywords) {
        if (mode == MatchMode.SUBSTRING) {
            return keywords.stream().anyMatch(type::contains);
        }
        List<String> segments = SEGMENTS.splitToList(type);
        return keywords.stream().anyMatch(segments::contains);
    }
}
