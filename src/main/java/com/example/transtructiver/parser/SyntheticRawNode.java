package com.example.transtructiver.parser;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;

import java.util.List;
import java.util.Optional;

/**
 * A raw node that was not produced by a parser: synthetic roots wrapping partial parses,
 * or a single error leaf standing for a source nothing could make sense of.
 */
@Builder
@AllArgsConstructor
public class SyntheticRawNode implements RawNode {
    private final String type;
    private final boolean error;
    private final boolean named;
    @Singular
    private final List<RawNode> children;
    private final String text;

    public static SyntheticRawNode root(String type, List<? extends RawNode> children) {
        return new SyntheticRawNode(type, false, true, List.copyOf(children), null);
    }

    public static SyntheticRawNode errorLeaf(String text) {
        return new SyntheticRawNode("ERROR", true, true, List.of(), text);
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public boolean isError() {
        return error;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public List<RawNode> children() {
        return children;
    }

    @Override
    public Optional<String> text() {
        return Optional.ofNullable(text);
    }
}
