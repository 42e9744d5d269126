package com.example.transtructiver.parser;

import java.util.List;
import java.util.Optional;

/**
 * Minimal view of a node produced by a parsing backend.
 * <p>
 * Leaf text is recovered either from an inline value ({@link #text()}) or from the
 * {@link #startByte()}/{@link #endByte()} span into the UTF-8 encoded source.
 */
public interface RawNode {

    String type();

    /** True for nodes the backend emitted while recovering from a syntax error. */
    boolean isError();

    /** False for anonymous tokens such as punctuation and keywords. */
    boolean isNamed();

    List<? extends RawNode> children();

    default Optional<String> text() {
        return Optional.empty();
    }

    default int startByte() {
        return -1;
    }

    default int endByte() {
        return -1;
    }
}
