package com.example.transtructiver.parser;

import com.example.transtructiver.Node;

import java.nio.charset.StandardCharsets;

/**
 * Converts a backend parse tree into the {@link Node} model.
 */
public final class TreeAdapter {

    private TreeAdapter() {
    }

    /**
     * Leaves keep the exact token text, internal nodes get none. Child order is preserved,
     * since it defines path addressing downstream.
     *
     * @param raw        root of the backend tree
     * @param utf8Source the source the backend parsed, already known to be valid UTF-8
     */
    public static Node convert(RawNode raw, byte[] utf8Source) {
        if (raw.children().isEmpty()) {
            return new Node(raw.type(), leafText(raw, utf8Source), raw.isNamed());
        }
        Node node = new Node(raw.type(), null, raw.isNamed());
        for (RawNode child : raw.children()) {
            node.addChild(convert(child, utf8Source));
        }
        return node;
    }

    private static String leafText(RawNode raw, byte[] source) {
        return raw.text().orElseGet(() -> {
            int start = raw.startByte();
            int end = raw.endByte();
            if (start < 0 || end < start || end > source.length) {
                throw new IllegalArgumentException(
                        "Leaf '" + raw.type() + "' has no inline text and an invalid span [" + start + ", " + end + ")");
            }
            return new String(source, start, end - start, StandardCharsets.UTF_8);
        });
    }
}
