package com.example.transtructiver.mutation;

import com.example.transtructiver.Node;

/**
 * Prefixes the text of every {@code identifier} node with {@code x_}.
 */
public class RenameIdentifiersRule implements MutationRule {

    public static final String NAME = "rename-identifier";
    public static final String IDENTIFIER_TYPE = "identifier";
    public static final String PREFIX = "x_";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Node apply(Node tree) {
        tree.traverse()
                .filter(node -> IDENTIFIER_TYPE.equals(node.getType()) && node.getText() != null)
                .forEach(node -> node.setText(PREFIX + node.getText()));
        return tree;
    }
}
