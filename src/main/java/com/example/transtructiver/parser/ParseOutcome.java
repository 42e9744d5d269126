package com.example.transtructiver.parser;

import com.example.transtructiver.Node;
import com.example.transtructiver.filter.DiscardReason;

import java.util.Optional;

/**
 * Either an accepted tree or the reason the sample was discarded, never both.
 */
public final class ParseOutcome {
    private final Node tree;
    private final DiscardReason reason;

    private ParseOutcome(Node tree, DiscardReason reason) {
        this.tree = tree;
        this.reason = reason;
    }

    public static ParseOutcome accepted(Node tree) {
        if (tree == null) {
            throw new IllegalArgumentException("Accepted outcome needs a tree");
        }
        return new ParseOutcome(tree, null);
    }

    public static ParseOutcome discarded(DiscardReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("Discarded outcome needs a reason");
        }
        return new ParseOutcome(null, reason);
    }

    public boolean isAccepted() {
        return tree != null;
    }

    public Optional<Node> tree() {
        return Optional.ofNullable(tree);
    }

    public Optional<DiscardReason> discardReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return isAccepted() ? "accepted " + tree.getType() : "discarded " + reason.code();
    }
}
