package com.example.transtructiver;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A node of a concrete syntax tree.
 * <p>
 * Leaves may carry the raw token text; internal nodes never do. Children are owned by
 * exactly one parent, so a node can only be attached once and never below itself.
 */
@Getter
public class Node {
    private final String type;
    private final boolean named;
    private final List<Node> children = new ArrayList<>();
    private String text;
    private Node parent;

    public Node(String type) {
        this(type, null, false);
    }

    public Node(String type, String text) {
        this(type, text, false);
    }

    public Node(String type, String text, boolean named) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(type), "Node type must not be empty");
        this.type = type;
        this.text = text;
        this.named = named;
    }

    public static Node leaf(String type, String text) {
        return new Node(type, text, true);
    }

    public static Node of(String type, Node... children) {
        Node node = new Node(type, null, true);
        for (Node child : children) {
            node.addChild(child);
        }
        return node;
    }

    public void addChild(Node child) {
        Preconditions.checkNotNull(child, "child");
        Preconditions.checkState(text == null, "Node '%s' carries text and cannot have children", type);
        Preconditions.checkArgument(child.parent == null, "Node '%s' is already attached to a parent", child.type);
        for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            Preconditions.checkArgument(ancestor != child, "Attaching '%s' would create a cycle", child.type);
        }
        child.parent = this;
        children.add(child);
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Replaces the token text of a leaf. Mutation rules use this on cloned trees.
     */
    public void setText(String text) {
        Preconditions.checkState(children.isEmpty(), "Internal node '%s' cannot carry text", type);
        this.text = text;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * All nodes of this subtree in preorder.
     */
    public Stream<Node> traverse() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(Node::traverse));
    }

    /**
     * Deep copy of this subtree. The copy is detached from any parent.
     */
    @Override
    public Node clone() {
        Node copy = new Node(type, text, named);
        for (Node child : children) {
            copy.addChild(child.clone());
        }
        return copy;
    }

    /**
     * Resolves a path relative to this node, which is treated as the root {@code "0"}.
     */
    public Optional<Node> nodeAt(String path) {
        Node current = this;
        for (int index : NodePath.indices(path)) {
            if (index >= current.children.size()) {
                return Optional.empty();
            }
            current = current.children.get(index);
        }
        return Optional.of(current);
    }

    /**
     * Every valid path of this subtree in preorder, starting with the root.
     */
    public List<String> paths() {
        List<String> result = new ArrayList<>();
        collectPaths(this, NodePath.ROOT, result);
        return result;
    }

    private static void collectPaths(Node node, String path, List<String> out) {
        out.add(path);
        for (int i = 0; i < node.children.size(); i++) {
            collectPaths(node.children.get(i), NodePath.child(path, i), out);
        }
    }

    /**
     * Indented, one node per line. Text is shown for named leaves only.
     */
    public String pretty() {
        StringBuilder sb = new StringBuilder();
        appendPretty(sb, 0);
        return sb.toString();
    }

    private void appendPretty(StringBuilder sb, int indent) {
        sb.append("  ".repeat(indent)).append(type);
        if (text != null && named) {
            sb.append(": ").append(text);
        }
        sb.append(System.lineSeparator());
        for (Node child : children) {
            child.appendPretty(sb, indent + 1);
        }
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return text == null ? "(" + type + ")" : "(" + type + " \"" + text + "\")";
        }
        var sb = new StringBuilder("(" + type);
        for (var c : children) {
            sb.append(" ").append(c.toString());
        }
        sb.append(")");
        return sb.toString();
    }
}
