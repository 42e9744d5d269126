package com.example.transtructiver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    private static Node sampleTree() {
        return Node.of("function_definition",
                Node.leaf("identifier", "add"),
                Node.of("parameters", Node.leaf("identifier", "a"), Node.leaf("identifier", "b")));
    }

    @Test
    void internalNodeCannotCarryText() {
        Node leaf = Node.leaf("identifier", "a");
        assertThatThrownBy(() -> leaf.addChild(Node.leaf("identifier", "b")))
                .isInstanceOf(IllegalStateException.class);

        Node internal = Node.of("block", Node.leaf("identifier", "a"));
        assertThatThrownBy(() -> internal.setText("x")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void childIsOwnedByOneParent() {
        Node child = Node.leaf("identifier", "a");
        Node.of("first", child);
        assertThatThrownBy(() -> Node.of("second", child)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsCycles() {
        Node inner = new Node("inner");
        Node outer = Node.of("outer", inner);
        assertThatThrownBy(() -> inner.addChild(outer)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> inner.addChild(inner)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsEmptyType() {
        assertThatThrownBy(() -> new Node("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cloneIsDeepAndDetached() {
        Node original = sampleTree();
        Node copy = original.clone();

        copy.nodeAt("0.1.0").get().setText("x_a");

        assertThat(original.nodeAt("0.1.0").get().getText()).isEqualTo("a");
        assertThat(copy.getParent()).isNull();
        assertThat(copy.toString()).isEqualTo(
                "(function_definition (identifier \"add\") (parameters (identifier \"x_a\") (identifier \"b\")))");
        assertThat(copy.nodeAt("0.1").get().isNamed()).isTrue();
    }

    @Test
    void traversesInPreorder() {
        assertThat(sampleTree().traverse().map(Node::getType))
                .containsExactly("function_definition", "identifier", "parameters", "identifier", "identifier");
    }

    @Test
    void pathsAddressEveryNode() {
        Node tree = sampleTree();
        assertThat(tree.paths()).containsExactly("0", "0.0", "0.1", "0.1.0", "0.1.1");
        assertThat(tree.nodeAt("0").get()).isSameAs(tree);
        assertThat(tree.nodeAt("0.1.1").get().getText()).isEqualTo("b");
        assertThat(tree.nodeAt("0.2")).isEmpty();
        assertThat(tree.nodeAt("0.0.0")).isEmpty();
    }

    @Test
    void prettyShowsTextOfNamedLeavesOnly() {
        Node tree = Node.of("block", new Node("{", "{"), Node.leaf("identifier", "a"));
        String nl = System.lineSeparator();
        assertThat(tree.pretty()).isEqualTo("block" + nl + "  {" + nl + "  identifier: a" + nl);
    }
}
