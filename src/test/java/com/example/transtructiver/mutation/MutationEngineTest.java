package com.example.transtructiver.mutation;

import com.example.transtructiver.Node;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MutationEngineTest {

    private static Node tree() {
        return Node.of("function_definition",
                Node.leaf("identifier", "add"),
                Node.of("parameters", Node.leaf("identifier", "a"), new Node(",", ","), Node.leaf("identifier", "b")),
                Node.of("body", Node.leaf("number_literal", "1")));
    }

    @Test
    void renamesEveryIdentifier() {
        Node mutated = new RenameIdentifiersRule().apply(tree());

        assertThat(mutated.traverse().filter(n -> n.getType().equals("identifier")).map(Node::getText))
                .containsExactly("x_add", "x_a", "x_b");
        assertThat(mutated.nodeAt("0.1.1").get().getText()).isEqualTo(",");
        assertThat(mutated.nodeAt("0.2.0").get().getText()).isEqualTo("1");
    }

    @Test
    void identifierWithoutTextIsLeftAlone() {
        Node tree = Node.of("wrapper", new Node("identifier"));
        Node mutated = new RenameIdentifiersRule().apply(tree);
        assertThat(mutated.nodeAt("0.0").get().getText()).isNull();
    }

    @Test
    void emptyEngineReturnsInput() {
        Node input = tree();
        assertThat(new MutationEngine(List.of()).applyMutations(input)).isSameAs(input);
    }

    @Test
    void rulesRunInOrderOnPreviousResult() {
        List<String> calls = new ArrayList<>();
        MutationRule wrap = new MutationRule() {
            @Override
            public String name() {
                return "wrap";
            }

            @Override
            public Node apply(Node tree) {
                calls.add("wrap");
                return Node.of("wrapped", tree);
            }
        };
        MutationRule rename = new RenameIdentifiersRule() {
            @Override
            public Node apply(Node tree) {
                calls.add("rename:" + tree.getType());
                return super.apply(tree);
            }
        };

        Node result = new MutationEngine(List.of(wrap, rename, new RenameIdentifiersRule())).applyMutations(tree());

        assertThat(calls).containsExactly("wrap", "rename:wrapped");
        assertThat(result.getType()).isEqualTo("wrapped");
        assertThat(result.nodeAt("0.0.0").get().getText()).isEqualTo("x_x_add");
    }

    @Test
    void cloneKeepsOriginalIntact() {
        Node original = tree();
        new MutationEngine(List.of(new RenameIdentifiersRule())).applyMutations(original.clone());
        assertThat(original.nodeAt("0.0").get().getText()).isEqualTo("add");
    }
}
