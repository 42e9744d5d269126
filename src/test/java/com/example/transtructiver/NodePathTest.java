package com.example.transtructiver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodePathTest {

    @Test
    void buildsChildPaths() {
        assertThat(NodePath.child(NodePath.ROOT, 2)).isEqualTo("0.2");
        assertThat(NodePath.child("0.2", 0)).isEqualTo("0.2.0");
        assertThatThrownBy(() -> NodePath.child("0", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesIndices() {
        assertThat(NodePath.indices("0")).isEmpty();
        assertThat(NodePath.indices("0.10.3")).containsExactly(10, 3);
        assertThat(NodePath.depth("0.1.2")).isEqualTo(2);
    }

    @Test
    void rejectsMalformedPaths() {
        assertThatThrownBy(() -> NodePath.indices("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodePath.indices("1.0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodePath.indices("0..1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodePath.indices("0.a")).isInstanceOf(IllegalArgumentException.class);
    }
}
