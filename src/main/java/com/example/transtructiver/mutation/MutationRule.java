package com.example.transtructiver.mutation;

import com.example.transtructiver.Node;

/**
 * A deterministic tree transformation. Rules may modify the tree they are given and return
 * it, or return a new tree; callers pass a clone when the input must stay untouched.
 */
public interface MutationRule {

    String name();

    Node apply(Node tree);
}
