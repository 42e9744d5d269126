package com.example.transtructiver.mutation;

import com.example.transtructiver.Node;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies an ordered list of rules, each one to the result of the previous.
 */
public class MutationEngine {

    private final List<MutationRule> rules;

    public MutationEngine(List<MutationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public Node applyMutations(Node tree) {
        Node current = tree;
        for (MutationRule rule : rules) {
            current = rule.apply(current);
        }
        return current;
    }

    public List<MutationRule> getRules() {
        return rules;
    }

    public List<String> ruleNames() {
        return rules.stream().map(MutationRule::name).collect(Collectors.toList());
    }
}
