package com.example.transtructiver.mutation;

import lombok.Getter;

import java.util.List;
import java.util.Set;

@Getter
public class UnknownMutationRuleException extends IllegalArgumentException {
    private final List<String> unknownRules;

    public UnknownMutationRuleException(List<String> unknownRules, Set<String> availableRules) {
        super("Unknown mutation rule(s) " + unknownRules + ", available: " + availableRules);
        this.unknownRules = List.copyOf(unknownRules);
    }
}
