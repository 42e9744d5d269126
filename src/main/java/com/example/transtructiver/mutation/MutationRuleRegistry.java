package com.example.transtructiver.mutation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Name to rule lookup for the command line.
 */
@Component
public class MutationRuleRegistry {

    private static final Map<String, Supplier<MutationRule>> ruleRegistry = new TreeMap<>();

    static {
        ruleRegistry.put(RenameIdentifiersRule.NAME, RenameIdentifiersRule::new);
    }

    /**
     * Builds an engine for the given rules, in order. All names are checked before any rule
     * is instantiated.
     *
     * @throws UnknownMutationRuleException naming every unknown rule
     */
    public MutationEngine createEngine(List<String> ruleNames) {
        List<String> unknown = ruleNames.stream()
                .filter(name -> !ruleRegistry.containsKey(name))
                .toList();
        if (!unknown.isEmpty()) {
            throw new UnknownMutationRuleException(unknown, availableRules());
        }

        List<MutationRule> rules = new ArrayList<>(ruleNames.size());
        for (String name : ruleNames) {
            rules.add(ruleRegistry.get(name).get());
        }
        return new MutationEngine(rules);
    }

    public Set<String> availableRules() {
        return ruleRegistry.keySet();
    }
}
