package com.example.transtructiver.filter;

import com.example.transtructiver.parser.RawNode;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a parsed sample is worth mutating and verifying.
 * <p>
 * The checks run in a fixed order and the first failing one names the discard reason.
 * Classification depends on nothing but the tree and the source text.
 */
public class QualityFilter {

    private final NodeTypeClassifier classifier;

    public QualityFilter(NodeTypeClassifier classifier) {
        this.classifier = classifier;
    }

    public Optional<DiscardReason> classify(RawNode root, String source) {
        if (source.strip().isEmpty()) {
            return Optional.of(DiscardReason.EMPTY_SOURCE);
        }

        List<? extends RawNode> children = root.children();
        if (children.isEmpty()) {
            return Optional.of(DiscardReason.NO_CHILDREN);
        }

        if (children.stream().allMatch(RawNode::isError)) {
            return Optional.of(DiscardReason.ROOT_ERROR_ONLY);
        }

        if (children.stream().noneMatch(this::hasMeaningfulStructure)) {
            return Optional.of(DiscardReason.NO_MEANINGFUL_STRUCTURE);
        }

        return Optional.empty();
    }

    /**
     * Looks into the node's body (or the node itself when it has none) for at least one named
     * child that is meaningful and not trivial.
     */
    public boolean hasMeaningfulStructure(RawNode node) {
        RawNode target = node.children().stream()
                .filter(child -> classifier.isBody(child.type()))
                .findFirst()
                .map(RawNode.class::cast)
                .orElse(node);

        return target.children().stream()
                .filter(RawNode::isNamed)
                .anyMatch(child -> classifier.isMeaningful(child.type()) && !classifier.isTrivial(child.type()));
    }
}
