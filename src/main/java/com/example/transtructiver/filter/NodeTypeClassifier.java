package com.example.transtructiver.filter;

/**
 * Decides what a node type denotes, independently of any grammar.
 */
public interface NodeTypeClassifier {

    /** Body, block or compound construct holding the statements of its parent. */
    boolean isBody(String type);

    boolean isMeaningful(String type);

    boolean isTrivial(String type);
}
