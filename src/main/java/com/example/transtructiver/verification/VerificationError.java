package com.example.transtructiver.verification;

/**
 * One discrepancy between an original tree and its mutated counterpart.
 */
public record VerificationError(Kind kind, String path, String detail) {

    public enum Kind {
        TYPE_MISMATCH,
        MUTATION_FAIL,
        UNEXPECTED_CHANGE,
        STRUCTURAL_MISMATCH
    }

    static VerificationError typeMismatch(String path, String originalType, String mutatedType) {
        return new VerificationError(Kind.TYPE_MISMATCH, path, originalType + " vs " + mutatedType);
    }

    static VerificationError mutationFail(String path, String expected, String actual) {
        return new VerificationError(Kind.MUTATION_FAIL, path, "Expected " + expected + ", got " + actual);
    }

    static VerificationError unexpectedChange(String path, String originalText, String mutatedText) {
        return new VerificationError(Kind.UNEXPECTED_CHANGE, path, originalText + " -> " + mutatedText);
    }

    static VerificationError structuralMismatch(String path) {
        return new VerificationError(Kind.STRUCTURAL_MISMATCH, path, "Child count differs");
    }

    @Override
    public String toString() {
        return kind + " at " + path + ": " + detail;
    }
}
