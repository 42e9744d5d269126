package com.example.transtructiver.verification;

import java.util.List;
import java.util.Optional;

public record VerificationResult(boolean verified, List<VerificationError> errors) {

    public static final String NO_ERROR = "N/A";

    public VerificationResult {
        errors = List.copyOf(errors);
    }

    public static VerificationResult of(List<VerificationError> errors) {
        return new VerificationResult(errors.isEmpty(), errors);
    }

    /** The first error encountered, if any. */
    public Optional<VerificationError> headline() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
    }

    public double score() {
        return verified ? 1.0 : 0.0;
    }

    public String reason() {
        return headline().map(VerificationError::toString).orElse(NO_ERROR);
    }
}
