package com.example.transtructiver.report;

import com.example.transtructiver.verification.VerificationResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of the result log.
 */
@JsonPropertyOrder({"sample_id", "score", "reason"})
public record SummaryRecord(
        @JsonProperty("sample_id") String sampleId,
        @JsonProperty("score") double score,
        @JsonProperty("reason") String reason) {

    public static SummaryRecord of(String sampleId, VerificationResult result) {
        return new SummaryRecord(sampleId, result.score(), result.reason());
    }
}
