package com.example.transtructiver.pipeline;

import com.example.transtructiver.filter.DiscardReason;
import com.example.transtructiver.report.SummaryRecord;
import com.example.transtructiver.verification.VerificationResult;

import java.util.Optional;

/**
 * What happened to one sample: discarded before mutation, or verified with a result.
 */
public record SampleOutcome(String sampleId, DiscardReason discardReason, VerificationResult verification) {

    public static SampleOutcome discarded(String sampleId, DiscardReason reason) {
        return new SampleOutcome(sampleId, reason, null);
    }

    public static SampleOutcome verified(String sampleId, VerificationResult result) {
        return new SampleOutcome(sampleId, null, result);
    }

    public boolean isDiscarded() {
        return discardReason != null;
    }

    public Optional<SummaryRecord> toSummaryRecord() {
        return isDiscarded() ? Optional.empty() : Optional.of(SummaryRecord.of(sampleId, verification));
    }
}
