package com.example.transtructiver.pipeline;

import com.example.transtructiver.filter.DiscardReason;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

@Getter
@Builder
public class PipelineReport {
    private final int total;
    private final int verified;
    private final int failed;
    private final int crashed;
    @Builder.Default
    private final Map<DiscardReason, Integer> discarded = new EnumMap<>(DiscardReason.class);
    private final Duration elapsed;

    public int getDiscardedTotal() {
        return discarded.values().stream().mapToInt(Integer::intValue).sum();
    }

    public String summary() {
        String reasons = discarded.entrySet().stream()
                .map(e -> e.getKey().code() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return String.format("%d samples in %d ms: %d verified, %d failed, %d discarded [%s], %d crashed",
                total, elapsed.toMillis(), verified, failed, getDiscardedTotal(), reasons, crashed);
    }
}
