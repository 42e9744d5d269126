package com.example.transtructiver.pipeline;

import com.example.transtructiver.Node;
import com.example.transtructiver.config.AuditProperties;
import com.example.transtructiver.data.ManifestRepository;
import com.example.transtructiver.data.Sample;
import com.example.transtructiver.filter.DiscardReason;
import com.example.transtructiver.mutation.MutationEngine;
import com.example.transtructiver.parser.ParseOutcome;
import com.example.transtructiver.parser.ParserFactory;
import com.example.transtructiver.parser.SourceParser;
import com.example.transtructiver.report.SummaryLogWriter;
import com.example.transtructiver.verification.Manifest;
import com.example.transtructiver.verification.StructuralVerifier;
import com.example.transtructiver.verification.VerificationResult;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Parse, filter, mutate and verify every sample of a corpus, appending one result row per
 * verified sample.
 */
@Service
public class AuditPipeline {
    private static final Logger log = LoggerFactory.getLogger(AuditPipeline.class);
    private final Logger timingLog = LoggerFactory.getLogger("fileOnlyLogger");

    private final SourceParser sourceParser;
    private final ParserFactory parserFactory;
    private final StructuralVerifier verifier;
    private final SummaryLogWriter summaryLog;
    private final AuditProperties properties;

    private long maxSampleTimeMs = -1;

    public AuditPipeline(SourceParser sourceParser,
                         ParserFactory parserFactory,
                         StructuralVerifier verifier,
                         SummaryLogWriter summaryLog,
                         AuditProperties properties) {
        this.sourceParser = sourceParser;
        this.parserFactory = parserFactory;
        this.verifier = verifier;
        this.summaryLog = summaryLog;
        this.properties = properties;
    }

    /**
     * Runs a single sample. The parsed tree is cloned before mutation, so the original
     * stays intact for verification.
     */
    public SampleOutcome process(Sample sample, MutationEngine engine, Manifest manifest) {
        Stopwatch sw = Stopwatch.createStarted();
        ParseOutcome parsed = sourceParser.parse(sample.getCode(), sample.getLanguage());
        if (!parsed.isAccepted()) {
            DiscardReason reason = parsed.discardReason().get();
            log.debug("Sample {} discarded: {}", sample.getId(), reason.code());
            return SampleOutcome.discarded(sample.getId(), reason);
        }

        Node original = parsed.tree().get();
        Node mutated = engine.applyMutations(original.clone());
        if (properties.debug()) {
            log.info("Sample {} original:{}{}", sample.getId(), System.lineSeparator(), original.pretty());
            log.info("Sample {} mutated:{}{}", sample.getId(), System.lineSeparator(), mutated.pretty());
        }

        VerificationResult result = verifier.verify(original, mutated, manifest);
        sw.stop();
        recordTiming(sample, sw.elapsed(TimeUnit.MILLISECONDS), original);

        if (!result.verified()) {
            log.debug("Sample {} failed verification with {} error(s): {}",
                    sample.getId(), result.errors().size(), result.reason());
        }
        return SampleOutcome.verified(sample.getId(), result);
    }

    /**
     * Processes the whole corpus on a fixed worker pool. Languages are checked before any
     * sample is touched; results are logged in corpus order.
     *
     * @throws com.example.transtructiver.parser.UnsupportedLanguageException if any sample
     *         names a language without a parser
     */
    public PipelineReport run(List<Sample> samples, MutationEngine engine, ManifestRepository manifests) {
        samples.forEach(sample -> parserFactory.requireSupported(sample.getLanguage()));
        synchronized (this) {
            maxSampleTimeMs = -1;
        }

        Stopwatch total = Stopwatch.createStarted();
        int threads = properties.effectiveWorkers();
        log.info("Processing {} samples on {} worker(s) with rules {}", samples.size(), threads, engine.ruleNames());

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        List<Future<SampleOutcome>> futures = new ArrayList<>(samples.size());
        try {
            for (Sample sample : samples) {
                futures.add(exec.submit(() -> process(sample, engine, manifests.forSample(sample.getId()))));
            }

            int verified = 0;
            int failed = 0;
            int crashed = 0;
            Map<DiscardReason, Integer> discarded = new EnumMap<>(DiscardReason.class);

            for (int i = 0; i < futures.size(); i++) {
                SampleOutcome outcome;
                try {
                    outcome = futures.get(i).get();
                } catch (ExecutionException e) {
                    log.error("Sample {} failed: {}", samples.get(i).getId(), e.getCause().toString(), e.getCause());
                    crashed++;
                    continue;
                }

                if (outcome.isDiscarded()) {
                    discarded.merge(outcome.discardReason(), 1, Integer::sum);
                    continue;
                }
                outcome.toSummaryRecord().ifPresent(summaryLog::append);
                if (outcome.verification().verified()) {
                    verified++;
                } else {
                    failed++;
                }
            }

            total.stop();
            return PipelineReport.builder()
                    .total(samples.size())
                    .verified(verified)
                    .failed(failed)
                    .crashed(crashed)
                    .discarded(discarded)
                    .elapsed(total.elapsed())
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Processing interrupted", e);
        } finally {
            exec.shutdownNow();
        }
    }

    /**
     * Slowest verified sample of the current or last run, in milliseconds; -1 before any.
     */
    public synchronized long getSlowestSampleMillis() {
        return maxSampleTimeMs;
    }

    private void recordTiming(Sample sample, long elapsedMs, Node tree) {
        synchronized (this) {
            if (elapsedMs > maxSampleTimeMs) {
                maxSampleTimeMs = elapsedMs;
                timingLog.info("Slowest sample so far: '{}' ({}), {} ms, {} nodes",
                        sample.getId(), sample.getLanguage(), elapsedMs, tree.traverse().count());
            }
        }
    }
}
