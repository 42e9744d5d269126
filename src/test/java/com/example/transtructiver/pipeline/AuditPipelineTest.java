package com.example.transtructiver.pipeline;

import com.example.transtructiver.Node;
import com.example.transtructiver.config.AuditProperties;
import com.example.transtructiver.data.ManifestRepository;
import com.example.transtructiver.data.Sample;
import com.example.transtructiver.filter.DiscardReason;
import com.example.transtructiver.filter.KeywordNodeTypeClassifier;
import com.example.transtructiver.filter.QualityFilter;
import com.example.transtructiver.mutation.MutationEngine;
import com.example.transtructiver.mutation.MutationRuleRegistry;
import com.example.transtructiver.parser.ParserFactory;
import com.example.transtructiver.parser.SourceParser;
import com.example.transtructiver.parser.UnsupportedLanguageException;
import com.example.transtructiver.report.SummaryLogWriter;
import com.example.transtructiver.verification.Manifest;
import com.example.transtructiver.verification.StructuralVerifier;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditPipelineTest {

    private static final String ADD = "int add(int a, int b) { int c = a + b; return c; }";

    @TempDir
    Path dir;

    private Path log;
    private SourceParser sourceParser;
    private AuditPipeline pipeline;
    private final MutationEngine engine = new MutationRuleRegistry().createEngine(List.of("rename-identifier"));

    @BeforeEach
    void setUp() {
        log = dir.resolve("summary_log.csv");
        sourceParser = new SourceParser(new ParserFactory(), new QualityFilter(KeywordNodeTypeClassifier.substring()));
        AuditProperties properties = new AuditProperties(log.toString(), 2, null, null, true);
        pipeline = new AuditPipeline(sourceParser, new ParserFactory(), new StructuralVerifier(),
                new SummaryLogWriter(log), properties);
    }

    private static Sample sample(String id, String code, String language) {
        return Sample.builder().id(id).code(code).language(language).build();
    }

    private List<List<String>> readRows() throws IOException {
        CsvMapper mapper = new CsvMapper().enable(CsvParser.Feature.WRAP_AS_ARRAY);
        try (MappingIterator<List<String>> rows = mapper.readerForListOf(String.class).readValues(log.toFile())) {
            return rows.readAll();
        }
    }

    /** Every identifier of the parsed sample, renamed the way the rename rule does it. */
    private Manifest renameManifest(String code, String language) {
        Node tree = sourceParser.parse(code, language).tree().orElseThrow();
        Map<String, String> renames = tree.paths().stream()
                .filter(path -> tree.nodeAt(path).get().getType().equals("identifier"))
                .collect(Collectors.toMap(path -> path, path -> "x_" + tree.nodeAt(path).get().getText()));
        return new Manifest(renames, Set.of());
    }

    @Test
    void processVerifiesRenamedSample() {
        SampleOutcome outcome = pipeline.process(sample("s1", ADD, "c"), engine, renameManifest(ADD, "c"));

        assertThat(outcome.isDiscarded()).isFalse();
        assertThat(outcome.verification().verified()).isTrue();
        assertThat(outcome.toSummaryRecord()).isPresent();
    }

    @Test
    void processWithEmptyManifestFailsOnFirstIdentifier() {
        SampleOutcome outcome = pipeline.process(sample("s1", ADD, "c"), engine, Manifest.EMPTY);

        assertThat(outcome.verification().verified()).isFalse();
        assertThat(outcome.verification().reason()).isEqualTo("UNEXPECTED_CHANGE at 0.0.1: add -> x_add");
    }

    @Test
    void runLogsVerifiedSamplesInCorpusOrder() throws IOException {
        Files.writeString(log, "earlier,1.0,N/A\n");
        List<Sample> samples = List.of(
                sample("ok", ADD, "c"),
                sample("blank", "   ", "c"),
                sample("trivial", "void f() { return; }", "c"),
                sample("unlisted", ADD, "c"),
                sample("java", ADD, "java"));
        ManifestRepository manifests = new ManifestRepository(Map.of(
                "ok", renameManifest(ADD, "c"),
                "java", renameManifest(ADD, "java")));

        PipelineReport report = pipeline.run(samples, engine, manifests);

        assertThat(report.getTotal()).isEqualTo(5);
        assertThat(report.getVerified()).isEqualTo(2);
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getCrashed()).isZero();
        assertThat(report.getDiscarded())
                .containsEntry(DiscardReason.EMPTY_SOURCE, 1)
                .containsEntry(DiscardReason.NO_MEANINGFUL_STRUCTURE, 1);
        assertThat(report.getDiscardedTotal()).isEqualTo(2);
        assertThat(report.summary()).contains("2 verified", "1 failed", "2 discarded");

        assertThat(readRows()).containsExactly(
                List.of("earlier", "1.0", "N/A"),
                List.of("ok", "1.0", "N/A"),
                List.of("unlisted", "0.0", "UNEXPECTED_CHANGE at 0.0.1: add -> x_add"),
                List.of("java", "1.0", "N/A"));
    }

    @Test
    void slowestSampleIsTrackedPerRun() {
        pipeline.run(List.of(sample("ok", ADD, "c")), engine, ManifestRepository.empty());
        assertThat(pipeline.getSlowestSampleMillis()).isGreaterThanOrEqualTo(0);

        pipeline.run(List.of(sample("blank", "   ", "c")), engine, ManifestRepository.empty());
        assertThat(pipeline.getSlowestSampleMillis()).isEqualTo(-1);
    }

    @Test
    void pythonSampleIsRenamedAndVerified() {
        String code = "def add(a, b):\n    c = a + b\n    return c\n";

        SampleOutcome outcome = pipeline.process(sample("py", code, "python"), engine, renameManifest(code, "python"));

        assertThat(outcome.isDiscarded()).isFalse();
        assertThat(outcome.verification().verified()).isTrue();
    }

    @Test
    void unsupportedLanguageFailsBeforeAnyWork() {
        List<Sample> samples = List.of(sample("ok", ADD, "c"), sample("odd", "PRINT 1", "basic"));

        assertThatThrownBy(() -> pipeline.run(samples, engine, ManifestRepository.empty()))
                .isInstanceOf(UnsupportedLanguageException.class);
        assertThat(log).doesNotExist();
    }
}
