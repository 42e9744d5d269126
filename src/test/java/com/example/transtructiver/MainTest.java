package com.example.transtructiver;

import com.example.transtructiver.config.AuditProperties;
import com.example.transtructiver.data.CorpusLoader;
import com.example.transtructiver.filter.KeywordNodeTypeClassifier;
import com.example.transtructiver.filter.NodeTypeClassifier;
import com.example.transtructiver.mutation.MutationRuleRegistry;
import com.example.transtructiver.mutation.UnknownMutationRuleException;
import com.example.transtructiver.pipeline.AuditPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(
        args = "src/test/resources/corpus/mixed.jsonl",
        properties = {
                "transtructiver.workers=3",
                "transtructiver.filter.match-mode=token",
                "transtructiver.summary-log=target/main-test/summary_log.csv",
                "transtructiver.manifest.path=target/main-test/absent.json"
        })
class MainTest {

    @Autowired
    private AuditPipeline pipeline;

    @Autowired
    private AuditProperties properties;

    @Autowired
    private NodeTypeClassifier classifier;

    @Test
    void wiresPipelineFromConfiguration() {
        assertThat(pipeline).isNotNull();
        assertThat(properties.effectiveWorkers()).isEqualTo(3);
        assertThat(properties.manifest().required()).isFalse();
        assertThat(classifier).isInstanceOfSatisfying(KeywordNodeTypeClassifier.class,
                keywords -> assertThat(keywords.getMode()).isEqualTo(KeywordNodeTypeClassifier.MatchMode.TOKEN));
    }

    @Test
    void startupRunAppendsOneRowPerAcceptedSample() throws IOException {
        Path summaryLog = Path.of(properties.summaryLog());

        assertThat(summaryLog).exists();
        assertThat(Files.readAllLines(summaryLog))
                .anyMatch(row -> row.startsWith("0,0.0,"))
                .anyMatch(row -> row.startsWith("1,0.0,"))
                .anyMatch(row -> row.startsWith("2,0.0,"))
                .noneMatch(row -> row.startsWith("3,"));
    }

    @Test
    void missingCorpusArgumentIsRejected() {
        Main main = new Main(new MutationRuleRegistry(), new CorpusLoader(), pipeline, properties);

        assertThatThrownBy(() -> main.run())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Usage");
        assertThatThrownBy(() -> main.run("--transtructiver.debug=true"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownRuleIsRejectedBeforeReadingCorpus() {
        Main main = new Main(new MutationRuleRegistry(), new CorpusLoader(), pipeline, properties);

        assertThatThrownBy(() -> main.run("target/main-test/no-such-corpus.jsonl", "swap-operands"))
                .isInstanceOf(UnknownMutationRuleException.class);
    }
}
