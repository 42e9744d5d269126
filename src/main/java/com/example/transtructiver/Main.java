package com.example.transtructiver;

import com.example.transtructiver.config.AuditProperties;
import com.example.transtructiver.data.CorpusLoader;
import com.example.transtructiver.data.ManifestRepository;
import com.example.transtructiver.data.Sample;
import com.example.transtructiver.mutation.MutationEngine;
import com.example.transtructiver.mutation.MutationRuleRegistry;
import com.example.transtructiver.mutation.RenameIdentifiersRule;
import com.example.transtructiver.pipeline.AuditPipeline;
import com.example.transtructiver.pipeline.PipelineReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * {@code transtructiver <corpus> [rule ...]}. Options of the form
 * {@code --transtructiver.<key>=<value>} are picked up by Spring and skipped here.
 */
@SpringBootApplication
@EnableConfigurationProperties(AuditProperties.class)
public class Main implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private final MutationRuleRegistry ruleRegistry;
    private final CorpusLoader corpusLoader;
    private final AuditPipeline pipeline;
    private final AuditProperties properties;

    public Main(MutationRuleRegistry ruleRegistry,
                CorpusLoader corpusLoader,
                AuditPipeline pipeline,
                AuditProperties properties) {
        this.ruleRegistry = ruleRegistry;
        this.corpusLoader = corpusLoader;
        this.pipeline = pipeline;
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(Main.class, args);
    }

    @Override
    public void run(String... args) {
        List<String> positional = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .toList();
        if (positional.isEmpty()) {
            throw new IllegalArgumentException("Usage: transtructiver <corpus> [rule ...]; available rules: "
                    + ruleRegistry.availableRules());
        }

        Path corpus = Path.of(positional.get(0));
        List<String> ruleNames = positional.size() > 1
                ? positional.subList(1, positional.size())
                : List.of(RenameIdentifiersRule.NAME);

        // Rule names are checked before any input is read.
        MutationEngine engine = ruleRegistry.createEngine(ruleNames);

        AuditProperties.Manifest manifestConfig = properties.manifest();
        ManifestRepository manifests = ManifestRepository.load(
                manifestConfig.path() == null ? null : Path.of(manifestConfig.path()),
                manifestConfig.required());
        List<Sample> samples = corpusLoader.load(corpus);

        PipelineReport report = pipeline.run(samples, engine, manifests);
        log.info(report.summary());
        log.info("Results appended to {}", properties.summaryLog());
    }
}
