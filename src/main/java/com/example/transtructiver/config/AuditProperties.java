package com.example.transtructiver.config;

import com.example.transtructiver.filter.KeywordNodeTypeClassifier.MatchMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the audit run.
 *
 * @param summaryLog result log the verified samples are appended to
 * @param workers    size of the worker pool; {@code 0} means half the available processors
 * @param debug      log the pretty-printed original and mutated tree of every accepted sample
 */
@ConfigurationProperties(prefix = "transtructiver")
public record AuditProperties(
        String summaryLog,
        int workers,
        Manifest manifest,
        Filter filter,
        boolean debug
) {

    public static final String DEFAULT_SUMMARY_LOG = "summary_log.csv";

    public AuditProperties {
        summaryLog = summaryLog == null || summaryLog.isBlank() ? DEFAULT_SUMMARY_LOG : summaryLog;
        manifest = manifest == null ? new Manifest(null, false) : manifest;
        filter = filter == null ? new Filter(null) : filter;
    }

    public int effectiveWorkers() {
        return workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }

    /**
     * @param path     JSON file with the per-sample manifests
     * @param required fail instead of falling back to empty manifests when the file is missing
     */
    public record Manifest(String path, boolean required) {}

    /**
     * @param matchMode how node type keywords are matched
     */
    public record Filter(MatchMode matchMode) {
        public Filter {
            matchMode = matchMode == null ? MatchMode.SUBSTRING : matchMode;
        }
    }
}
