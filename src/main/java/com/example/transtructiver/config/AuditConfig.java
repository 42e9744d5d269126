package com.example.transtructiver.config;

import com.example.transtructiver.filter.KeywordNodeTypeClassifier;
import com.example.transtructiver.filter.NodeTypeClassifier;
import com.example.transtructiver.filter.QualityFilter;
import com.example.transtructiver.report.SummaryLogWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class AuditConfig {

    @Bean
    public NodeTypeClassifier nodeTypeClassifier(AuditProperties properties) {
        return new KeywordNodeTypeClassifier(properties.filter().matchMode());
    }

    @Bean
    public QualityFilter qualityFilter(NodeTypeClassifier classifier) {
        return new QualityFilter(classifier);
    }

    @Bean
    public SummaryLogWriter summaryLogWriter(AuditProperties properties) {
        return new SummaryLogWriter(Path.of(properties.summaryLog()));
    }
}
