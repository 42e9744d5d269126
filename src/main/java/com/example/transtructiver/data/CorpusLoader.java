package com.example.transtructiver.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a corpus from either a JSON array or a JSON Lines file. The format is picked from
 * the first non-blank character.
 */
@Component
public class CorpusLoader {
    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    public List<Sample> load(Path corpus) {
        String content;
        try {
            content = Files.readString(corpus, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read corpus " + corpus, e);
        }

        List<Sample> samples;
        try {
            samples = content.stripLeading().startsWith("[")
                    ? mapper.readValue(content, new TypeReference<List<Sample>>() {})
                    : readLines(content);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed corpus " + corpus, e);
        }

        for (int i = 0; i < samples.size(); i++) {
            Sample sample = samples.get(i);
            if (sample.getId() == null) {
                sample.setId(String.valueOf(i));
            }
            if (sample.getCode() == null) {
                sample.setCode("");
            }
        }
        log.info("Loaded {} samples from {}", samples.size(), corpus);
        return samples;
    }

    private static List<Sample> readLines(String content) throws JsonProcessingException {
        List<Sample> samples = new ArrayList<>();
        for (String line : content.split("\\R")) {
            if (!line.isBlank()) {
                samples.add(mapper.readValue(line, Sample.class));
            }
        }
        return samples;
    }
}
