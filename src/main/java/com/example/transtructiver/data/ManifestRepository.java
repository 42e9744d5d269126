package com.example.transtructiver.data;

import com.example.transtructiver.verification.Manifest;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Per-sample manifests keyed by sample id. Samples without an entry get {@link Manifest#EMPTY}.
 */
public class ManifestRepository {
    private static final Logger log = LoggerFactory.getLogger(ManifestRepository.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    private final Map<String, Manifest> manifests;

    public ManifestRepository(Map<String, Manifest> manifests) {
        this.manifests = Map.copyOf(manifests);
    }

    public static ManifestRepository empty() {
        return new ManifestRepository(Map.of());
    }

    /**
     * @param file     JSON object mapping sample ids to manifests; may be {@code null}
     * @param required when false, a missing file yields empty manifests for every sample
     */
    public static ManifestRepository load(Path file, boolean required) {
        if (file == null || !Files.exists(file)) {
            if (required) {
                throw new UncheckedIOException(new FileNotFoundException("Manifest file not found: " + file));
            }
            log.warn("No manifest file at {}; every sample is verified against an empty manifest", file);
            return empty();
        }
        try {
            Map<String, Manifest> loaded = mapper.readValue(file.toFile(), new TypeReference<Map<String, Manifest>>() {});
            loaded.replaceAll((id, manifest) -> manifest == null ? Manifest.EMPTY : manifest);
            log.info("Loaded {} manifests from {}", loaded.size(), file);
            return new ManifestRepository(loaded);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read manifest file " + file, e);
        }
    }

    public Manifest forSample(String sampleId) {
        return manifests.getOrDefault(sampleId, Manifest.EMPTY);
    }

    public int size() {
        return manifests.size();
    }
}
