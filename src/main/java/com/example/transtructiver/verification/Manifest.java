package com.example.transtructiver.verification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What a mutation is allowed to change: exact expected texts by path, and paths whose
 * whole subtree is exempt from comparison.
 * <p>
 * A renamed path mapped to {@code null} stays in the manifest: the verifier treats it as an
 * expectation no mutated text can meet. Null ignored paths are dropped.
 */
public record Manifest(
        @JsonProperty("renamed_paths") Map<String, String> renamedPaths,
        @JsonProperty("ignored_paths") Set<String> ignoredPaths) {

    public static final Manifest EMPTY = new Manifest(Map.of(), Set.of());

    @JsonCreator
    public Manifest {
        renamedPaths = renamedPaths == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(renamedPaths));
        ignoredPaths = ignoredPaths == null
                ? Set.of()
                : ignoredPaths.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }

    public boolean isRenamed(String path) {
        return renamedPaths.containsKey(path);
    }

    public boolean isIgnored(String path) {
        return ignoredPaths.contains(path);
    }
}
