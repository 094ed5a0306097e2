package io.iprank.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.iprank.server.dto.CandidatesResponse;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The endpoints collectors are asked to measure.
 * Loaded once at startup; blank and duplicate entries are dropped, order is kept.
 */
public final class CandidatePool {

    static final List<String> BUILT_IN = List.of(
            "104.16.0.0", "104.17.0.0", "172.64.0.0", "188.114.96.0"
    );

    private final List<String> candidates;

    public CandidatePool(List<String> candidates) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String c : candidates) {
            if (c != null && !c.isBlank()) {
                unique.add(c.trim());
            }
        }
        this.candidates = List.copyOf(new ArrayList<>(unique));
    }

    public static CandidatePool builtIn() {
        return new CandidatePool(BUILT_IN);
    }

    /** Reads {@code {"candidates": [...]}}. */
    public static CandidatePool fromJsonFile(Path path) {
        try {
            CandidatesResponse file = new ObjectMapper().readValue(path.toFile(), CandidatesResponse.class);
            if (file.candidates == null) {
                throw new IllegalArgumentException("candidate file " + path + " has no \"candidates\" array");
            }
            return new CandidatePool(file.candidates);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load candidates from " + path + ": " + e.getMessage(), e);
        }
    }

    public List<String> candidates() {
        return candidates;
    }
}
