package com.media.resolution.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Unmapped entries of the last run, persisted as JSON so an operator can add manual mappings.
 */
public record UnmappedState(
        @JsonProperty("entries") List<UnmappedEntry> entries,
        @JsonProperty("updated_at") Instant updatedAt
) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public UnmappedState {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static UnmappedState of(List<UnmappedEntry> entries) {
        return new UnmappedState(entries, Instant.now());
    }

    /**
     * Loads state from {@code path}; a missing file yields an empty state.
     */
    public static UnmappedState load(Path path) {
        if (!Files.exists(path)) {
            return new UnmappedState(List.of(), null);
        }
        try {
            return MAPPER.readValue(path.toFile(), UnmappedState.class);
        } catch (IOException e) {
            throw new UncheckedIOException("parse unmapped state: " + path, e);
        }
    }

    public void save(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(path.toFile(), this);
        } catch (IOException e) {
            throw new UncheckedIOException("write unmapped state: " + path, e);
        }
    }
}
