package com.example.chronology.domain.model;

import java.util.List;

/**
 * Domain DTO returned for a batch of documents.
 * Returned from {@code ChronologyService} to controllers and the batch runner.
 */
public record ChronologyResult(
        List<ChronologyEntry> entries,
        List<String> processedSources,
        List<SkippedDocument> skipped
) {

    public ChronologyResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
        processedSources = processedSources == null ? List.of() : List.copyOf(processedSources);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    /**
     * A document that was left out of the batch, with the reason.
     */
    public record SkippedDocument(String source, String reason) {
    }
}
