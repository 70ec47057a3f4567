package com.example.chronology.domain.model;

/**
 * Secondary-extractor row after repair: event clamped, description capped, location and source
 * replaced with the caller's values.
 */
public record ExtractedRow(
        String date,
        EventType event,
        String description,
        String pageSection,
        String source
) {
}
