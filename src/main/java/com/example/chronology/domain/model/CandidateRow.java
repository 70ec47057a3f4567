package com.example.chronology.domain.model;

/**
 * Rule-derived row for a single unit of text.
 * {@code date} is an ISO-8601 date or empty; {@code event} is {@code null} when no specific label matched,
 * in which case the emitted label falls back to {@link EventType#EVENT}.
 */
public record CandidateRow(
        String date,
        EventType event,
        String description,
        String location,
        String source,
        double confidence,
        boolean hasDate,
        boolean hasEvent
) {

    /**
     * @return the event label to emit, never {@code null}
     */
    public EventType eventOrDefault() {
        return event != null ? event : EventType.EVENT;
    }

    /**
     * Returns a copy attributed to the given source document.
     *
     * @param newSource source identifier (usually the file name or path)
     * @return row with the source filled in
     */
    public CandidateRow withSource(String newSource) {
        return new CandidateRow(date, event, description, location, newSource, confidence, hasDate, hasEvent);
    }
}
