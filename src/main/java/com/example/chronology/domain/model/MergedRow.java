package com.example.chronology.domain.model;

/**
 * Canonical row produced by the merger. The confidence only breaks merge ties and is dropped by
 * {@link #toEntry()}.
 */
public record MergedRow(
        String source,
        String date,
        EventType event,
        String description,
        String pageSection,
        double confidence
) {

    /**
     * @return the emitted form of this row, without the internal confidence
     */
    public ChronologyEntry toEntry() {
        return new ChronologyEntry(date, event, description, pageSection, source);
    }
}
