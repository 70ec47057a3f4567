package com.example.chronology.domain.model;

import java.util.List;

/**
 * Domain DTO describing one page produced by a document loader.
 * Lines are already trimmed and non-empty, in reading order.
 */
public record PageRecord(
        int pageNumber,
        String text,
        List<String> lines,
        boolean scanned
) {

    public PageRecord {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page numbers start at 1 but was " + pageNumber);
        }
        text = text == null ? "" : text;
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * Builds a page from its lines, joining them with newlines for the full text.
     *
     * @param pageNumber 1-based page number
     * @param lines      trimmed non-empty lines
     * @param scanned    whether the page came from an image-only source
     * @return page record
     */
    public static PageRecord ofLines(int pageNumber, List<String> lines, boolean scanned) {
        return new PageRecord(pageNumber, String.join("\n", lines), lines, scanned);
    }
}
