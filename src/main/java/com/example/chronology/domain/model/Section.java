package com.example.chronology.domain.model;

/**
 * A labelled run of lines on a page, starting at {@code startIndex}.
 */
public record Section(String label, int startIndex) {

    /** Label used when a page has no detected heading. */
    public static final String BODY = "BODY";
}
