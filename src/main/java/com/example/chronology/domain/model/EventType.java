package com.example.chronology.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed vocabulary of chronology event labels.
 * {@link #EVENT} is the generic fallback for dated text that matched no specific label.
 */
public enum EventType {
    FILING("Filing"),
    HEARING("Hearing"),
    ORDER("Order"),
    ADJOURNMENT("Adjournment"),
    NOTICE("Notice"),
    BAIL("Bail"),
    CHARGE("Charge"),
    EVIDENCE("Evidence"),
    JUDGMENT("Judgment"),
    APPLICATION("Application"),
    SERVICE("Service"),
    SETTLEMENT("Settlement"),
    LEASE("Lease"),
    APPEAL("Appeal"),
    EVENT("Event");

    private final String label;

    EventType(String label) {
        this.label = label;
    }

    /**
     * @return display label written to the output table
     */
    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a free-text label into the closed vocabulary.
     * The value is trimmed and title-cased before lookup; anything unknown maps to {@link #EVENT}.
     *
     * @param rawLabel label from configuration or an untrusted extractor
     * @return matching event type or the generic fallback
     */
    public static EventType fromLabel(String rawLabel) {
        return lookup(rawLabel, EVENT);
    }

    /**
     * Strict variant of {@link #fromLabel(String)} used when reading configuration.
     *
     * @param rawLabel label to resolve
     * @return matching event type or {@code null} when the label is not part of the vocabulary
     */
    public static EventType fromLabelOrNull(String rawLabel) {
        return lookup(rawLabel, null);
    }

    private static EventType lookup(String rawLabel, EventType fallback) {
        if (rawLabel == null) {
            return fallback;
        }
        String titled = titleCase(rawLabel.trim());
        for (EventType type : values()) {
            if (type.label.equals(titled)) {
                return type;
            }
        }
        return fallback;
    }

    /**
     * Upper-cases the first letter of every word and lower-cases the rest.
     *
     * @param value input text
     * @return title-cased text
     */
    static String titleCase(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (char c : value.toCharArray()) {
            if (Character.isLetter(c)) {
                builder.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                builder.append(c);
                startOfWord = true;
            }
        }
        return builder.toString();
    }
}
