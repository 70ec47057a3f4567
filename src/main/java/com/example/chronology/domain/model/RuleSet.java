package com.example.chronology.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Compiled, immutable rule configuration shared by the chunker, matcher and date parser.
 * The event map keeps declaration order; the first label with a matching pattern wins.
 */
public record RuleSet(
        List<Pattern> sectionPatterns,
        List<Pattern> datePatterns,
        Map<EventType, List<Pattern>> eventPatterns,
        List<Locale> languages,
        DateOrder dateOrder,
        boolean lineBreakIsBoundary,
        List<String> delimiters
) {

    public RuleSet {
        sectionPatterns = List.copyOf(sectionPatterns);
        datePatterns = List.copyOf(datePatterns);
        LinkedHashMap<EventType, List<Pattern>> ordered = new LinkedHashMap<>();
        eventPatterns.forEach((type, patterns) -> ordered.put(type, List.copyOf(patterns)));
        eventPatterns = Collections.unmodifiableMap(ordered);
        languages = languages == null || languages.isEmpty() ? List.of(Locale.ENGLISH) : List.copyOf(languages);
        dateOrder = dateOrder == null ? DateOrder.DMY : dateOrder;
        delimiters = delimiters == null ? List.of(".") : List.copyOf(delimiters);
    }
}
