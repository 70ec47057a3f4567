package com.example.chronology.infrastructure.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Raw shape of {@code rules.yaml} before compilation.
 */
record RuleFileDocument(
        @JsonProperty("section_patterns") List<String> sectionPatterns,
        @JsonProperty("date_patterns") List<String> datePatterns,
        @JsonProperty("events") Map<String, List<String>> events,
        @JsonProperty("dateparser") DateParserSection dateParser,
        @JsonProperty("line_break_is_boundary") Boolean lineBreakIsBoundary,
        @JsonProperty("sentence_delimiters") List<String> sentenceDelimiters
) {

    record DateParserSection(
            @JsonProperty("languages") List<String> languages,
            @JsonProperty("settings") Map<String, String> settings
    ) {
    }
}
