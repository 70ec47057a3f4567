package com.example.chronology.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of the final chronology table.
 * Serialized with the same column names the CSV export uses.
 */
@JsonPropertyOrder({"DATE", "EVENT", "DESCRIPTION", "PAGE/SECTION", "SOURCE"})
public record ChronologyEntry(
        @JsonProperty("DATE") String date,
        @JsonProperty("EVENT") EventType event,
        @JsonProperty("DESCRIPTION") String description,
        @JsonProperty("PAGE/SECTION") String pageSection,
        @JsonProperty("SOURCE") String source
) {
}
