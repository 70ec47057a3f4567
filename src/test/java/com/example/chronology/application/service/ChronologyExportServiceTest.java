package com.example.chronology.application.service;

import com.example.chronology.application.exception.ChronologyExportValidationException;
import com.example.chronology.domain.model.ChronologyEntry;
import com.example.chronology.domain.model.ChronologyResult;
import com.example.chronology.domain.model.EventType;
import com.example.chronology.domain.model.OutputFormat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests verifying the export application service honors validation rules and produces CSV and JSON output.
 */
class ChronologyExportServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ChronologyExportService service = new ChronologyExportService(objectMapper);

    /**
     * Ensures validation fails when no cached result exists in the session.
     */
    @Test
    void exportRequiresCachedResult() {
        assertThrows(ChronologyExportValidationException.class, () -> service.export(null, OutputFormat.CSV));
    }

    @Test
    void csvHasHeaderAndQuotesSpecialCharacters() {
        String csv = service.export(sampleResult(), OutputFormat.CSV);

        assertThat(csv).isEqualTo("""
                DATE,EVENT,DESCRIPTION,PAGE/SECTION,SOURCE
                2020-03-12,Filing,"Suit filed by A, B and C",p.1 / FACTS,case.pdf
                2020-04-03,Adjournment,"Adjourned ""sine die""\non request",p.2 / PROCEEDINGS,case.pdf
                """);
    }

    @Test
    void emptyTableExportsHeaderOnly() {
        String csv = service.export(new ChronologyResult(List.of(), List.of("case.pdf"), List.of()), OutputFormat.CSV);

        assertThat(csv).isEqualTo("DATE,EVENT,DESCRIPTION,PAGE/SECTION,SOURCE\n");
    }

    @Test
    void jsonUsesColumnNamesAsKeys() throws Exception {
        String json = service.export(sampleResult(), OutputFormat.JSON);

        JsonNode rows = objectMapper.readTree(json);
        assertThat(rows.isArray()).isTrue();
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).get("DATE").asText()).isEqualTo("2020-03-12");
        assertThat(rows.get(0).get("EVENT").asText()).isEqualTo("Filing");
        assertThat(rows.get(1).get("PAGE/SECTION").asText()).isEqualTo("p.2 / PROCEEDINGS");
        assertThat(rows.get(1).get("SOURCE").asText()).isEqualTo("case.pdf");
        assertThat(json).contains("\n");
    }

    /**
     * @return sample result used across the test cases
     */
    private ChronologyResult sampleResult() {
        List<ChronologyEntry> entries = List.of(
                new ChronologyEntry("2020-03-12", EventType.FILING, "Suit filed by A, B and C", "p.1 / FACTS", "case.pdf"),
                new ChronologyEntry("2020-04-03", EventType.ADJOURNMENT, "Adjourned \"sine die\"\non request",
                        "p.2 / PROCEEDINGS", "case.pdf")
        );
        return new ChronologyResult(entries, List.of("case.pdf"), List.of());
    }
}
