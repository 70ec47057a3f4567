package com.example.chronology.application.service;

import com.example.chronology.application.exception.ChronologyExportValidationException;
import com.example.chronology.domain.model.ChronologyEntry;
import com.example.chronology.domain.model.ChronologyResult;
import com.example.chronology.domain.model.OutputFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that turns a chronology table into downloadable CSV or JSON content.
 */
@Service
public class ChronologyExportService {

    static final String CSV_HEADER = "DATE,EVENT,DESCRIPTION,PAGE/SECTION,SOURCE";

    private final ObjectMapper objectMapper;

    public ChronologyExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

	/**
	 * Serializes every row of the result in the requested format.
	 *
	 * @param result cached chronology result
	 * @param format CSV or JSON
	 * @return document content ready to stream or write to disk
	 * @throws ChronologyExportValidationException when there is no result to export
	 */
    public String export(ChronologyResult result, OutputFormat format) {
        if (result == null) {
            throw new ChronologyExportValidationException("No chronology available for export. Upload documents first.");
        }
        return format == OutputFormat.JSON ? buildJson(result.entries()) : buildCsv(result.entries());
    }

	/**
	 * Builds the CSV output including the header row and sanitized values.
	 *
	 * @param entries sorted chronology rows
	 * @return CSV document as a string
	 */
    private String buildCsv(List<ChronologyEntry> entries) {
        StringBuilder builder = new StringBuilder();
        builder.append(CSV_HEADER).append('\n');
        for (ChronologyEntry entry : entries) {
            builder.append(escape(entry.date())).append(',')
                    .append(escape(entry.event() == null ? "" : entry.event().label())).append(',')
                    .append(escape(entry.description())).append(',')
                    .append(escape(entry.pageSection())).append(',')
                    .append(escape(entry.source()))
                    .append('\n');
        }
        return builder.toString();
    }

    private String buildJson(List<ChronologyEntry> entries) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize the chronology as JSON.", e);
        }
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n") || sanitized.contains("\r")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
