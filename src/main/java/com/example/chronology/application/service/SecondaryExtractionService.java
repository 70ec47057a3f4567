package com.example.chronology.application.service;

import com.example.chronology.application.exception.ExtractionResponseException;
import com.example.chronology.application.port.SecondaryExtractor;
import com.example.chronology.application.port.SecondaryExtractor.ExtractionRequest;
import com.example.chronology.domain.model.CandidateRow;
import com.example.chronology.domain.model.EventType;
import com.example.chronology.domain.model.ExtractedRow;
import com.example.chronology.infrastructure.config.ChronologyProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Sends escalated chunks to the {@link SecondaryExtractor} and repairs whatever comes back.
 * <p>
 * One call is made per distinct chunk, at most {@code chronology.llm.max-concurrent-calls} at a time.
 * Results are collected in dispatch order, so the outcome does not depend on which call finishes first.
 * A failing call is logged and contributes no rows.
 */
@Service
public class SecondaryExtractionService {

    private static final Logger log = LoggerFactory.getLogger(SecondaryExtractionService.class);
    static final int MAX_DESCRIPTION_CHARS = 400;

    private final SecondaryExtractor extractor;
    private final LocaleDateParser dateParser;
    private final Executor executor;
    private final ChronologyProperties.Llm settings;
    private final ObjectMapper objectMapper;

    /**
     * Creates the service. The extractor is optional: without one, escalation is unavailable.
     *
     * @param extractorProvider provider of the configured extractor, if any
     * @param dateParser        parser used to repair missing or non-ISO dates
     * @param executor          bounded pool running the calls
     * @param properties        application settings
     * @param objectMapper      JSON parser for model responses
     */
    @Autowired
    public SecondaryExtractionService(ObjectProvider<SecondaryExtractor> extractorProvider,
                                      LocaleDateParser dateParser,
                                      @Qualifier("escalationExecutor") Executor executor,
                                      ChronologyProperties properties,
                                      ObjectMapper objectMapper) {
        this(extractorProvider.getIfAvailable(), dateParser, executor, properties.llm(), objectMapper);
    }

    SecondaryExtractionService(SecondaryExtractor extractor,
                               LocaleDateParser dateParser,
                               Executor executor,
                               ChronologyProperties.Llm settings,
                               ObjectMapper objectMapper) {
        this.extractor = extractor;
        this.dateParser = dateParser;
        this.executor = executor;
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    /**
     * @return {@code true} when an extractor is wired in
     */
    public boolean isAvailable() {
        return extractor != null;
    }

    /**
     * Escalates the given rows: deduplicates their chunks, calls the extractor for each one and
     * blocks until every call has finished or failed.
     *
     * @param rows rows selected by the {@link EscalationGate}
     * @return repaired rows in chunk dispatch order
     */
    public List<ExtractedRow> escalate(List<CandidateRow> rows) {
        if (extractor == null || rows == null || rows.isEmpty()) {
            return List.of();
        }
        Set<Chunk> chunks = new LinkedHashSet<>();
        for (CandidateRow row : rows) {
            chunks.add(new Chunk(row.description(), row.location(), row.source()));
        }

        Map<Chunk, CompletableFuture<List<ExtractedRow>>> calls = new LinkedHashMap<>();
        for (Chunk chunk : chunks) {
            calls.put(chunk, CompletableFuture.supplyAsync(() -> extractChunk(chunk), executor));
        }
        CompletableFuture.allOf(calls.values().toArray(new CompletableFuture[0])).join();

        List<ExtractedRow> extracted = new ArrayList<>();
        calls.values().forEach(call -> extracted.addAll(call.join()));
        log.info("Escalated {} rows as {} chunks; secondary extractor returned {} rows",
                rows.size(), chunks.size(), extracted.size());
        return extracted;
    }

    /**
     * Runs one call. Never throws: any failure is logged and yields an empty list.
     */
    List<ExtractedRow> extractChunk(Chunk chunk) {
        String text = truncate(chunk.text(), settings.maxChunkChars());
        try {
            String response = extractor.extract(new ExtractionRequest(
                    text, chunk.pageSection(), chunk.source(), settings.provider(), settings.model()));
            return repair(response, chunk.pageSection(), chunk.source());
        } catch (Exception e) {
            log.warn("Secondary extraction failed for {} ({}): {}", chunk.source(), chunk.pageSection(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Validates the response shape and repairs each row.
     *
     * @param response    raw extractor output
     * @param pageSection location the caller knows to be correct
     * @param source      source the caller knows to be correct
     * @return repaired rows; rows without any resolvable date are dropped
     * @throws ExtractionResponseException when the response is not a JSON object holding a {@code rows} array of objects
     */
    List<ExtractedRow> repair(String response, String pageSection, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response == null ? "" : response);
        } catch (JsonProcessingException e) {
            throw new ExtractionResponseException("Response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ExtractionResponseException("Response is not a JSON object");
        }
        JsonNode rows = root.get("rows");
        if (rows == null || !rows.isArray()) {
            throw new ExtractionResponseException("Response has no 'rows' array");
        }
        for (JsonNode row : rows) {
            if (!row.isObject()) {
                throw new ExtractionResponseException("Row is not a JSON object: " + row);
            }
        }

        List<ExtractedRow> repaired = new ArrayList<>();
        for (JsonNode row : rows) {
            String date = asText(row, "date").trim();
            String description = asText(row, "description").trim();
            EventType event = EventType.fromLabel(asText(row, "event"));

            if (date.isEmpty()) {
                List<String> found = dateParser.findDates(description);
                date = found.isEmpty() ? "" : found.get(0);
            }
            if (date.isEmpty()) {
                continue;
            }
            repaired.add(new ExtractedRow(
                    normalizeDate(date),
                    event,
                    truncate(description, MAX_DESCRIPTION_CHARS),
                    pageSection,
                    source
            ));
        }
        return repaired;
    }

    /**
     * Converts a resolvable date to ISO-8601. Unresolvable text is kept as given and removed later by
     * calendar validation.
     */
    private String normalizeDate(String date) {
        return dateParser.parse(date)
                .map(LocalDate::toString)
                .orElseGet(() -> {
                    List<String> embedded = dateParser.findDates(date);
                    return embedded.isEmpty() ? date : embedded.get(0);
                });
    }

    private static String asText(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        return value.length() > maxChars ? value.substring(0, maxChars) : value;
    }

    /**
     * Unit of dispatch: identical description, location and source collapse into one call.
     */
    record Chunk(String text, String pageSection, String source) {
    }
}
