package com.example.chronology.application.port;

/**
 * Port to the higher-cost extractor used for escalated chunks.
 * Implementations return the raw model response; the application layer treats it as untrusted text.
 */
public interface SecondaryExtractor {

    /**
     * Asks the extractor for dated events in one chunk.
     *
     * @param request chunk text, location, source and model selectors
     * @return raw response, expected to be a JSON object of the form {@code {"rows":[...]}}
     */
    String extract(ExtractionRequest request);

    /**
     * Input for a single secondary extraction call.
     *
     * @param chunkText   text to analyse, already truncated by the caller
     * @param pageSection location descriptor such as {@code p.3 / PROCEEDINGS}
     * @param source      document identifier
     * @param provider    provider selector
     * @param model       model selector
     */
    record ExtractionRequest(String chunkText, String pageSection, String source, String provider, String model) {
    }
}
