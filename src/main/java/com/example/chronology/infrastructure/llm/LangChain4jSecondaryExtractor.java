package com.example.chronology.infrastructure.llm;

import com.example.chronology.application.port.SecondaryExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SecondaryExtractor} backed by the LangChain4j {@link ChronologyExtractionAgent}.
 * Provider and model are fixed when the chat model bean is built, so the request's selectors are only logged.
 */
public class LangChain4jSecondaryExtractor implements SecondaryExtractor {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jSecondaryExtractor.class);

    private final ChronologyExtractionAgent agent;

    public LangChain4jSecondaryExtractor(ChronologyExtractionAgent agent) {
        this.agent = agent;
    }

    @Override
    public String extract(ExtractionRequest request) {
        log.debug("Calling {}/{} for {} ({}, {} chars)", request.provider(), request.model(),
                request.source(), request.pageSection(), request.chunkText().length());
        return agent.extract(request.chunkText(), request.pageSection(), request.source());
    }
}
