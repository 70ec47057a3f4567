package com.example.chronology.infrastructure.llm;

import com.example.chronology.application.port.SecondaryExtractor.ExtractionRequest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LangChain4jSecondaryExtractorTest {

    @Test
    void passesChunkAndLocationToTheAgent() {
        ChronologyExtractionAgent agent = mock(ChronologyExtractionAgent.class);
        when(agent.extract("Notice issued on 20.03.2020", "p.1 / BODY", "case.pdf")).thenReturn("{\"rows\":[]}");
        LangChain4jSecondaryExtractor extractor = new LangChain4jSecondaryExtractor(agent);

        String response = extractor.extract(new ExtractionRequest(
                "Notice issued on 20.03.2020", "p.1 / BODY", "case.pdf", "gemini", "gemini-1.5-flash"));

        assertThat(response).isEqualTo("{\"rows\":[]}");
        verify(agent).extract("Notice issued on 20.03.2020", "p.1 / BODY", "case.pdf");
    }
}
