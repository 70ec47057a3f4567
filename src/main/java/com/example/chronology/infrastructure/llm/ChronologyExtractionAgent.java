package com.example.chronology.infrastructure.llm;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that lists the dated procedural events in one chunk of a legal document. Uses LangChain4j AI
 * Services; the backing chat model is configured for JSON output.
 */
public interface ChronologyExtractionAgent {

    @SystemMessage("""
            You extract legal case events. STRICT RULES:
            - Return ONLY rows that have an explicit date in the text.
            - Normalize dates to YYYY-MM-DD if possible; if uncertain, keep the original date string.
            - Use one event label from: Filing, Hearing, Order, Adjournment, Notice, Bail, Charge,
              Evidence, Judgment, Application, Service, Settlement, Lease, Appeal, Event.
            - Keep description <= 2 lines and quote key phrase(s).
            - Do not invent information not present in the text.
            - If no dated events are found, return: {"rows":[]}
            - Return ONLY a JSON object of the form
              {"rows": [{"date": "...", "event": "...", "description": "...", "page_section": "...", "source": "..."}]}
            """)
    @UserMessage("""
            Meta:
            source: {{source}}
            page_section: {{pageSection}}

            Text:
            \"\"\"{{chunkText}}\"\"\"
            """)
    String extract(@V("chunkText") String chunkText,
                   @V("pageSection") String pageSection,
                   @V("source") String source);
}
