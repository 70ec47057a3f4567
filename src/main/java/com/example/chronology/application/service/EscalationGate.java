package com.example.chronology.application.service;

import com.example.chronology.domain.model.CandidateRow;
import com.example.chronology.infrastructure.config.ChronologyProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which rule rows are worth a secondary-extractor call.
 */
@Component
public class EscalationGate {

    private static final Pattern ANALYSIS_CUES = Pattern.compile(
            "\\b(it is observed|it may be mentioned|question whether|we are unable to|held that|in our view"
                    + "|it is obvious|therefore|consequently|accordingly|it follows that)\\b");

    private final double confidenceThreshold;

    @Autowired
    public EscalationGate(ChronologyProperties properties) {
        this(properties.confidenceThreshold());
    }

    EscalationGate(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    /**
     * Commentary is never escalated. Otherwise a row goes to the secondary extractor when its score is
     * under the threshold or when it has a date without an event (or the reverse).
     *
     * @param row rule-derived row
     * @return {@code true} when the row's text should be sent for secondary extraction
     */
    public boolean shouldEscalate(CandidateRow row) {
        if (looksLikeAnalysis(row.description())) {
            return false;
        }
        if (row.confidence() < confidenceThreshold) {
            return true;
        }
        return row.hasDate() ^ row.hasEvent();
    }

    /**
     * @param text row description
     * @return {@code true} when the text reads as judicial reasoning rather than a dated step
     */
    public boolean looksLikeAnalysis(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return ANALYSIS_CUES.matcher(text.toLowerCase(Locale.ROOT)).find();
    }
}
