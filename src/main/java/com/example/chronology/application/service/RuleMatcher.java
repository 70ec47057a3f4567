package com.example.chronology.application.service;

import com.example.chronology.domain.model.CandidateRow;
import com.example.chronology.domain.model.EventType;
import com.example.chronology.domain.model.PageRecord;
import com.example.chronology.domain.model.RuleSet;
import com.example.chronology.domain.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based first pass: detects dates and event labels per unit of text and scores each hit.
 */
@Component
public class RuleMatcher {

    private static final Logger log = LoggerFactory.getLogger(RuleMatcher.class);

    private static final Pattern STATUTE_CUES = Pattern.compile(
            "\\b(act|amendment|section|sub-section|clause|with effect from)\\b");
    private static final Pattern PROCEDURAL_CUES = Pattern.compile(
            "\\b(hearing|order|decree|judgment)");

    static final double EVENT_WEIGHT = 0.5;
    static final double DATE_WEIGHT = 0.2;
    static final double SECTION_WEIGHT = 0.2;
    static final double AMBIGUITY_PENALTY = 0.1;

    private final RuleSet ruleSet;
    private final SectionChunker sectionChunker;
    private final LocaleDateParser dateParser;
    private final Pattern delimiterPattern;

    public RuleMatcher(RuleSet ruleSet, SectionChunker sectionChunker, LocaleDateParser dateParser) {
        this.ruleSet = ruleSet;
        this.sectionChunker = sectionChunker;
        this.dateParser = dateParser;
        this.delimiterPattern = ruleSet.delimiters().isEmpty()
                ? null
                : Pattern.compile(ruleSet.delimiters().stream().map(Pattern::quote).collect(Collectors.joining("|")));
    }

    /**
     * Runs the rules over every unit of a page.
     * Rows come back without a source; the caller attributes them to a document.
     *
     * @param page page to scan
     * @return one row per unit carrying a date or an event, in reading order
     */
    public List<CandidateRow> parsePage(PageRecord page) {
        List<String> lines = page.lines();
        List<Section> sections = sectionChunker.buildSections(lines);
        List<CandidateRow> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String section = null;
            for (String unit : splitUnits(lines.get(i))) {
                List<String> dates = dateParser.findDates(unit);
                EventType event = detectEvent(unit);
                if (dates.isEmpty() && event == null) {
                    continue;
                }
                if (section == null) {
                    section = sectionChunker.sectionFor(sections, i);
                }
                double confidence = confidence(event, dates, isProceedingSection(section));
                rows.add(new CandidateRow(
                        dates.isEmpty() ? "" : dates.get(0),
                        event,
                        unit,
                        location(page.pageNumber(), section),
                        "",
                        confidence,
                        !dates.isEmpty(),
                        event != null
                ));
            }
        }
        log.debug("Page {}: {} sections, {} candidate rows", page.pageNumber(), sections.size(), rows.size());
        return rows;
    }

    /**
     * Splits a line into units: the whole line when line breaks are the boundary, otherwise the trimmed
     * non-empty fragments between delimiters.
     *
     * @param line page line
     * @return units to evaluate
     */
    public List<String> splitUnits(String line) {
        String[] fragments = ruleSet.lineBreakIsBoundary() || delimiterPattern == null
                ? new String[]{line}
                : delimiterPattern.split(line);
        List<String> units = new ArrayList<>(fragments.length);
        for (String fragment : fragments) {
            String trimmed = fragment.trim();
            if (!trimmed.isEmpty()) {
                units.add(trimmed);
            }
        }
        return units;
    }

    /**
     * Picks the event label for a unit.
     * Statutory citations without a procedural word are never treated as court events.
     *
     * @param unit unit text
     * @return first label in declaration order whose pattern matches, or {@code null}
     */
    public EventType detectEvent(String unit) {
        String lower = unit.toLowerCase(Locale.ROOT);
        if (STATUTE_CUES.matcher(lower).find() && !PROCEDURAL_CUES.matcher(lower).find()) {
            return null;
        }
        for (Map.Entry<EventType, List<Pattern>> entry : ruleSet.eventPatterns().entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(lower).find()) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    /**
     * Scores a unit: event 0.5, any date 0.2, proceedings/hearing section 0.2, minus 0.1 when several
     * distinct dates compete.
     *
     * @param event                detected event or {@code null}
     * @param dates                distinct parsed dates
     * @param inProceedingsSection whether the enclosing section is a proceedings or hearing section
     * @return score clamped to [0, 1]
     */
    public double confidence(EventType event, List<String> dates, boolean inProceedingsSection) {
        double score = 0.0;
        if (event != null) {
            score += EVENT_WEIGHT;
        }
        if (!dates.isEmpty()) {
            score += DATE_WEIGHT;
        }
        if (inProceedingsSection) {
            score += SECTION_WEIGHT;
        }
        if (dates.size() > 1) {
            score -= AMBIGUITY_PENALTY;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private boolean isProceedingSection(String section) {
        String lower = section.toLowerCase(Locale.ROOT);
        return lower.contains("proceeding") || lower.contains("hearing");
    }

    static String location(int pageNumber, String section) {
        return "p." + pageNumber + " / " + section;
    }
}
