package com.example.chronology.application.service;

import com.example.chronology.domain.model.CandidateRow;
import com.example.chronology.domain.model.EventType;
import com.example.chronology.domain.model.ExtractedRow;
import com.example.chronology.domain.model.MergedRow;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reconciles rule rows with secondary-extractor rows and removes duplicates.
 * <p>
 * Within a document, rows sharing (source, date, event, page) compete: a confidence lead of at least
 * {@value #CONFIDENCE_MARGIN} wins outright, otherwise the longer description wins and the incumbent keeps
 * the slot on a tie. Across documents, the first row per dedupe key is kept.
 */
@Component
public class RowMerger {

    static final int MAX_DESCRIPTION_CHARS = 400;
    static final int DEDUPE_PREFIX_CHARS = 100;
    static final double SECONDARY_CONFIDENCE = 0.75;
    static final double CONFIDENCE_MARGIN = 0.05;
    static final int UNKNOWN_PAGE = -1;

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern PAGE_NUMBER = Pattern.compile("p\\.(\\d+)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Merges one document's rule rows with its secondary rows and drops calendar-invalid dates.
     *
     * @param ruleRows      rows from the rule matcher, seeded first
     * @param secondaryRows repaired secondary rows, folded in afterwards with a fixed confidence
     * @return merged rows in first-seen key order
     */
    public List<MergedRow> merge(List<CandidateRow> ruleRows, List<ExtractedRow> secondaryRows) {
        Map<MergeKey, MergedRow> slots = new LinkedHashMap<>();
        for (CandidateRow row : ruleRows) {
            place(slots, normalize(row));
        }
        for (ExtractedRow row : secondaryRows) {
            place(slots, normalize(row));
        }
        return slots.values().stream()
                .filter(row -> isValidIsoDate(row.date()))
                .toList();
    }

    /**
     * Normalizes rule rows one-to-one, for documents where nothing was escalated.
     *
     * @param ruleRows rows from the rule matcher
     * @return normalized rows, same order and count
     */
    public List<MergedRow> normalizeAll(List<CandidateRow> ruleRows) {
        return ruleRows.stream().map(this::normalize).toList();
    }

    /**
     * Keeps the first row for each (source, date, event, page, description prefix) key.
     * Applying it twice gives the same list.
     *
     * @param rows rows from every document, in processing order
     * @return rows without duplicates, order preserved
     */
    public List<MergedRow> dedupe(List<MergedRow> rows) {
        Set<DedupeKey> seen = new HashSet<>();
        List<MergedRow> unique = new ArrayList<>();
        for (MergedRow row : rows) {
            String description = row.description() == null ? "" : row.description();
            DedupeKey key = new DedupeKey(
                    row.source(),
                    row.date(),
                    row.event() == null ? EventType.EVENT : row.event(),
                    pageNumber(row.pageSection()),
                    description.substring(0, Math.min(DEDUPE_PREFIX_CHARS, description.length()))
            );
            if (seen.add(key)) {
                unique.add(row);
            }
        }
        return unique;
    }

    MergedRow normalize(CandidateRow row) {
        return new MergedRow(
                clean(row.source(), Integer.MAX_VALUE),
                clean(row.date(), Integer.MAX_VALUE),
                row.eventOrDefault(),
                clean(row.description(), MAX_DESCRIPTION_CHARS),
                clean(row.location(), Integer.MAX_VALUE),
                row.confidence()
        );
    }

    MergedRow normalize(ExtractedRow row) {
        return new MergedRow(
                clean(row.source(), Integer.MAX_VALUE),
                clean(row.date(), Integer.MAX_VALUE),
                row.event() == null ? EventType.EVENT : row.event(),
                clean(row.description(), MAX_DESCRIPTION_CHARS),
                clean(row.pageSection(), Integer.MAX_VALUE),
                SECONDARY_CONFIDENCE
        );
    }

    private void place(Map<MergeKey, MergedRow> slots, MergedRow candidate) {
        MergeKey key = new MergeKey(candidate.source(), candidate.date(), candidate.event(), pageNumber(candidate.pageSection()));
        slots.merge(key, candidate, RowMerger::better);
    }

    /**
     * @param incumbent row currently holding the slot
     * @param challenger row competing for it
     * @return the row to keep
     */
    static MergedRow better(MergedRow incumbent, MergedRow challenger) {
        double delta = incumbent.confidence() - challenger.confidence();
        if (Math.abs(delta) >= CONFIDENCE_MARGIN) {
            return delta > 0 ? incumbent : challenger;
        }
        return incumbent.description().length() >= challenger.description().length() ? incumbent : challenger;
    }

    /**
     * @param pageSection location descriptor such as {@code p.3 / FACTS}
     * @return the page number, or {@value #UNKNOWN_PAGE} when none can be read
     */
    public static int pageNumber(String pageSection) {
        if (pageSection == null) {
            return UNKNOWN_PAGE;
        }
        Matcher matcher = PAGE_NUMBER.matcher(pageSection);
        if (!matcher.find()) {
            return UNKNOWN_PAGE;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return UNKNOWN_PAGE;
        }
    }

    /**
     * @param date candidate date text
     * @return {@code true} for a YYYY-MM-DD string naming a real calendar day
     */
    public static boolean isValidIsoDate(String date) {
        if (date == null || !ISO_DATE.matcher(date).matches()) {
            return false;
        }
        try {
            LocalDate.of(
                    Integer.parseInt(date.substring(0, 4)),
                    Integer.parseInt(date.substring(5, 7)),
                    Integer.parseInt(date.substring(8, 10)));
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    private static String clean(String value, int limit) {
        if (value == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(value.trim()).replaceAll(" ");
        return collapsed.length() > limit ? collapsed.substring(0, limit) : collapsed;
    }

    private record MergeKey(String source, String date, EventType event, int page) {
    }

    private record DedupeKey(String source, String date, EventType event, int page, String descriptionPrefix) {
    }
}
