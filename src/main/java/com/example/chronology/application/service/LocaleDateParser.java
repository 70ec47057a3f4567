package com.example.chronology.application.service;

import com.example.chronology.domain.model.DateOrder;
import com.example.chronology.domain.model.RuleSet;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns date expressions found in legal text into {@link LocalDate}s.
 * Numeric dates follow the configured field order; textual dates use month names from the configured
 * languages. Anything that is not a real calendar date is rejected.
 */
@Component
public class LocaleDateParser {

    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("\\b(\\d{1,2})(st|nd|rd|th)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern OF_WORD = Pattern.compile("\\bof\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEPT_ABBREVIATION = Pattern.compile("\\bsept\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_DATE = Pattern.compile("^(\\d{1,4})\\s*[./-]\\s*(\\d{1,2})\\s*[./-]\\s*(\\d{1,4})$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> TEXTUAL_LAYOUTS = List.of(
            "d MMMM uuuu",
            "d MMM uuuu",
            "MMMM d uuuu",
            "MMM d uuuu",
            "uuuu MMMM d",
            "uuuu MMM d"
    );
    private static final int TWO_DIGIT_YEAR_PIVOT = 50;

    private final List<Pattern> datePatterns;
    private final DateOrder dateOrder;
    private final List<DateTimeFormatter> textualFormatters;

    /**
     * Creates the parser from the compiled rule set.
     *
     * @param ruleSet rule configuration supplying date patterns, languages and field order
     */
    public LocaleDateParser(RuleSet ruleSet) {
        this.datePatterns = ruleSet.datePatterns();
        this.dateOrder = ruleSet.dateOrder();
        this.textualFormatters = buildTextualFormatters(ruleSet.languages());
    }

    /**
     * Finds every configured date pattern match in the text and keeps the ones that parse.
     *
     * @param text unit or description to scan
     * @return distinct ISO-8601 dates in ascending order
     */
    public List<String> findDates(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        TreeSet<String> hits = new TreeSet<>();
        for (Pattern pattern : datePatterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                parse(matcher.group()).ifPresent(date -> hits.add(date.toString()));
            }
        }
        return List.copyOf(hits);
    }

    /**
     * Parses a single date expression such as {@code 12.03.2020}, {@code 3rd March, 2020} or
     * {@code 2020-03-12}.
     *
     * @param expression text that should contain nothing but a date
     * @return parsed date, or empty when the text is not a real calendar date
     */
    public Optional<LocalDate> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        String cleaned = WHITESPACE.matcher(expression.trim()).replaceAll(" ");
        Matcher numeric = NUMERIC_DATE.matcher(cleaned);
        if (numeric.matches()) {
            return parseNumeric(numeric.group(1), numeric.group(2), numeric.group(3));
        }
        return parseTextual(normalizeTextual(cleaned));
    }

    private Optional<LocalDate> parseNumeric(String first, String second, String third) {
        if (first.length() == 4) {
            return toDate(first, second, third);
        }
        Optional<LocalDate> primary = resolve(dateOrder, first, second, third);
        if (primary.isPresent()) {
            return primary;
        }
        DateOrder alternative = dateOrder.swapped();
        return alternative == dateOrder ? Optional.empty() : resolve(alternative, first, second, third);
    }

    private Optional<LocalDate> resolve(DateOrder order, String first, String second, String third) {
        return switch (order) {
            case DMY -> toDate(third, second, first);
            case MDY -> toDate(third, first, second);
            case YMD -> toDate(first, second, third);
        };
    }

    private Optional<LocalDate> toDate(String year, String month, String day) {
        if (day.length() > 2 || month.length() > 2) {
            return Optional.empty();
        }
        int resolvedYear;
        if (year.length() == 4) {
            resolvedYear = Integer.parseInt(year);
        } else if (year.length() == 2) {
            int shortYear = Integer.parseInt(year);
            resolvedYear = shortYear <= TWO_DIGIT_YEAR_PIVOT ? 2000 + shortYear : 1900 + shortYear;
        } else {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.of(resolvedYear, Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private Optional<LocalDate> parseTextual(String text) {
        for (DateTimeFormatter formatter : textualFormatters) {
            try {
                return Optional.of(LocalDate.parse(text, formatter));
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        return Optional.empty();
    }

    /**
     * Reduces "3rd of March, 2020" or "12-Mar.-2020" to "3 March 2020" / "12 Mar 2020".
     * "Sept" becomes "Sep", the only short month name the formatters accept.
     */
    private String normalizeTextual(String text) {
        String normalized = ORDINAL_SUFFIX.matcher(text).replaceAll("$1");
        normalized = OF_WORD.matcher(normalized).replaceAll(" ");
        normalized = SEPT_ABBREVIATION.matcher(normalized).replaceAll("Sep");
        normalized = normalized.replace(',', ' ')
                .replace('.', ' ')
                .replace('-', ' ')
                .replace('/', ' ');
        return WHITESPACE.matcher(normalized.trim()).replaceAll(" ");
    }

    private static List<DateTimeFormatter> buildTextualFormatters(List<Locale> languages) {
        List<DateTimeFormatter> formatters = new ArrayList<>();
        for (Locale locale : languages) {
            for (String layout : TEXTUAL_LAYOUTS) {
                formatters.add(new DateTimeFormatterBuilder()
                        .parseCaseInsensitive()
                        .appendPattern(layout)
                        .toFormatter(locale)
                        .withResolverStyle(ResolverStyle.STRICT));
            }
        }
        return List.copyOf(formatters);
    }
}
