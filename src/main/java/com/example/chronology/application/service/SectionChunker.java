package com.example.chronology.application.service;

import com.example.chronology.domain.model.RuleSet;
import com.example.chronology.domain.model.Section;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a page into sections by detecting heading lines.
 * A heading is short, mostly upper case and matches one of the configured section patterns.
 */
@Component
public class SectionChunker {

    static final int MAX_HEADING_LENGTH = 80;
    static final double MIN_UPPERCASE_RATIO = 0.6;

    private final List<Pattern> sectionPatterns;

    public SectionChunker(RuleSet ruleSet) {
        this.sectionPatterns = ruleSet.sectionPatterns();
    }

    /**
     * Scans the lines top to bottom; every heading opens a new section.
     *
     * @param lines page lines in reading order
     * @return sections ordered by start index, or a single {@code BODY} section when no heading exists
     */
    public List<Section> buildSections(List<String> lines) {
        List<Section> sections = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isHeading(line)) {
                sections.add(new Section(line.trim(), i));
            }
        }
        if (sections.isEmpty()) {
            return List.of(new Section(Section.BODY, 0));
        }
        return List.copyOf(sections);
    }

    /**
     * Resolves the label of the section that encloses a line.
     *
     * @param sections sections returned by {@link #buildSections(List)}
     * @param index    line index on the page
     * @return label of the last section starting at or before {@code index}, {@code BODY} if none does
     */
    public String sectionFor(List<Section> sections, int index) {
        String current = Section.BODY;
        for (Section section : sections) {
            if (section.startIndex() > index) {
                break;
            }
            current = section.label();
        }
        return current;
    }

    /**
     * @param line raw line
     * @return {@code true} when the line qualifies as a section heading
     */
    public boolean isHeading(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_HEADING_LENGTH) {
            return false;
        }
        if (uppercaseRatio(trimmed) < MIN_UPPERCASE_RATIO) {
            return false;
        }
        for (Pattern pattern : sectionPatterns) {
            if (pattern.matcher(trimmed).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param text text to measure
     * @return share of letters that are upper case, 0 when the text has no letters
     */
    static double uppercaseRatio(String text) {
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        return letters == 0 ? 0.0 : (double) upper / letters;
    }
}
