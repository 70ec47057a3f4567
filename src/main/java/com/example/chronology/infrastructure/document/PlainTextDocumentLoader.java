package com.example.chronology.infrastructure.document;

import com.example.chronology.domain.model.PageRecord;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads UTF-8 text exported from a PDF.
 * A line that starts with a three- or four-digit number is read as a printed page marker and begins a new
 * page with that number, and the rest of the marker line stays on that page. Text before the first marker
 * is page 1.
 */
@Component
public class PlainTextDocumentLoader implements DocumentLoader {

    private static final Pattern PAGE_MARKER = Pattern.compile("^(\\d{3,4})\\b");

    @Override
    public boolean supports(String fileName) {
        return FileExtensions.hasExtension(fileName, ".txt");
    }

    @Override
    public List<PageRecord> load(byte[] content, String fileName) {
        String text = new String(content, StandardCharsets.UTF_8);
        List<PageRecord> pages = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentPage = 1;

        for (String raw : text.split("\\R", -1)) {
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            Matcher marker = PAGE_MARKER.matcher(line);
            if (marker.find()) {
                if (!current.isEmpty()) {
                    pages.add(PageRecord.ofLines(currentPage, current, false));
                    current = new ArrayList<>();
                }
                currentPage = Math.max(1, Integer.parseInt(marker.group(1)));
                line = line.substring(marker.end()).trim();
                if (line.isEmpty()) {
                    continue;
                }
            }
            current.add(line);
        }
        if (!current.isEmpty()) {
            pages.add(PageRecord.ofLines(currentPage, current, false));
        }
        if (pages.isEmpty()) {
            pages.add(PageRecord.ofLines(1, List.of(), false));
        }
        return pages;
    }
}
