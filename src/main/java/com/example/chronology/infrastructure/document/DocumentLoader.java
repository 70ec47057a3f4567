package com.example.chronology.infrastructure.document;

import com.example.chronology.domain.model.PageRecord;

import java.util.List;

/**
 * Turns the bytes of one container format into ordered pages.
 */
public interface DocumentLoader {

    /**
     * @param fileName original file name
     * @return {@code true} when this loader handles the file's extension
     */
    boolean supports(String fileName);

    /**
     * @param content  raw document bytes
     * @param fileName original file name, used in log and error messages
     * @return pages in document order
     * @throws com.example.chronology.infrastructure.exception.DocumentProcessingException when the bytes cannot be parsed
     */
    List<PageRecord> load(byte[] content, String fileName);
}
