package com.example.chronology.domain.model;

/**
 * Raw document bytes together with the identifier written to the SOURCE column.
 */
public record SourceDocument(String source, String fileName, byte[] content) {
}
