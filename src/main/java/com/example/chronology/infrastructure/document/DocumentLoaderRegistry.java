package com.example.chronology.infrastructure.document;

import com.example.chronology.domain.exception.UnsupportedDocumentFormatException;
import com.example.chronology.domain.model.PageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the {@link DocumentLoader} for a file by its extension.
 */
@Component
public class DocumentLoaderRegistry {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoaderRegistry.class);

    private final List<DocumentLoader> loaders;

    public DocumentLoaderRegistry(List<DocumentLoader> loaders) {
        this.loaders = List.copyOf(loaders);
    }

    public boolean isSupported(String fileName) {
        return findLoader(fileName).isPresent();
    }

    /**
     * Loads a document with the matching loader.
     *
     * @param content  raw bytes
     * @param fileName original file name
     * @return pages in document order
     * @throws UnsupportedDocumentFormatException when no loader handles the extension
     */
    public List<PageRecord> load(byte[] content, String fileName) {
        DocumentLoader loader = findLoader(fileName)
                .orElseThrow(() -> new UnsupportedDocumentFormatException(fileName));
        List<PageRecord> pages = loader.load(content, fileName);
        log.debug("Loaded {} pages from {} with {}", pages.size(), fileName, loader.getClass().getSimpleName());
        return pages;
    }

    private Optional<DocumentLoader> findLoader(String fileName) {
        return loaders.stream().filter(loader -> loader.supports(fileName)).findFirst();
    }
}
