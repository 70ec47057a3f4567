package com.example.chronology.application.service;

import com.example.chronology.domain.exception.DocumentFileRequiredException;
import com.example.chronology.domain.exception.DocumentNotFoundException;
import com.example.chronology.domain.exception.DocumentPathRequiredException;
import com.example.chronology.domain.exception.DomainException;
import com.example.chronology.domain.model.CandidateRow;
import com.example.chronology.domain.model.ChronologyEntry;
import com.example.chronology.domain.model.ChronologyResult;
import com.example.chronology.domain.model.ChronologyResult.SkippedDocument;
import com.example.chronology.domain.model.ExtractedRow;
import com.example.chronology.domain.model.MergedRow;
import com.example.chronology.domain.model.PageRecord;
import com.example.chronology.domain.model.SourceDocument;
import com.example.chronology.infrastructure.config.ChronologyProperties;
import com.example.chronology.infrastructure.document.DocumentLoaderRegistry;
import com.example.chronology.infrastructure.exception.DocumentProcessingException;
import com.example.chronology.infrastructure.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Application-layer service that turns a batch of legal documents into one chronology table.
 * It validates inputs, delegates loading to the infrastructure loaders, runs the rule pass, escalation and
 * merging per document, and finishes with a global dedupe and sort.
 */
@Service
public class ChronologyService {

    private static final Logger log = LoggerFactory.getLogger(ChronologyService.class);

    static final Comparator<MergedRow> TABLE_ORDER = Comparator
            .comparing(MergedRow::source)
            .thenComparingInt(row -> RowMerger.pageNumber(row.pageSection()))
            .thenComparing(MergedRow::date)
            .thenComparing(row -> row.event().label());

    private final DocumentLoaderRegistry loaderRegistry;
    private final RuleMatcher ruleMatcher;
    private final EscalationGate escalationGate;
    private final SecondaryExtractionService secondaryExtraction;
    private final RowMerger rowMerger;
    private final ChronologyProperties properties;

    /**
     * Creates the service with the pipeline stages it orchestrates.
     *
     * @param loaderRegistry      picks a loader by file extension
     * @param ruleMatcher         rule pass over each page
     * @param escalationGate      selects rows for the secondary extractor
     * @param secondaryExtraction runs escalated chunks through the secondary extractor
     * @param rowMerger           reconciles and deduplicates rows
     * @param properties          application settings
     */
    public ChronologyService(DocumentLoaderRegistry loaderRegistry,
                             RuleMatcher ruleMatcher,
                             EscalationGate escalationGate,
                             SecondaryExtractionService secondaryExtraction,
                             RowMerger rowMerger,
                             ChronologyProperties properties) {
        this.loaderRegistry = loaderRegistry;
        this.ruleMatcher = ruleMatcher;
        this.escalationGate = escalationGate;
        this.secondaryExtraction = secondaryExtraction;
        this.rowMerger = rowMerger;
        this.properties = properties;
    }

    /**
     * Builds a chronology from uploaded files.
     *
     * @param files uploaded documents; empty parts are ignored
     * @return sorted table plus processed and skipped sources
     * @throws DocumentFileRequiredException when no non-empty file was uploaded
     */
    public ChronologyResult buildChronology(List<MultipartFile> files) {
        List<MultipartFile> uploads = files == null ? List.of() : files.stream()
                .filter(file -> file != null && !file.isEmpty())
                .toList();
        if (uploads.isEmpty()) {
            throw new DocumentFileRequiredException();
        }

        List<SourceDocument> documents = new ArrayList<>();
        List<SkippedDocument> skipped = new ArrayList<>();
        for (MultipartFile file : uploads) {
            String fileName = resolveFileName(file);
            try {
                documents.add(new SourceDocument(fileName, fileName, file.getBytes()));
            } catch (IOException e) {
                log.warn("Skipping {}: unable to read the upload ({})", fileName, e.getMessage());
                skipped.add(new SkippedDocument(fileName, "Unable to read the uploaded file."));
            }
        }
        return process(documents, skipped);
    }

    /**
     * Builds a chronology from a file or, recursively, from every file under a directory in path order.
     *
     * @param input file or directory on disk
     * @return sorted table plus processed and skipped sources
     * @throws DocumentPathRequiredException when {@code input} is null
     * @throws DocumentNotFoundException     when the path does not exist
     * @throws DocumentProcessingException   when the directory cannot be listed
     */
    public ChronologyResult buildChronology(Path input) {
        if (input == null) {
            throw new DocumentPathRequiredException();
        }
        if (!Files.exists(input)) {
            throw new DocumentNotFoundException(input.toAbsolutePath().toString());
        }

        List<SourceDocument> documents = new ArrayList<>();
        List<SkippedDocument> skipped = new ArrayList<>();
        for (Path file : listFiles(input)) {
            String source = file.toString();
            String fileName = file.getFileName() != null ? file.getFileName().toString() : source;
            if (!loaderRegistry.isSupported(fileName)) {
                log.warn("Skipping {}: unsupported document type", source);
                skipped.add(new SkippedDocument(source, "Unsupported document type."));
                continue;
            }
            try {
                documents.add(new SourceDocument(source, fileName, Files.readAllBytes(file)));
            } catch (IOException e) {
                log.warn("Skipping {}: unable to read the file ({})", source, e.getMessage());
                skipped.add(new SkippedDocument(source, "Unable to read the file."));
            }
        }
        return process(documents, skipped);
    }

    /**
     * Runs every document through the pipeline and assembles the sorted table.
     *
     * @param documents documents in processing order
     * @param skipped   documents already left out while reading input, extended in place
     * @return chronology result
     */
    ChronologyResult process(List<SourceDocument> documents, List<SkippedDocument> skipped) {
        List<MergedRow> rows = new ArrayList<>();
        List<String> processed = new ArrayList<>();
        for (SourceDocument document : documents) {
            try {
                rows.addAll(processDocument(document));
                processed.add(document.source());
            } catch (DomainException | InfrastructureException e) {
                log.warn("Skipping {}: {}", document.source(), e.getMessage());
                skipped.add(new SkippedDocument(document.source(), e.getMessage()));
            }
        }

        List<ChronologyEntry> entries = rowMerger.dedupe(rows).stream()
                .filter(row -> RowMerger.isValidIsoDate(row.date()))
                .sorted(TABLE_ORDER)
                .map(MergedRow::toEntry)
                .toList();
        log.info("Chronology built: {} rows from {} documents, {} skipped",
                entries.size(), processed.size(), skipped.size());
        return new ChronologyResult(entries, processed, skipped);
    }

    /**
     * Loads one document, runs the rule pass, escalates what the gate selects and merges the results.
     *
     * @param document source document
     * @return merged rows for this document
     */
    List<MergedRow> processDocument(SourceDocument document) {
        List<PageRecord> pages = loaderRegistry.load(document.content(), document.fileName());

        List<CandidateRow> ruleRows = new ArrayList<>();
        for (PageRecord page : pages) {
            List<CandidateRow> pageRows = ruleMatcher.parsePage(page);
            log.debug("{} page {}: {} rule rows", document.source(), page.pageNumber(), pageRows.size());
            pageRows.forEach(row -> ruleRows.add(row.withSource(document.source())));
        }

        List<CandidateRow> escalated = escalationEnabled()
                ? ruleRows.stream().filter(escalationGate::shouldEscalate).toList()
                : List.of();

        List<MergedRow> merged;
        if (escalated.isEmpty()) {
            merged = rowMerger.normalizeAll(ruleRows);
        } else {
            List<ExtractedRow> secondaryRows = secondaryExtraction.escalate(escalated);
            merged = rowMerger.merge(ruleRows, secondaryRows);
        }
        log.info("Processed {}: {} pages, {} rule rows, {} escalated, {} merged rows",
                document.source(), pages.size(), ruleRows.size(), escalated.size(), merged.size());
        return merged;
    }

    private boolean escalationEnabled() {
        return properties.llm().enabled() && secondaryExtraction.isAvailable();
    }

    private List<Path> listFiles(Path input) {
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        try (Stream<Path> paths = Files.walk(input)) {
            return paths.filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new DocumentProcessingException("Unable to list documents under " + input, e);
        }
    }

    /**
     * Returns a safe file name, falling back when the client omitted one.
     */
    private String resolveFileName(MultipartFile file) {
        String original = file.getOriginalFilename();
        if (original == null || original.isBlank()) {
            return file.getName();
        }
        return original;
    }
}
