package com.example.chronology.interfaces.api;

import com.example.chronology.application.service.ChronologyExportService;
import com.example.chronology.application.service.ChronologyService;
import com.example.chronology.domain.model.ChronologyResult;
import com.example.chronology.domain.model.OutputFormat;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interfaces-layer REST controller that builds chronologies from uploaded documents and exports them.
 * The latest result is cached in the HTTP session so the export call does not re-process the files.
 */
@RestController
@RequestMapping("/api/chronology")
public class ChronologyController {

    static final String SESSION_RESULT_KEY = "LATEST_CHRONOLOGY_RESULT";

    private final ChronologyService chronologyService;
    private final ChronologyExportService exportService;

    /**
     * Creates the controller with the required application services.
     *
     * @param chronologyService service running the extraction pipeline
     * @param exportService     service responsible for CSV and JSON generation
     */
    public ChronologyController(ChronologyService chronologyService, ChronologyExportService exportService) {
        this.chronologyService = chronologyService;
        this.exportService = exportService;
    }

    /**
     * Processes the uploaded documents and returns the chronology as JSON.
     *
     * @param files   uploaded PDF, DOCX or TXT documents
     * @param session HTTP session for caching the result
     * @return chronology result with processed and skipped sources
     */
    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChronologyResult> buildChronology(@RequestParam("files") List<MultipartFile> files,
                                                            HttpSession session) {
        ChronologyResult result = chronologyService.buildChronology(files);
        session.setAttribute(SESSION_RESULT_KEY, result);
        return ResponseEntity.ok(result);
    }

    /**
     * Streams the cached chronology as a download.
     *
     * @param format  {@code csv} (default) or {@code json}
     * @param session HTTP session storing the cached result
     * @return document as a {@link ResponseEntity}
     */
    @PostMapping("/export")
    public ResponseEntity<byte[]> export(@RequestParam(name = "format", required = false) String format,
                                         HttpSession session) {
        OutputFormat outputFormat = OutputFormat.fromString(format);
        ChronologyResult cached = (ChronologyResult) session.getAttribute(SESSION_RESULT_KEY);
        String body = exportService.export(cached, outputFormat);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"chronology." + outputFormat.extension() + "\"")
                .contentType(MediaType.parseMediaType(outputFormat.mediaType() + ";charset=UTF-8"))
                .body(body.getBytes(StandardCharsets.UTF_8));
    }
}
