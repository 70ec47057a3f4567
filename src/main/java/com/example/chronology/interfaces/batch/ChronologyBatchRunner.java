package com.example.chronology.interfaces.batch;

import com.example.chronology.application.service.ChronologyExportService;
import com.example.chronology.application.service.ChronologyService;
import com.example.chronology.domain.model.ChronologyResult;
import com.example.chronology.domain.model.OutputFormat;
import com.example.chronology.infrastructure.config.ChronologyProperties;
import com.example.chronology.infrastructure.exception.DocumentProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Interfaces-layer entry point for batch mode: processes {@code chronology.batch.input} at startup and
 * writes the table to {@code chronology.batch.output}. Does nothing when no input is configured.
 */
@Component
public class ChronologyBatchRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ChronologyBatchRunner.class);
    private static final String DEFAULT_OUTPUT = "chronology.csv";

    private final ChronologyService chronologyService;
    private final ChronologyExportService exportService;
    private final ChronologyProperties.Batch settings;

    public ChronologyBatchRunner(ChronologyService chronologyService,
                                 ChronologyExportService exportService,
                                 ChronologyProperties properties) {
        this.chronologyService = chronologyService;
        this.exportService = exportService;
        this.settings = properties.batch();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (settings.input() == null || settings.input().isBlank()) {
            log.debug("No batch input configured; serving HTTP requests only");
            return;
        }
        Path input = Path.of(settings.input());
        Path output = Path.of(settings.output() == null || settings.output().isBlank() ? DEFAULT_OUTPUT : settings.output());

        ChronologyResult result = chronologyService.buildChronology(input);
        OutputFormat format = OutputFormat.fromFileName(output.toString());
        write(output, exportService.export(result, format));
        log.info("Wrote {} rows -> {}", result.entries().size(), output);
    }

    private void write(Path output, String content) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DocumentProcessingException("Unable to write the chronology to " + output, e);
        }
    }
}
