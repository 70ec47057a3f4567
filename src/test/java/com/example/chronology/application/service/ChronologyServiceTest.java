package com.example.chronology.application.service;

import com.example.chronology.TestFixtures;
import com.example.chronology.application.port.SecondaryExtractor;
import com.example.chronology.domain.exception.DocumentFileRequiredException;
import com.example.chronology.domain.exception.DocumentNotFoundException;
import com.example.chronology.domain.exception.DocumentPathRequiredException;
import com.example.chronology.domain.model.ChronologyEntry;
import com.example.chronology.domain.model.ChronologyResult;
import com.example.chronology.domain.model.EventType;
import com.example.chronology.domain.model.RuleSet;
import com.example.chronology.infrastructure.config.ChronologyProperties;
import com.example.chronology.infrastructure.document.DocumentLoaderRegistry;
import com.example.chronology.infrastructure.document.DocxDocumentLoader;
import com.example.chronology.infrastructure.document.PdfBoxDocumentLoader;
import com.example.chronology.infrastructure.document.PlainTextDocumentLoader;
import com.example.chronology.infrastructure.ocr.OcrEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

/**
 * Pipeline tests for the chronology application service, run against real loaders and rules.
 */
class ChronologyServiceTest {

    private static final String CASE_TEXT = """
            FACTS
            The plaintiff filed the suit on 12.03.2020.
            PROCEEDINGS
            The matter was adjourned to 3rd April, 2020.
            """;

    private final RuleSet rules = TestFixtures.defaultRules();
    private final LocaleDateParser dateParser = new LocaleDateParser(rules);

    @Test
    void buildsSortedChronologyFromText() {
        ChronologyService service = service(false, null);
        MockMultipartFile file = textFile("case.txt", CASE_TEXT);

        ChronologyResult result = service.buildChronology(List.of(file));

        assertThat(result.entries()).containsExactly(
                new ChronologyEntry("2020-03-12", EventType.FILING, "The plaintiff filed the suit on 12.03.2020.",
                        "p.1 / FACTS", "case.txt"),
                new ChronologyEntry("2020-04-03", EventType.ADJOURNMENT, "The matter was adjourned to 3rd April, 2020.",
                        "p.1 / PROCEEDINGS", "case.txt"));
        assertThat(result.processedSources()).containsExactly("case.txt");
        assertThat(result.skipped()).isEmpty();
    }

    /**
     * Uploading the same document twice yields each row once.
     */
    @Test
    void duplicateDocumentsAreDeduplicated() {
        ChronologyService service = service(false, null);

        ChronologyResult result = service.buildChronology(List.of(
                textFile("case.txt", CASE_TEXT), textFile("case.txt", CASE_TEXT)));

        assertThat(result.entries()).hasSize(2);
        assertThat(result.processedSources()).containsExactly("case.txt", "case.txt");
    }

    @Test
    void rowsAreSortedBySourceThenPageThenDate() {
        ChronologyService service = service(false, null);
        String paged = """
                Judgment pronounced on 01.01.2021.
                102
                Hearing held on 05.05.2019.
                """;

        ChronologyResult result = service.buildChronology(List.of(
                textFile("b.txt", "Suit filed on 02.02.2018."),
                textFile("a.txt", paged)));

        assertThat(result.entries())
                .extracting(ChronologyEntry::source, ChronologyEntry::date)
                .containsExactly(
                        tuple("a.txt", "2021-01-01"),
                        tuple("a.txt", "2019-05-05"),
                        tuple("b.txt", "2018-02-02"));
        assertThat(result.entries().get(1).pageSection()).isEqualTo("p.102 / BODY");
    }

    @Test
    void unsupportedAndUnreadableDocumentsAreSkipped() {
        ChronologyService service = service(false, null);

        ChronologyResult result = service.buildChronology(List.of(
                textFile("case.txt", CASE_TEXT),
                new MockMultipartFile("files", "notes.xlsx", "application/octet-stream", new byte[]{1, 2, 3}),
                new MockMultipartFile("files", "broken.pdf", "application/pdf", "not a pdf".getBytes(StandardCharsets.UTF_8))));

        assertThat(result.entries()).hasSize(2);
        assertThat(result.processedSources()).containsExactly("case.txt");
        assertThat(result.skipped())
                .extracting(ChronologyResult.SkippedDocument::source)
                .containsExactly("notes.xlsx", "broken.pdf");
    }

    @Test
    void emptyUploadIsRejected() {
        ChronologyService service = service(false, null);
        MockMultipartFile empty = new MockMultipartFile("files", "case.txt", "text/plain", new byte[0]);

        assertThrows(DocumentFileRequiredException.class, () -> service.buildChronology(List.<MultipartFile>of()));
        assertThrows(DocumentFileRequiredException.class, () -> service.buildChronology(List.<MultipartFile>of(empty)));
    }

    @Test
    void readsPdfPagesWithTheirOwnPageNumbers() throws IOException {
        ChronologyService service = service(false, null);
        byte[] pdf = createPdf(
                List.of("FACTS", "The plaintiff filed the suit on 12.03.2020."),
                List.of("PROCEEDINGS", "The matter was adjourned to 3rd April, 2020."));

        ChronologyResult result = service.buildChronology(List.of(
                new MockMultipartFile("files", "order.pdf", "application/pdf", pdf)));

        assertThat(result.entries())
                .extracting(ChronologyEntry::pageSection)
                .containsExactly("p.1 / FACTS", "p.2 / PROCEEDINGS");
        assertThat(result.entries().get(1).event()).isEqualTo(EventType.ADJOURNMENT);
    }

    /**
     * A rule row with an event but no date is escalated; the extractor supplies the date.
     */
    @Test
    void escalatedRowsAreMergedWhenExtractorIsEnabled() {
        AtomicInteger calls = new AtomicInteger();
        SecondaryExtractor extractor = request -> {
            calls.incrementAndGet();
            assertThat(request.pageSection()).isEqualTo("p.1 / PROCEEDINGS");
            return "{\"rows\":[{\"date\":\"20.03.2020\",\"event\":\"Notice\","
                    + "\"description\":\"Notice was issued to the respondent\"}]}";
        };
        ChronologyService service = service(true, extractor);
        String text = CASE_TEXT + "Notice was issued to the respondent.\n";

        ChronologyResult result = service.buildChronology(List.of(textFile("case.txt", text)));

        assertThat(calls).hasValue(1);
        assertThat(result.entries())
                .extracting(ChronologyEntry::date, ChronologyEntry::event)
                .containsExactly(
                        tuple("2020-03-12", EventType.FILING),
                        tuple("2020-03-20", EventType.NOTICE),
                        tuple("2020-04-03", EventType.ADJOURNMENT));
    }

    @Test
    void escalationIsSkippedWhenDisabled() {
        AtomicInteger calls = new AtomicInteger();
        ChronologyService service = service(false, request -> {
            calls.incrementAndGet();
            return "{\"rows\":[]}";
        });

        service.buildChronology(List.of(textFile("case.txt", CASE_TEXT + "Notice was issued.\n")));

        assertThat(calls).hasValue(0);
    }

    @Test
    void walksDirectoriesRecursivelyInPathOrder(@TempDir Path directory) throws IOException {
        ChronologyService service = service(false, null);
        Files.createDirectories(directory.resolve("sub"));
        Files.writeString(directory.resolve("a.txt"), "Suit filed on 02.02.2018.");
        Files.writeString(directory.resolve("c.csv"), "date,event");
        Files.writeString(directory.resolve("sub").resolve("b.txt"), CASE_TEXT);

        ChronologyResult result = service.buildChronology(directory);

        assertThat(result.processedSources()).containsExactly(
                directory.resolve("a.txt").toString(),
                directory.resolve("sub").resolve("b.txt").toString());
        assertThat(result.skipped())
                .extracting(ChronologyResult.SkippedDocument::source)
                .containsExactly(directory.resolve("c.csv").toString());
        assertThat(result.entries()).hasSize(3);
    }

    @Test
    void pathInputIsValidated(@TempDir Path directory) {
        ChronologyService service = service(false, null);

        assertThrows(DocumentPathRequiredException.class, () -> service.buildChronology((Path) null));
        assertThrows(DocumentNotFoundException.class, () -> service.buildChronology(directory.resolve("missing")));
    }

    @SuppressWarnings("unchecked")
    private ChronologyService service(boolean llmEnabled, SecondaryExtractor extractor) {
        ChronologyProperties properties = TestFixtures.properties(llmEnabled);
        ObjectProvider<OcrEngine> noOcr = mock(ObjectProvider.class);
        DocumentLoaderRegistry registry = new DocumentLoaderRegistry(List.of(
                new PdfBoxDocumentLoader(noOcr, properties),
                new DocxDocumentLoader(),
                new PlainTextDocumentLoader()));
        SectionChunker chunker = new SectionChunker(rules);
        SecondaryExtractionService secondary = new SecondaryExtractionService(extractor, dateParser, Runnable::run,
                properties.llm(), new ObjectMapper());
        return new ChronologyService(registry, new RuleMatcher(rules, chunker, dateParser),
                new EscalationGate(properties), secondary, new RowMerger(), properties);
    }

    private MockMultipartFile textFile(String name, String content) {
        return new MockMultipartFile("files", name, "text/plain", content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Builds a PDF with one page per line list.
     */
    @SafeVarargs
    private byte[] createPdf(List<String>... pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            for (List<String> lines : pages) {
                PDPage page = new PDPage(PDRectangle.A4);
                document.addPage(page);
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    contentStream.newLineAtOffset(72, 750);
                    for (String line : lines) {
                        contentStream.showText(line);
                        contentStream.newLineAtOffset(0, -20);
                    }
                    contentStream.endText();
                }
            }

            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }
}
