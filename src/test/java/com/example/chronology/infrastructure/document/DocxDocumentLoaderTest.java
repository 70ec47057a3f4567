package com.example.chronology.infrastructure.document;

import com.example.chronology.domain.model.PageRecord;
import com.example.chronology.infrastructure.exception.DocumentProcessingException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocxDocumentLoaderTest {

    private final DocxDocumentLoader loader = new DocxDocumentLoader();

    @Test
    void paragraphsBecomeLinesOfPageOne() throws IOException {
        byte[] docx = createDocx("FACTS", "   ", "  Suit filed on 12.03.2020.  ", "");

        List<PageRecord> pages = loader.load(docx, "brief.docx");

        assertThat(pages).singleElement().satisfies(page -> {
            assertThat(page.pageNumber()).isEqualTo(1);
            assertThat(page.lines()).containsExactly("FACTS", "Suit filed on 12.03.2020.");
            assertThat(page.scanned()).isFalse();
        });
    }

    @Test
    void unreadableBytesRaiseProcessingException() {
        assertThrows(DocumentProcessingException.class,
                () -> loader.load("not a docx".getBytes(StandardCharsets.UTF_8), "broken.docx"));
    }

    @Test
    void supportsOnlyDocx() {
        assertThat(loader.supports("Brief.DOCX")).isTrue();
        assertThat(loader.supports("brief.doc")).isFalse();
    }

    private byte[] createDocx(String... paragraphs) throws IOException {
        try (XWPFDocument document = new XWPFDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            for (String text : paragraphs) {
                document.createParagraph().createRun().setText(text);
            }
            document.write(outputStream);
            return outputStream.toByteArray();
        }
    }
}
