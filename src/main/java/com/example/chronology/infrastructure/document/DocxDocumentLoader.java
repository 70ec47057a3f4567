package com.example.chronology.infrastructure.document;

import com.example.chronology.domain.model.PageRecord;
import com.example.chronology.infrastructure.exception.DocumentProcessingException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads Word documents as a single page of non-empty paragraphs.
 * DOCX has no stable page boundaries, so every row from it is located on page 1.
 */
@Component
public class DocxDocumentLoader implements DocumentLoader {

    @Override
    public boolean supports(String fileName) {
        return FileExtensions.hasExtension(fileName, ".docx");
    }

    @Override
    public List<PageRecord> load(byte[] content, String fileName) {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
            List<String> lines = new ArrayList<>();
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                String text = paragraph.getText();
                if (text != null && !text.isBlank()) {
                    lines.add(text.trim());
                }
            }
            return List.of(PageRecord.ofLines(1, lines, false));
        } catch (IOException | POIXMLException | OpenXML4JRuntimeException | IllegalArgumentException e) {
            throw new DocumentProcessingException("Unable to read the Word document " + fileName, e);
        }
    }
}
