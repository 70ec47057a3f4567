package com.example.chronology.infrastructure.document;

import com.example.chronology.domain.model.PageRecord;
import com.example.chronology.infrastructure.config.ChronologyProperties;
import com.example.chronology.infrastructure.exception.DocumentProcessingException;
import com.example.chronology.infrastructure.ocr.OcrEngine;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads PDFs page by page through the PDFBox text layer.
 * Pages with an empty text layer are flagged as scanned; when OCR is enabled and an {@link OcrEngine} is
 * registered, the whole document is rendered and recognized instead.
 */
@Component
public class PdfBoxDocumentLoader implements DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentLoader.class);
    private static final float OCR_DPI = 144f;

    private final OcrEngine ocrEngine;
    private final boolean ocrEnabled;

    /**
     * Creates the loader with an optional OCR engine.
     *
     * @param ocrEngineProvider provider of the OCR engine bean, if one is registered
     * @param properties        application settings carrying the OCR switch
     */
    @Autowired
    public PdfBoxDocumentLoader(ObjectProvider<OcrEngine> ocrEngineProvider, ChronologyProperties properties) {
        this(ocrEngineProvider.getIfAvailable(), properties.ocrEnabled());
    }

    PdfBoxDocumentLoader(OcrEngine ocrEngine, boolean ocrEnabled) {
        this.ocrEngine = ocrEngine;
        this.ocrEnabled = ocrEnabled;
    }

    @Override
    public boolean supports(String fileName) {
        return FileExtensions.hasExtension(fileName, ".pdf");
    }

    @Override
    public List<PageRecord> load(byte[] content, String fileName) {
        try (PDDocument document = Loader.loadPDF(content)) {
            List<PageRecord> pages = extractTextLayer(document);
            boolean hasScannedPages = pages.stream().anyMatch(PageRecord::scanned);
            if (ocrEnabled && hasScannedPages) {
                if (ocrEngine == null) {
                    log.warn("{} has scanned pages but no OCR engine is registered; keeping the text layer", fileName);
                } else {
                    log.info("{} has scanned pages; running OCR on {} pages", fileName, document.getNumberOfPages());
                    return recognize(document);
                }
            }
            return pages;
        } catch (IOException | RuntimeException e) {
            // PDFBox reports some malformed structures as unchecked exceptions
            throw new DocumentProcessingException("Unable to read the PDF " + fileName, e);
        }
    }

    /**
     * Uses {@link PDFTextStripper} to read each page separately.
     *
     * @param document loaded PDF document
     * @return one record per page
     * @throws IOException when PDFBox cannot read the page content
     */
    private List<PageRecord> extractTextLayer(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setLineSeparator("\n");

        List<PageRecord> pages = new ArrayList<>();
        for (int pageNumber = 1; pageNumber <= document.getNumberOfPages(); pageNumber++) {
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            String text = stripper.getText(document);
            pages.add(new PageRecord(pageNumber, text, toLines(text), text.isBlank()));
        }
        return pages;
    }

    /**
     * Renders every page and passes it to the OCR engine.
     *
     * @param document loaded PDF document
     * @return recognized pages, all flagged as scanned
     * @throws IOException when a page cannot be rendered
     */
    private List<PageRecord> recognize(PDDocument document) throws IOException {
        PDFRenderer renderer = new PDFRenderer(document);
        List<PageRecord> pages = new ArrayList<>();
        for (int pageIndex = 0; pageIndex < document.getNumberOfPages(); pageIndex++) {
            BufferedImage image = renderer.renderImageWithDPI(pageIndex, OCR_DPI, ImageType.RGB);
            String text = ocrEngine.recognize(image);
            pages.add(PageRecord.ofLines(pageIndex + 1, toLines(text), true));
        }
        return pages;
    }

    private static List<String> toLines(String text) {
        if (text == null) {
            return List.of();
        }
        return text.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
