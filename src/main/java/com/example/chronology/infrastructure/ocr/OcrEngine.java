package com.example.chronology.infrastructure.ocr;

import java.awt.image.BufferedImage;

/**
 * Recognizes text on a rendered page image.
 * No recognizer ships with the application; register a bean implementing this interface to enable the
 * OCR fallback for scanned PDFs.
 */
public interface OcrEngine {

    /**
     * @param pageImage page rendered at 144 DPI
     * @return recognized text with one line per text line on the page
     */
    String recognize(BufferedImage pageImage);
}
