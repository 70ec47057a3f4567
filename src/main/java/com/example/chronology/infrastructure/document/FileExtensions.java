package com.example.chronology.infrastructure.document;

import java.util.Locale;

final class FileExtensions {

    private FileExtensions() {
    }

    static boolean hasExtension(String fileName, String extension) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(extension);
    }
}
