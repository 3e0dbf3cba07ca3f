package com.churchadmin.service;

import com.churchadmin.config.ImportProperties;
import com.churchadmin.importer.CsvDocument;
import com.churchadmin.importer.ImportFileException;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads an uploaded CSV into memory after the file-level checks shared by every import.
 */
@Component
public class CsvUploadReader {

    private final ImportProperties importProperties;

    public CsvUploadReader(ImportProperties importProperties) {
        this.importProperties = importProperties;
    }

    public CsvDocument read(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ImportFileException("No file provided");
        }
        if (file.getSize() > importProperties.getMaxFileBytes()) {
            throw new ImportFileException(tooLargeMessage());
        }
        return CsvDocument.parse(new String(file.getBytes(), StandardCharsets.UTF_8));
    }

    public String tooLargeMessage() {
        return "File is too large (maximum " + importProperties.getMaxFileBytes() + " bytes)";
    }
}
