package com.churchadmin.importer;

/**
 * A structural problem with an upload (missing file, too few lines, missing required columns).
 * Aborts the import before any row is validated.
 */
public class ImportFileException extends IllegalArgumentException {

    public ImportFileException(String message) {
        super(message);
    }
}
