package com.axoncity.metrics.importer;

public class EmptyFileException extends ExternalIndexImportException {

    public EmptyFileException() {
        super("File must have at least a header row and one data row");
    }

    @Override
    public String errorCode() {
        return "EMPTY_FILE";
    }
}
