package com.axoncity.metrics.importer;

public class MissingColumnException extends ExternalIndexImportException {

    private final String column;

    public MissingColumnException(String column) {
        super("Value column \"" + column + "\" not found in file");
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public String errorCode() {
        return "MISSING_COLUMN";
    }
}
