package com.axoncity.metrics.importer;

public class NoValidRowsException extends ExternalIndexImportException {

    public NoValidRowsException(String valueColumn) {
        super("No valid numeric values found in column \"" + valueColumn + "\"");
    }

    @Override
    public String errorCode() {
        return "NO_VALID_ROWS";
    }
}
