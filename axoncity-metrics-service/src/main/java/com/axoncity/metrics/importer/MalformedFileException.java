package com.axoncity.metrics.importer;

/**
 * Text the delimited parser cannot tokenize, such as a quoted field that is never closed.
 */
public class MalformedFileException extends ExternalIndexImportException {

    public MalformedFileException(Throwable cause) {
        super("File could not be parsed as delimited text: " + cause.getMessage(), cause);
    }

    @Override
    public String errorCode() {
        return "MALFORMED_FILE";
    }
}
