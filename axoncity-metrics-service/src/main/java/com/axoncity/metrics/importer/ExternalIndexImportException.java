package com.axoncity.metrics.importer;

/**
 * An import that cannot produce an index. Never a partial success.
 */
public abstract class ExternalIndexImportException extends RuntimeException {

    protected ExternalIndexImportException(String message) {
        super(message);
    }

    protected ExternalIndexImportException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorCode();
}
