package com.company.searchindexer.exception;

/**
 * El origen MySQL o Elasticsearch no responde. Al inicio de un proceso es fatal.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
