package com.company.searchindexer.exception;

/**
 * Parámetros de proceso incompletos o mal formados. Se lanza antes de crear el registro.
 */
public class InvalidJobParametersException extends IllegalArgumentException {

    public InvalidJobParametersException(String message) {
        super(message);
    }

    public InvalidJobParametersException(String message, Throwable cause) {
        super(message, cause);
    }
}
