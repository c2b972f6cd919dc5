package com.example.supplymatch.application.exception;

/**
 * Signals a request a use case refuses to run, such as confirming a mapping for a blank line text.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
