package com.iimsoft.vrpvalidator.service;

/**
 * The problem document could not be read or is not valid JSON for {@code ProblemRequest}.
 */
public class ProblemReadException extends RuntimeException {

    public ProblemReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
