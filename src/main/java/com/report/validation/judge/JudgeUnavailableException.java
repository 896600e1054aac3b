package com.report.validation.judge;

/**
 * Thrown when the judge cannot produce a verdict (transport error, timeout, unparseable response).
 */
public class JudgeUnavailableException extends RuntimeException {

    public JudgeUnavailableException(String message) {
        super(message);
    }

    public JudgeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
