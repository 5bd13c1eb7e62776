package com.whereq.triage.exception;

/**
 * Exception thrown when a submission carries values the classifier cannot reason about
 */
public class InvalidSubmissionException extends IllegalArgumentException {
    public InvalidSubmissionException(String message) {
        super(message);
    }
}
