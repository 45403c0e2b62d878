package com.leadscoring.exception;

/**
 * Inbound signal is malformed, incomplete, stale or points at an unknown prospect.
 * Rejected synchronously; the caller decides between retry and discard.
 */
public class SignalValidationException extends EngineException {

    public SignalValidationException(String component, String prospectId, String message) {
        super(component, prospectId, message);
    }
}
