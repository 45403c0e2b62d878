package com.leadscoring.exception;

import lombok.Getter;

/**
 * Base class for failures reported back to the orchestrator.
 *
 * Always carries the prospect (or integration) it concerns and the component that failed, so
 * an operator can retry the right thing. None of these is fatal to the process.
 */
@Getter
public abstract class EngineException extends RuntimeException {

    private final String subjectId;
    private final String component;

    protected EngineException(String component, String subjectId, String message) {
        super(message);
        this.component = component;
        this.subjectId = subjectId;
    }
}
