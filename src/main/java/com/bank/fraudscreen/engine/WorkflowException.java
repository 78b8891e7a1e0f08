package com.bank.fraudscreen.engine;

/**
 * Base class for failures that stop a workflow run. Carries the name of the stage that failed.
 */
public class WorkflowException extends RuntimeException {

    private final String stage;

    public WorkflowException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public WorkflowException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
