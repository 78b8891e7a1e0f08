package com.bank.fraudscreen.engine;

/**
 * Unexpected failure of an upstream stage (enrichment or risk scoring).
 */
public class StageExecutionException extends WorkflowException {

    public StageExecutionException(String stage, Throwable cause) {
        super(stage, "Stage '" + stage + "' failed: " + cause.getMessage(), cause);
    }
}
