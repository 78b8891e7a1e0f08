package com.bank.fraudscreen.client;

/**
 * Failure of a call to an external collaborator (reasoning service, alert channel).
 */
public class RemoteCallException extends RuntimeException {

    private final String operation;
    private final boolean timedOut;

    public RemoteCallException(String operation, String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.timedOut = timedOut;
    }

    public RemoteCallException(String operation, String message) {
        this(operation, message, false, null);
    }

    public String getOperation() {
        return operation;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
