package com.bank.fraudscreen.client;

/**
 * Narrow seam to the external natural-language reasoning service.
 */
public interface ReasoningClient {

    /**
     * Send a prompt and return the service's free-text answer.
     *
     * @throws RemoteCallException when the service is unavailable or answers with an error
     */
    String run(String prompt);
}
