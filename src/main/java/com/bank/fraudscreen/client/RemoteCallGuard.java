package com.bank.fraudscreen.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to external collaborators under a deadline. Every failure, including a timeout,
 * surfaces as {@link RemoteCallException}; callers decide how to degrade.
 */
@Component
public class RemoteCallGuard {

    private static final Logger log = LoggerFactory.getLogger(RemoteCallGuard.class);

    private final ExecutorService executor;

    public RemoteCallGuard(@Qualifier("remoteCallExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    public <T> T call(String operation, Duration timeout, Supplier<T> call) {
        Callable<T> task = call::get;
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Remote call '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new RemoteCallException(operation,
                    operation + " timed out after " + timeout.toMillis() + " ms", true, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RemoteCallException(operation, operation + " was interrupted", false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RemoteCallException) {
                throw (RemoteCallException) cause;
            }
            throw new RemoteCallException(operation, operation + " failed: " + cause.getMessage(), false, cause);
        }
    }
}
