package com.example.EV_Charging_Platform.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Call helpers shared by every component that talks to a provider:
 * bounded waiting and the explicit credential refresh step.
 */
public final class ProviderCalls {

    private static final Logger logger = LoggerFactory.getLogger(ProviderCalls.class);

    @FunctionalInterface
    public interface Call<T> {
        T execute() throws ProviderException;
    }

    private ProviderCalls() {}

    /**
     * Run the call; on UNAUTHORIZED refresh the adapter credentials and retry exactly once.
     * A second UNAUTHORIZED is returned to the caller unchanged.
     */
    public static <T> T withCredentialRefresh(ProviderAdapter adapter, Call<T> call) throws ProviderException {
        try {
            return call.execute();
        } catch (ProviderException e) {
            if (e.getKind() != ProviderException.Kind.UNAUTHORIZED) {
                throw e;
            }
            logger.info("Provider {} rejected credentials, refreshing before a single retry", adapter.name());
            adapter.refreshCredentials();
            return call.execute();
        }
    }

    /**
     * Run the call on the executor and wait at most {@code timeout}.
     * An expired wait cancels the task and surfaces as TIMEOUT.
     */
    public static <T> T withTimeout(ExecutorService executor, ProviderAdapter adapter, Duration timeout,
                                    Call<T> call) throws ProviderException {
        Callable<T> task = call::execute;
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new ProviderException(adapter.name(), ProviderException.Kind.UNAVAILABLE,
                    "Provider call rejected: executor saturated or shut down", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException(adapter.name(), ProviderException.Kind.TIMEOUT,
                    "No answer within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(adapter.name(), ProviderException.Kind.TIMEOUT,
                    "Interrupted while waiting for provider", e);
        } catch (ExecutionException e) {
            throw unwrap(adapter, e.getCause());
        }
    }

    static ProviderException unwrap(ProviderAdapter adapter, Throwable cause) {
        if (cause instanceof ProviderException) {
            return (ProviderException) cause;
        }
        return new ProviderException(adapter.name(), ProviderException.Kind.UNAVAILABLE,
                "Unexpected provider failure: " + cause, cause);
    }
}
