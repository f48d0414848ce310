package de.t14d3.clientdb.core;

import de.t14d3.clientdb.exceptions.ClientDbException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Coalesces concurrent identical operations: while one is in flight, callers with the same key
 * wait for it and get its result or its failure.
 *
 * The in-flight registration is removed before the outcome is delivered, so a call made after
 * completion starts a new operation. A call re-entering its own key on the thread that runs the
 * operation (for example from a synchronous listener) runs directly instead of waiting on itself.
 */
public final class RequestDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(RequestDeduplicator.class);

    private final ConcurrentHashMap<String, InFlight> inFlight = new ConcurrentHashMap<>();

    private record InFlight(Thread owner, CompletableFuture<Object> future) {
    }

    /**
     * Key of an operation: {@code ::name::param1::param2...}.
     */
    public static String key(String operation, Object... params) {
        StringBuilder key = new StringBuilder("::").append(operation);
        for (Object param : params) {
            key.append("::").append(param);
        }
        return key.toString();
    }

    @SuppressWarnings("unchecked")
    public <T> T dedupe(String key, Supplier<T> operation) {
        Objects.requireNonNull(operation, "operation");
        InFlight mine = new InFlight(Thread.currentThread(), new CompletableFuture<>());
        InFlight existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            if (existing.owner() == Thread.currentThread()) {
                log.debug("Re-entrant call of {} runs unshared", key);
                return operation.get();
            }
            return (T) await(existing.future());
        }

        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            inFlight.remove(key, mine);
            mine.future().completeExceptionally(e);
            throw e;
        }
        inFlight.remove(key, mine);
        mine.future().complete(result);
        return result;
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientDbException("Interrupted while waiting for a shared operation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ClientDbException(cause);
        }
    }
}
