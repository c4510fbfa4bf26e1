package com.questrail.helixd.internal.lifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * ShutdownSignal
 * =============================================================================
 * One-shot, idempotent broadcast used to stop the daemon.
 *
 * <p>The first {@link #trigger(String)} wins and records its reason; later
 * calls are ignored. Every listener registered through {@link #onTrigger}
 * runs exactly once, including listeners registered after the signal fired.
 * There is no acknowledgement of drain completion.</p>
 */
public final class ShutdownSignal
{
    private final CompletableFuture<String> fired = new CompletableFuture<>();

    /**
     * @return {@code true} if this call fired the signal
     */
    public boolean trigger(String reason)
    {
        return fired.complete(Objects.requireNonNullElse(reason, ""));
    }

    public boolean isTriggered()
    {
        return fired.isDone();
    }

    public Optional<String> reason()
    {
        return Optional.ofNullable(fired.getNow(null));
    }

    public void onTrigger(Consumer<String> listener)
    {
        Objects.requireNonNull(listener, "listener");
        fired.thenAccept(listener);
    }

    /**
     * Block until the signal fires.
     *
     * @return the shutdown reason
     */
    public String await() throws InterruptedException
    {
        try {
            return fired.get();
        }
        catch (ExecutionException e) {
            throw new IllegalStateException("Shutdown signal completed exceptionally", e.getCause());
        }
    }

    /**
     * Block until the signal fires or {@code timeout} elapses.
     *
     * @return the shutdown reason, or empty on timeout
     */
    public Optional<String> await(Duration timeout) throws InterruptedException
    {
        try {
            return Optional.of(fired.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        }
        catch (TimeoutException e) {
            return Optional.empty();
        }
        catch (ExecutionException e) {
            throw new IllegalStateException("Shutdown signal completed exceptionally", e.getCause());
        }
    }
}
