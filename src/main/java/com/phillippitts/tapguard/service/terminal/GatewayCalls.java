package com.phillippitts.tapguard.service.terminal;

import com.phillippitts.tapguard.exception.TerminalCommandException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bounded waits on gateway futures.
 *
 * <p>Gateway implementations wrap a vendor SDK and may throw from the call itself instead of
 * failing the returned future. {@link #invoke} folds both paths into a failed future so
 * callers only handle {@link TerminalCommandException}.
 */
public final class GatewayCalls {

    private GatewayCalls() {
    }

    /**
     * Starts a gateway command. A synchronous throw or a {@code null} result becomes a future
     * failed with {@link TerminalCommandException}.
     */
    public static <T> CompletableFuture<T> invoke(String command, Supplier<CompletableFuture<T>> call) {
        Objects.requireNonNull(call, "call");
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(TerminalCommandException.from(command, e));
        }
        if (future == null) {
            return CompletableFuture.failedFuture(
                    new TerminalCommandException(command, "gateway returned no result"));
        }
        return future;
    }

    /**
     * Starts a gateway command and waits at most {@code timeout} for it.
     *
     * @throws TerminalCommandException if the command threw, failed, timed out or was cancelled
     */
    public static <T> T awaitCall(Supplier<CompletableFuture<T>> call, Duration timeout, String command) {
        return await(invoke(command, call), timeout, command);
    }

    /**
     * Waits at most {@code timeout} for the command to complete.
     *
     * @throws TerminalCommandException if the command failed, timed out or was cancelled
     */
    public static <T> T await(CompletableFuture<T> future, Duration timeout, String command) {
        if (future == null) {
            throw new TerminalCommandException(command, "gateway returned no result");
        }
        Objects.requireNonNull(timeout, "timeout");
        try {
            return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException | CancellationException e) {
            throw TerminalCommandException.from(command, e);
        }
    }
}
