package com.nodeflow.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Races an asynchronous operation against a deadline.
 * <p>
 * The returned future completes with the operation's outcome, or exceptionally with {@link NodeTimeoutException}
 * once the deadline passes. After a timeout the operation's own future is cancelled (best effort) and its later
 * settlement is ignored; when the operation settles first the pending timer is cancelled. The deadline timer is
 * armed before the operation is started, so an operation that blocks inside {@code fn} still times out.
 */
public final class TimeoutGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutGuard.class);

    private final ScheduledThreadPoolExecutor timer;

    public TimeoutGuard() {
        this.timer = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "nodeflow-timeout");
            t.setDaemon(true);
            return t;
        });
        this.timer.setRemoveOnCancelPolicy(true);
    }

    public <T> CompletableFuture<T> withTimeout(Supplier<? extends CompletionStage<T>> fn, Duration timeout) {
        return withTimeout(fn, timeout.toMillis(), "Operation");
    }

    public <T> CompletableFuture<T> withTimeout(Supplier<? extends CompletionStage<T>> fn, long timeoutMs) {
        return withTimeout(fn, timeoutMs, "Operation");
    }

    /**
     * Runs {@code fn} and races its future against {@code timeoutMs}.
     *
     * @param fn        starts the operation; a synchronous throw fails the returned future
     * @param timeoutMs deadline in milliseconds; zero or negative disables it
     * @param operation name used in the timeout message ({@code "<operation> timed out after <n>ms"})
     */
    public <T> CompletableFuture<T> withTimeout(Supplier<? extends CompletionStage<T>> fn, long timeoutMs, String operation) {
        CompletableFuture<T> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<T>> source = new AtomicReference<>();
        ScheduledFuture<?> deadline = null;
        if (timeoutMs > 0) {
            deadline = timer.schedule(() -> {
                if (result.completeExceptionally(new NodeTimeoutException(operation, timeoutMs))) {
                    if (log.isDebugEnabled()) {
                        log.debug("Deadline reached | operation={} | timeoutMs={}", operation, timeoutMs);
                    }
                    CompletableFuture<T> pending = source.get();
                    if (pending != null) {
                        pending.cancel(true);
                    }
                }
            }, timeoutMs, TimeUnit.MILLISECONDS);
        }
        CompletionStage<T> stage;
        try {
            stage = fn.get();
        } catch (RuntimeException e) {
            cancel(deadline);
            result.completeExceptionally(e);
            return result;
        }
        if (stage == null) {
            cancel(deadline);
            result.completeExceptionally(new IllegalStateException(operation + " returned no future"));
            return result;
        }
        CompletableFuture<T> started = stage.toCompletableFuture();
        source.set(started);
        if (result.isDone()) {
            started.cancel(true);
            return result;
        }
        ScheduledFuture<?> armed = deadline;
        started.whenComplete((value, error) -> {
            cancel(armed);
            if (error != null) {
                result.completeExceptionally(NodeTimeoutException.unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    private static void cancel(ScheduledFuture<?> deadline) {
        if (deadline != null) {
            deadline.cancel(false);
        }
    }

    @Override
    public void close() {
        timer.shutdownNow();
    }
}
