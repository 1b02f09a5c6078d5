package org.adseller.server.execution;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs asynchronous collaborator calls bounded by both a per-call limit and the remaining evaluation budget.
 */
public class TimeoutExecutor {

    private final Vertx vertx;

    public TimeoutExecutor(Vertx vertx) {
        this.vertx = Objects.requireNonNull(vertx);
    }

    public <T> Future<T> execute(Supplier<Future<T>> action, long callTimeout, Timeout timeout) {
        final long effectiveTimeout = timeout.callBudget(callTimeout);
        if (effectiveTimeout == 0) {
            return Future.failedFuture(new TimeoutException("Timeout has been exceeded"));
        }

        final Promise<T> promise = Promise.promise();
        final long timeoutTimerId = vertx.setTimer(effectiveTimeout, id -> failWithTimeout(promise));

        executeSafely(action)
                .onComplete(result -> completeWithActionResult(promise, timeoutTimerId, result));

        return promise.future();
    }

    private static <T> void failWithTimeout(Promise<T> promise) {
        // timer fires on the same event loop thread as the action completion
        if (!promise.future().isComplete()) {
            promise.fail(new TimeoutException("Timed out while executing action"));
        }
    }

    private static <T> Future<T> executeSafely(Supplier<Future<T>> action) {
        try {
            final Future<T> result = action.get();
            return result != null ? result : Future.failedFuture(new IllegalStateException("Action returned null"));
        } catch (Throwable e) {
            return Future.failedFuture(e);
        }
    }

    private <T> void completeWithActionResult(Promise<T> promise, long timeoutTimerId, AsyncResult<T> result) {
        vertx.cancelTimer(timeoutTimerId);

        if (!promise.future().isComplete()) {
            promise.handle(result);
        }
    }
}
