package org.adseller.server.proposal;

import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs evaluations of the same proposal id one after another. Evaluations of different proposals are not
 * affected.
 */
public class ProposalSerializer {

    private final Map<String, Future<Void>> tails = new ConcurrentHashMap<>();

    public <T> Future<T> serialize(String proposalId, Supplier<Future<T>> action) {
        final Promise<Void> released = Promise.promise();
        final Future<Void> releasedFuture = released.future();
        final Future<Void> previous = tails.put(proposalId, releasedFuture);
        final Future<Void> start = previous != null ? previous : Future.succeededFuture();

        return start
                .compose(ignored -> executeSafely(action))
                .onComplete(ignored -> {
                    tails.remove(proposalId, releasedFuture);
                    released.complete();
                });
    }

    int inFlight() {
        return tails.size();
    }

    private static <T> Future<T> executeSafely(Supplier<Future<T>> action) {
        try {
            final Future<T> result = action.get();
            return result != null ? result : Future.failedFuture(new IllegalStateException("Action returned null"));
        } catch (Throwable e) {
            return Future.failedFuture(e);
        }
    }
}
