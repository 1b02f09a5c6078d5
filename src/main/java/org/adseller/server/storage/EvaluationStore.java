package org.adseller.server.storage;

import io.vertx.core.Future;

import java.util.List;

/**
 * Append-only persistence of evaluation artifacts. Saving never replaces earlier records for the same key.
 */
public interface EvaluationStore {

    Future<Void> save(StoredRecord record);

    Future<List<StoredRecord>> history(String key);
}
