package org.adseller.server.storage;

import io.vertx.core.Future;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryEvaluationStore implements EvaluationStore {

    private final Map<String, List<StoredRecord>> records = new ConcurrentHashMap<>();

    @Override
    public Future<Void> save(StoredRecord record) {
        records.computeIfAbsent(record.getKey(), key -> new CopyOnWriteArrayList<>()).add(record);
        return Future.succeededFuture();
    }

    @Override
    public Future<List<StoredRecord>> history(String key) {
        final List<StoredRecord> keyRecords = records.get(key);
        return Future.succeededFuture(keyRecords != null ? List.copyOf(keyRecords) : Collections.emptyList());
    }
}
