package org.adseller.server.storage;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of a serialized evaluation, decision or deal.
 */
@Value(staticConstructor = "of")
public class StoredRecord {

    String key;

    RecordType type;

    Map<String, Object> payload;

    Instant storedAt;
}
