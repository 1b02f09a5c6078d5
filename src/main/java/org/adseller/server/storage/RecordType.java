package org.adseller.server.storage;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecordType {

    EVALUATION("proposal"),
    DECISION("decision"),
    DEAL("deal");

    private final String keyPrefix;

    RecordType(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String key(String id) {
        return keyPrefix + ":" + id;
    }

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
