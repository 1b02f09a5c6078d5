package org.adseller.server.identity;

/**
 * Source of unique identifiers for deal records.
 */
public interface IdGenerator {

    String generateId();
}
