package org.adseller.server.identity;

import java.util.UUID;

/**
 * Returns ID as {@link UUID} hex digits without dashes.
 */
public class UUIDIdGenerator implements IdGenerator {

    @Override
    public String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
