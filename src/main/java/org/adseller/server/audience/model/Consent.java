package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.collections4.CollectionUtils;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Consent {

    @Builder.Default
    String framework = "IAB-TCFv2";

    String consentString;

    List<String> permissibleUses;

    @Builder.Default
    long ttlSeconds = 86400;

    String vendorId;

    public boolean hasPermissibleUse() {
        return CollectionUtils.isNotEmpty(permissibleUses);
    }
}
