package org.adseller.server.buyer;

import lombok.Value;

@Value(staticConstructor = "of")
public class TierResolution {

    private static final TierResolution PUBLIC = TierResolution.of(AccessTier.PUBLIC, "public", BuyerIdentity.empty());

    AccessTier tier;

    String pricingKey;

    /**
     * Identity attributes rules may match on. Empty for unauthenticated buyers.
     */
    BuyerIdentity matchableIdentity;

    public static TierResolution publicTier() {
        return PUBLIC;
    }
}
