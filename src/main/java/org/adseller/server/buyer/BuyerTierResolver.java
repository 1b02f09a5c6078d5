package org.adseller.server.buyer;

import org.apache.commons.lang3.StringUtils;

/**
 * Maps a {@link BuyerContext} to the access tier and the pricing key used for price-consistency grouping.
 */
public class BuyerTierResolver {

    public TierResolution resolve(BuyerContext buyerContext) {
        if (buyerContext instanceof BuyerContext.Authenticated authenticated) {
            final BuyerIdentity identity = authenticated.identity();
            return TierResolution.of(identity.getAccessTier(), pricingKey(identity), identity);
        }

        return TierResolution.publicTier();
    }

    public AccessTier resolveTier(BuyerContext buyerContext) {
        return resolve(buyerContext).getTier();
    }

    private static String pricingKey(BuyerIdentity identity) {
        if (StringUtils.isNotEmpty(identity.getAdvertiserId())) {
            return "advertiser:" + identity.getAdvertiserId();
        } else if (StringUtils.isNotEmpty(identity.getAgencyId())) {
            return "agency:" + identity.getAgencyId();
        } else if (StringUtils.isNotEmpty(identity.getSeatId())) {
            return "seat:" + identity.getSeatId();
        }
        return "public";
    }
}
