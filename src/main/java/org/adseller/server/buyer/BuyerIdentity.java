package org.adseller.server.buyer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Identity information presented by a buyer. Every field is optional.
 */
@Value
@Builder(toBuilder = true)
public class BuyerIdentity {

    private static final BuyerIdentity EMPTY = BuyerIdentity.builder().build();

    String seatId;

    String seatName;

    String dspPlatform;

    String agencyId;

    String agencyName;

    String agencyHoldingCompany;

    String advertiserId;

    String advertiserName;

    String advertiserIndustry;

    String campaignId;

    String campaignName;

    public static BuyerIdentity empty() {
        return EMPTY;
    }

    @JsonIgnore
    public IdentityLevel getIdentityLevel() {
        if (StringUtils.isNotEmpty(advertiserId) && StringUtils.isNotEmpty(agencyId)) {
            return IdentityLevel.AGENCY_AND_ADVERTISER;
        } else if (StringUtils.isNotEmpty(agencyId)) {
            return IdentityLevel.AGENCY_ONLY;
        } else if (StringUtils.isNotEmpty(seatId)) {
            return IdentityLevel.SEAT_ONLY;
        }
        return IdentityLevel.ANONYMOUS;
    }

    @JsonIgnore
    public AccessTier getAccessTier() {
        return switch (getIdentityLevel()) {
            case AGENCY_AND_ADVERTISER -> AccessTier.ADVERTISER;
            case AGENCY_ONLY -> AccessTier.AGENCY;
            case SEAT_ONLY -> AccessTier.SEAT;
            case ANONYMOUS -> AccessTier.PUBLIC;
        };
    }
}
