package org.adseller.server.deal.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Deal object as it appears in an OpenRTB 2.5 bid request {@code imp.pmp.deals}.
 */
@Value
@Builder
public class OpenRtbDealParams {

    public static final int FIRST_PRICE_AUCTION = 1;
    public static final int FIXED_PRICE = 3;

    String id;

    BigDecimal bidfloor;

    String bidfloorcur;

    Integer at;

    @Builder.Default
    List<String> wseat = Collections.emptyList();

    @Builder.Default
    List<String> wadomain = Collections.emptyList();

    ExtDeal ext;

    @Value(staticConstructor = "of")
    public static class ExtDeal {

        Boolean guaranteed;

        Long impressions;
    }
}
