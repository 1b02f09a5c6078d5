package org.adseller.server.deal.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class DealCreationResult {

    DealOutput deal;

    OpenRtbDealParams openrtbParams;
}
