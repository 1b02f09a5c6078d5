package org.adseller.server.pricing.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class PriceAcceptance {

    boolean acceptable;

    String reason;

    public static PriceAcceptance accepted() {
        return of(true, "Price acceptable");
    }

    public static PriceAcceptance rejected(String reason) {
        return of(false, reason);
    }
}
