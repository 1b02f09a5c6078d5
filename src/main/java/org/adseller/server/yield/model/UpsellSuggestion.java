package org.adseller.server.yield.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class UpsellSuggestion {

    UpsellType type;

    String message;
}
