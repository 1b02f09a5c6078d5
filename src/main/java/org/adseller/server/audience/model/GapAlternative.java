package org.adseller.server.audience.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class GapAlternative {

    String gap;

    String suggestion;
}
