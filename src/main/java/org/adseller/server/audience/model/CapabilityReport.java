package org.adseller.server.audience.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value(staticConstructor = "of")
public class CapabilityReport {

    List<AudienceCapability> capabilities;

    Map<SignalType, List<CapabilitySummary>> bySignalType;

    int totalCapabilities;

    long ucpCompatibleCount;

    @Value(staticConstructor = "of")
    public static class CapabilitySummary {

        String capabilityId;

        String name;

        double coveragePercentage;

        boolean ucpCompatible;
    }
}
