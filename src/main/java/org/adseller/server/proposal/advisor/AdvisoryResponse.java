package org.adseller.server.proposal.advisor;

import lombok.Value;

@Value(staticConstructor = "of")
public class AdvisoryResponse {

    String recommendation;

    /**
     * Free text answer, inspected when no explicit recommendation is given.
     */
    String reasoning;
}
