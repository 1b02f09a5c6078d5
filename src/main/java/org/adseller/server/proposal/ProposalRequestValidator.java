package org.adseller.server.proposal;

import org.adseller.server.proposal.model.ProposalRequest;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks proposal input. Missing required fields are fatal, inconsistent values are reported for the
 * evaluation to record.
 */
public class ProposalRequestValidator {

    private static final String PRODUCT_ID = "product_id";
    private static final String IMPRESSIONS = "impressions";
    private static final String START_DATE = "start_date";
    private static final String END_DATE = "end_date";

    public List<String> missingRequiredFields(ProposalRequest request) {
        final List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(request.getProductId())) {
            missing.add(PRODUCT_ID);
        }
        if (request.getImpressions() == null) {
            missing.add(IMPRESSIONS);
        }
        if (request.getStartDate() == null) {
            missing.add(START_DATE);
        }
        if (request.getEndDate() == null) {
            missing.add(END_DATE);
        }

        return missing.isEmpty()
                ? Collections.emptyList()
                : Collections.singletonList("Missing required fields: " + missing);
    }

    /**
     * Returns problems with fields that are present but unusable. Expects required fields to be present.
     */
    public List<String> inconsistentFields(ProposalRequest request) {
        final List<String> errors = new ArrayList<>();
        if (request.getImpressions() <= 0) {
            errors.add("Requested impressions must be positive, but was " + request.getImpressions());
        }
        if (request.getEndDate().isBefore(request.getStartDate())) {
            errors.add("Flight end date %s is before start date %s"
                    .formatted(request.getEndDate(), request.getStartDate()));
        }
        if (request.getPrice() != null && request.getPrice().signum() < 0) {
            errors.add("Requested price must not be negative, but was " + request.getPrice());
        }
        return errors;
    }
}
