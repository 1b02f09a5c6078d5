package org.adseller.server.metric;

import io.micrometer.core.instrument.MeterRegistry;
import org.adseller.server.proposal.model.ProposalStatus;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Defines interface for submitting deal evaluation metrics.
 */
public class Metrics {

    private final MeterRegistry meterRegistry;

    public Metrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry);
    }

    public void updateProposalReceivedMetric() {
        incCounter(MetricName.proposals_received);
    }

    public void updateProposalStatusMetric(ProposalStatus status) {
        switch (status) {
            case FAILED -> incCounter(MetricName.proposals_failed);
            case ACCEPTED -> incCounter(MetricName.proposals_accepted);
            case COUNTER_PENDING -> incCounter(MetricName.proposals_countered);
            case REJECTED -> incCounter(MetricName.proposals_rejected);
            // intermediate statuses are not reported
            default -> {
            }
        }
    }

    public void updateFallbackMetric(MetricName metricName) {
        incCounter(metricName);
    }

    public void updateEvaluationTimeMetric(long millis) {
        meterRegistry.timer(MetricName.proposal_evaluation_time.toString()).record(millis, TimeUnit.MILLISECONDS);
    }

    public void updateDealCreatedMetric(String dealType) {
        meterRegistry.counter(MetricName.deals_created.toString(), "deal_type", dealType).increment();
    }

    private void incCounter(MetricName metricName) {
        meterRegistry.counter(metricName.toString()).increment();
    }
}
