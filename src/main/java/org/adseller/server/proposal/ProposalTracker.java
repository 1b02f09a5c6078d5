package org.adseller.server.proposal;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps ids of proposals by their latest decision.
 */
public class ProposalTracker {

    private final List<String> acceptedProposals = new CopyOnWriteArrayList<>();
    private final List<String> rejectedProposals = new CopyOnWriteArrayList<>();
    private final List<String> counteredProposals = new CopyOnWriteArrayList<>();

    public void accepted(String proposalId) {
        acceptedProposals.add(proposalId);
    }

    public void rejected(String proposalId) {
        rejectedProposals.add(proposalId);
    }

    public void countered(String proposalId) {
        counteredProposals.add(proposalId);
    }

    public List<String> getAcceptedProposals() {
        return List.copyOf(acceptedProposals);
    }

    public List<String> getRejectedProposals() {
        return List.copyOf(rejectedProposals);
    }

    public List<String> getCounteredProposals() {
        return List.copyOf(counteredProposals);
    }
}
