package org.adseller.server.spring.config;

import org.adseller.server.proposal.ProposalEvaluationSettings;
import org.adseller.server.yield.model.YieldWeights;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ProposalConfigurationTest {

    @Test
    public void toYieldWeightsShouldMatchDefaultWeights() {
        // when and then
        assertThat(new ProposalConfiguration.YieldProperties().toYieldWeights())
                .isEqualTo(YieldWeights.defaultWeights());
    }

    @Test
    public void toSettingsShouldCarryTimeoutsAndMarketInputs() {
        // given
        final ProposalConfiguration.YieldProperties yieldProperties = new ProposalConfiguration.YieldProperties();
        yieldProperties.setCurrentFillRate(0.6);
        yieldProperties.setMarketCpm(Map.of("Video", BigDecimal.valueOf(25)));

        final ProposalConfiguration.ProposalProperties proposalProperties =
                new ProposalConfiguration.ProposalProperties();
        proposalProperties.setAdvisorTimeoutMs(300L);

        // when
        final ProposalEvaluationSettings result = proposalProperties.toSettings(yieldProperties);

        // then
        assertThat(result.getAdvisorTimeoutMs()).isEqualTo(300L);
        assertThat(result.getEvaluationTimeoutMs()).isEqualTo(5000L);
        assertThat(result.getCurrentFillRate()).isEqualTo(0.6);
        assertThat(result.marketCpm("video")).isEqualByComparingTo("25");
        assertThat(result.marketCpm("VIDEO")).isEqualByComparingTo("25");
        assertThat(result.marketCpm("display")).isEqualByComparingTo("15");
        assertThat(result.marketCpm(null)).isEqualByComparingTo("15");
    }
}
