package org.adseller.server.spring.config;

import org.adseller.server.audience.AudienceValidator;
import org.adseller.server.audience.CoverageCalculator;
import org.adseller.server.audience.EmbeddingService;
import org.adseller.server.audience.HttpEmbeddingService;
import org.adseller.server.audience.SimilarityCalculator;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.vertx.httpclient.HttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AudienceConfiguration {

    @Bean
    SimilarityCalculator similarityCalculator() {
        return new SimilarityCalculator();
    }

    @Bean
    AudienceValidator audienceValidator(
            SimilarityCalculator similarityCalculator,
            @Value("${audience.minimum-coverage-threshold:50}") double minimumCoverageThreshold,
            Clock clock) {

        return new AudienceValidator(similarityCalculator, minimumCoverageThreshold, clock);
    }

    @Bean
    CoverageCalculator coverageCalculator() {
        return new CoverageCalculator();
    }

    @Bean
    @ConditionalOnProperty(prefix = "embedding.http", name = "enabled", havingValue = "true")
    EmbeddingService httpEmbeddingService(@Value("${embedding.http.endpoint}") String endpoint,
                                          HttpClient httpClient,
                                          JacksonMapper mapper) {

        return new HttpEmbeddingService(endpoint, httpClient, mapper);
    }
}
