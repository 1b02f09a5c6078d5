package org.adseller.server.spring.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.SignalType;
import org.adseller.server.availability.AvailabilitySource;
import org.adseller.server.availability.ConfiguredAvailabilitySource;
import org.adseller.server.catalog.InMemoryProductCatalog;
import org.adseller.server.catalog.ProductCatalog;
import org.adseller.server.catalog.model.ProductDefinition;
import org.adseller.server.deal.model.DealType;
import org.adseller.server.exception.InvalidConfigurationException;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Configuration
public class CatalogConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "catalog")
    CatalogProperties catalogProperties() {
        return new CatalogProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "availability")
    AvailabilityProperties availabilityProperties() {
        return new AvailabilityProperties();
    }

    @Bean
    ProductCatalog productCatalog(CatalogProperties catalogProperties) {
        return new InMemoryProductCatalog(catalogProperties.toProductDefinitions());
    }

    @Bean
    AvailabilitySource availabilitySource(AvailabilityProperties availabilityProperties) {
        return new ConfiguredAvailabilitySource(
                availabilityProperties.getDefaultImpressions(),
                MapUtils.emptyIfNull(availabilityProperties.getProducts()));
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class CatalogProperties {

        @Valid
        private List<ProductProperties> products;

        List<ProductDefinition> toProductDefinitions() {
            return ListUtils.emptyIfNull(products).stream()
                    .map(ProductProperties::toProductDefinition)
                    .toList();
        }
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class ProductProperties {

        @NotBlank
        private String productId;

        private String name;

        private String description;

        private String inventoryType;

        @NotNull
        @PositiveOrZero
        private BigDecimal baseCpm;

        @NotNull
        @PositiveOrZero
        private BigDecimal floorCpm;

        private String currency = "USD";

        private List<String> supportedDealTypes;

        private long minimumImpressions = 10_000L;

        private Long maximumImpressions;

        private Map<String, Object> audienceTargeting;

        private Map<String, Object> contentTargeting;

        @Valid
        private List<CapabilityProperties> audienceCapabilities;

        ProductDefinition toProductDefinition() {
            final ProductDefinition.ProductDefinitionBuilder builder = ProductDefinition.builder()
                    .productId(productId)
                    .name(name)
                    .description(description)
                    .inventoryType(inventoryType)
                    .baseCpm(baseCpm)
                    .floorCpm(floorCpm)
                    .currency(currency)
                    .minimumImpressions(minimumImpressions)
                    .maximumImpressions(maximumImpressions)
                    .audienceTargeting(audienceTargeting)
                    .contentTargeting(contentTargeting)
                    .audienceCapabilities(ListUtils.emptyIfNull(audienceCapabilities).stream()
                            .map(CapabilityProperties::toAudienceCapability)
                            .toList());

            if (CollectionUtils.isNotEmpty(supportedDealTypes)) {
                builder.supportedDealTypes(supportedDealTypes.stream().map(this::toDealType).toList());
            }

            return builder.build();
        }

        private DealType toDealType(String value) {
            final DealType dealType = DealType.fromString(value);
            if (dealType == null) {
                throw new InvalidConfigurationException(
                        "Product %s declares unknown deal type %s".formatted(productId, value));
            }
            return dealType;
        }
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class CapabilityProperties {

        @NotBlank
        private String capabilityId;

        private String name;

        private String description;

        @NotNull
        private SignalType signalType;

        private double coveragePercentage;

        private List<String> availableSegments;

        private String taxonomy;

        private boolean ucpCompatible = true;

        private Integer embeddingDimension;

        AudienceCapability toAudienceCapability() {
            return AudienceCapability.builder()
                    .capabilityId(capabilityId)
                    .name(name)
                    .description(description)
                    .signalType(signalType)
                    .coveragePercentage(coveragePercentage)
                    .availableSegments(ListUtils.emptyIfNull(availableSegments))
                    .taxonomy(taxonomy)
                    .ucpCompatible(ucpCompatible)
                    .embeddingDimension(embeddingDimension)
                    .build();
        }
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class AvailabilityProperties {

        @PositiveOrZero
        private long defaultImpressions = 1_000_000L;

        private Map<String, Long> products;
    }
}
