package org.adseller.server.deal;

import org.adseller.server.deal.model.ActivationType;
import org.adseller.server.deal.model.DealCreationResult;
import org.adseller.server.deal.model.DealOutput;
import org.adseller.server.deal.model.DealType;
import org.adseller.server.deal.model.OpenRtbDealParams;
import org.adseller.server.identity.IdGenerator;
import org.adseller.server.proposal.model.ProposalRequest;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns agreed proposal terms into a deal record and its OpenRTB representation.
 */
public class DealRecordBuilder {

    private static final String DEFAULT_SELLER_PREFIX = "SELL";
    private static final int SELLER_PREFIX_LENGTH = 4;
    private static final int DEAL_SUFFIX_LENGTH = 12;

    private final IdGenerator idGenerator;
    private final Clock clock;
    private final String sellerOrganizationId;
    private final String currency;

    public DealRecordBuilder(IdGenerator idGenerator, Clock clock, String sellerOrganizationId, String currency) {
        this.idGenerator = Objects.requireNonNull(idGenerator);
        this.clock = Objects.requireNonNull(clock);
        this.sellerOrganizationId = StringUtils.defaultString(sellerOrganizationId);
        this.currency = Objects.requireNonNull(currency);
    }

    /**
     * Builds the deal for the given price and volume. Unknown or missing deal types become preferred deals.
     */
    public DealCreationResult build(ProposalRequest request,
                                    BigDecimal price,
                                    Long impressions,
                                    ActivationType activationType) {

        final DealType dealType = ObjectUtils.defaultIfNull(DealType.fromString(request.getDealType()),
                DealType.PREFERRED_DEAL);
        final BigDecimal dealPrice = ObjectUtils.defaultIfNull(price, BigDecimal.ZERO);
        final String dealId = generateDealId();

        final DealOutput.DealOutputBuilder deal = DealOutput.builder()
                .dealId(dealId)
                .dealType(dealType)
                .proposalId(request.getProposalId())
                .productId(request.getProductId())
                .price(dealPrice)
                .currency(currency)
                .openrtbDealId(dealId)
                .createdAt(clock.instant())
                .buyerOrganizationId(request.getBuyerOrganizationId())
                .sellerOrganizationId(sellerOrganizationId)
                .flightStart(request.getStartDate())
                .flightEnd(request.getEndDate())
                .activationType(ObjectUtils.defaultIfNull(activationType, ActivationType.TRADITIONAL_DSP));

        if (dealType == DealType.PROGRAMMATIC_GUARANTEED) {
            deal.guaranteedImpressions(impressions);
        } else {
            deal.floorPrice(dealPrice);
        }

        final DealOutput dealOutput = deal.build();
        return DealCreationResult.of(dealOutput, openRtbParams(dealOutput));
    }

    private String generateDealId() {
        final String prefix = StringUtils.isNotEmpty(sellerOrganizationId)
                ? StringUtils.left(sellerOrganizationId, SELLER_PREFIX_LENGTH)
                : DEFAULT_SELLER_PREFIX;
        final String suffix = StringUtils.left(idGenerator.generateId(), DEAL_SUFFIX_LENGTH).toUpperCase(Locale.ROOT);
        return prefix + "-" + suffix;
    }

    private static OpenRtbDealParams openRtbParams(DealOutput deal) {
        final boolean guaranteed = deal.getDealType() == DealType.PROGRAMMATIC_GUARANTEED;

        return OpenRtbDealParams.builder()
                .id(deal.getDealId())
                .bidfloor(ObjectUtils.defaultIfNull(deal.getFloorPrice(), deal.getPrice()))
                .bidfloorcur(deal.getCurrency())
                .at(deal.getDealType() == DealType.PRIVATE_AUCTION
                        ? OpenRtbDealParams.FIRST_PRICE_AUCTION
                        : OpenRtbDealParams.FIXED_PRICE)
                .ext(guaranteed ? OpenRtbDealParams.ExtDeal.of(true, deal.getGuaranteedImpressions()) : null)
                .build();
    }
}
