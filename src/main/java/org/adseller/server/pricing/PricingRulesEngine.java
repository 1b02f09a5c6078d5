package org.adseller.server.pricing;

import org.adseller.server.buyer.BuyerContext;
import org.adseller.server.buyer.BuyerIdentity;
import org.adseller.server.buyer.BuyerTierResolver;
import org.adseller.server.buyer.TierResolution;
import org.adseller.server.deal.model.DealType;
import org.adseller.server.pricing.model.DiscountType;
import org.adseller.server.pricing.model.PriceAcceptance;
import org.adseller.server.pricing.model.PriceDisplay;
import org.adseller.server.pricing.model.PricingDecision;
import org.adseller.server.pricing.model.PricingRule;
import org.adseller.server.pricing.model.PricingTier;
import org.adseller.server.pricing.model.RuleMatchContext;
import org.adseller.server.pricing.model.TieredPricingConfig;
import org.adseller.server.pricing.model.VolumeDiscount;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Calculates tier-aware CPM prices. Every input produces a decision; the global floor and ceiling are
 * applied last and always win.
 */
public class PricingRulesEngine {

    private static final String PRICING_MODEL = "cpm";
    private static final int PRICE_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal DEFAULT_NEGOTIATION_DISCOUNT = new BigDecimal("0.10");

    private static final Map<Long, BigDecimal> DEFAULT_VOLUME_BREAKPOINTS;

    static {
        final Map<Long, BigDecimal> breakpoints = new TreeMap<>();
        breakpoints.put(5_000_000L, new BigDecimal("0.05"));
        breakpoints.put(10_000_000L, new BigDecimal("0.10"));
        breakpoints.put(20_000_000L, new BigDecimal("0.15"));
        breakpoints.put(50_000_000L, new BigDecimal("0.20"));
        DEFAULT_VOLUME_BREAKPOINTS = Collections.unmodifiableMap(breakpoints);
    }

    private final TieredPricingConfig config;
    private final BuyerTierResolver tierResolver;
    private final Clock clock;

    public PricingRulesEngine(TieredPricingConfig config, BuyerTierResolver tierResolver, Clock clock) {
        this.config = Objects.requireNonNull(config);
        this.tierResolver = Objects.requireNonNull(tierResolver);
        this.clock = Objects.requireNonNull(clock);
    }

    public TieredPricingConfig getConfig() {
        return config;
    }

    public PricingDecision calculatePrice(String productId,
                                          BigDecimal basePrice,
                                          BuyerContext buyerContext,
                                          DealType dealType,
                                          long volume,
                                          String inventoryType) {

        final BigDecimal base = basePrice != null ? basePrice : BigDecimal.ZERO;
        final TierResolution resolution = tierResolver.resolve(buyerContext);
        final PricingTier tierConfig = config.tierConfig(resolution.getTier());
        final List<String> trail = new ArrayList<>();

        BigDecimal price = base;

        final BigDecimal tierDiscount = nonNegative(tierConfig.getTierDiscount());
        if (tierDiscount.signum() > 0) {
            price = discount(price, tierDiscount);
            trail.add("Tier discount: -%s%%".formatted(percent(tierDiscount)));
        }

        final List<PricingRule> rules = config.findMatchingRules(
                matchContext(resolution, productId, inventoryType), today());

        BigDecimal ruleDiscount = BigDecimal.ZERO;
        final PricingRule overrideRule = rules.stream()
                .filter(rule -> rule.getBasePriceOverride() != null)
                .findFirst()
                .orElse(null);

        if (overrideRule != null) {
            price = overrideRule.getBasePriceOverride();
            trail.add("Rule '%s': Price override %s".formatted(overrideRule.getRuleName(), money(price)));
        } else {
            final PricingRule discountRule = largestDiscountRule(rules);
            if (discountRule != null) {
                ruleDiscount = discountRule.getDiscountPercentage();
                price = discount(price, ruleDiscount);
                trail.add("Rule '%s': Discount -%s%%".formatted(discountRule.getRuleName(), percent(ruleDiscount)));
            }
        }

        final boolean ruleApplied = overrideRule != null || ruleDiscount.signum() > 0;

        BigDecimal volumeDiscount = BigDecimal.ZERO;
        if (tierConfig.isVolumeDiscountsEnabled() && volume > 0) {
            volumeDiscount = volumeDiscount(rules, volume, price);
            if (volumeDiscount.signum() > 0) {
                price = discount(price, volumeDiscount);
                trail.add("Volume discount: -%s%%".formatted(percent(volumeDiscount)));
            }
        }

        final BigDecimal finalPrice = enforceBounds(price, trail);

        return PricingDecision.builder()
                .productId(productId)
                .dealType(dealType)
                .buyerTier(resolution.getTier())
                .pricingKey(resolution.getPricingKey())
                .basePrice(base)
                .tierDiscount(tierDiscount)
                .ruleDiscount(ruleDiscount)
                .volumeDiscount(volumeDiscount)
                .finalPrice(finalPrice)
                .currency(config.getDefaultCurrency())
                .pricingModel(PRICING_MODEL)
                .rationale(rationale(base, finalPrice, tierConfig, tierDiscount, ruleApplied, volumeDiscount))
                .appliedRules(Collections.unmodifiableList(trail))
                .build();
    }

    public PriceDisplay getPriceDisplay(BigDecimal basePrice, BuyerContext buyerContext) {
        final BigDecimal base = basePrice != null ? basePrice : BigDecimal.ZERO;
        final TierResolution resolution = tierResolver.resolve(buyerContext);
        final PricingTier tierConfig = config.tierConfig(resolution.getTier());
        final String currency = config.getDefaultCurrency();

        if (tierConfig.isShowExactPrice()) {
            final BigDecimal price = discount(base, nonNegative(tierConfig.getTierDiscount()))
                    .setScale(PRICE_SCALE, RoundingMode.HALF_UP);

            return PriceDisplay.builder()
                    .tier(resolution.getTier())
                    .exact(true)
                    .price(price)
                    .currency(currency)
                    .negotiable(tierConfig.isNegotiationEnabled())
                    .display(money(price) + " CPM")
                    .build();
        }

        final BigDecimal variance = nonNegative(tierConfig.getPriceRangeVariance());
        final BigDecimal low = base.multiply(BigDecimal.ONE.subtract(variance)).setScale(0, RoundingMode.HALF_EVEN);
        final BigDecimal high = base.multiply(BigDecimal.ONE.add(variance)).setScale(0, RoundingMode.HALF_EVEN);

        return PriceDisplay.builder()
                .tier(resolution.getTier())
                .exact(false)
                .priceLow(low)
                .priceHigh(high)
                .currency(currency)
                .negotiable(false)
                .display("$%s-$%s CPM".formatted(low.toPlainString(), high.toPlainString()))
                .build();
    }

    public PriceAcceptance isPriceAcceptable(BigDecimal offeredPrice, BigDecimal productFloor,
                                             BuyerContext buyerContext) {

        final BigDecimal offered = offeredPrice != null ? offeredPrice : BigDecimal.ZERO;

        if (offered.compareTo(config.getGlobalFloorCpm()) < 0) {
            return PriceAcceptance.rejected("Below global floor (%s CPM)".formatted(money(config.getGlobalFloorCpm())));
        }

        if (productFloor == null) {
            return PriceAcceptance.accepted();
        }

        if (offered.compareTo(productFloor) < 0) {
            return PriceAcceptance.rejected("Below product floor (%s CPM)".formatted(money(productFloor)));
        }

        final TierResolution resolution = tierResolver.resolve(buyerContext);
        if (config.tierConfig(resolution.getTier()).isNegotiationEnabled()) {
            final BigDecimal minAcceptable = discount(productFloor, maxNegotiationDiscount(resolution));
            if (offered.compareTo(minAcceptable) < 0) {
                return PriceAcceptance.rejected("Below negotiation floor (%s CPM)".formatted(money(minAcceptable)));
            }
        }

        return PriceAcceptance.accepted();
    }

    private BigDecimal maxNegotiationDiscount(TierResolution resolution) {
        return config.findMatchingRules(matchContext(resolution, null, null), today()).stream()
                .filter(PricingRule::isNegotiationEnabled)
                .map(PricingRule::getMaxNegotiationDiscount)
                .filter(Objects::nonNull)
                .max(BigDecimal::compareTo)
                .orElse(DEFAULT_NEGOTIATION_DISCOUNT);
    }

    private RuleMatchContext matchContext(TierResolution resolution, String productId, String inventoryType) {
        final BuyerIdentity identity = resolution.getMatchableIdentity();
        final boolean consistentAdvertiser = config.isAdvertiserPricingConsistent()
                && StringUtils.isNotEmpty(identity.getAdvertiserId());

        return RuleMatchContext.builder()
                .tier(resolution.getTier())
                .agencyId(consistentAdvertiser ? null : identity.getAgencyId())
                .advertiserId(identity.getAdvertiserId())
                .holdingCompany(consistentAdvertiser ? null : identity.getAgencyHoldingCompany())
                .productId(productId)
                .inventoryType(inventoryType)
                .build();
    }

    private static PricingRule largestDiscountRule(List<PricingRule> rules) {
        PricingRule result = null;
        for (PricingRule rule : rules) {
            final BigDecimal ruleDiscount = rule.getDiscountPercentage();
            if (ruleDiscount != null && ruleDiscount.signum() > 0
                    && (result == null || ruleDiscount.compareTo(result.getDiscountPercentage()) > 0)) {
                result = rule;
            }
        }
        return result;
    }

    private static BigDecimal volumeDiscount(List<PricingRule> rules, long volume, BigDecimal price) {
        final List<VolumeDiscount> ladder = rules.stream()
                .flatMap(rule -> rule.getVolumeDiscounts().stream())
                .toList();

        if (ladder.isEmpty()) {
            return defaultVolumeDiscount(volume);
        }

        return ladder.stream()
                .filter(rung -> rung.appliesTo(volume))
                .map(rung -> discountFraction(rung, price))
                .max(BigDecimal::compareTo)
                .orElse(BigDecimal.ZERO);
    }

    private static BigDecimal defaultVolumeDiscount(long volume) {
        BigDecimal result = BigDecimal.ZERO;
        for (Map.Entry<Long, BigDecimal> breakpoint : DEFAULT_VOLUME_BREAKPOINTS.entrySet()) {
            if (volume >= breakpoint.getKey()) {
                result = breakpoint.getValue();
            }
        }
        return result;
    }

    /**
     * Expresses a rung as a fraction of the current price so that rungs of different types are comparable.
     */
    private static BigDecimal discountFraction(VolumeDiscount rung, BigDecimal price) {
        final BigDecimal value = rung.getDiscountValue() != null ? rung.getDiscountValue() : BigDecimal.ZERO;
        final DiscountType type = rung.getDiscountType() != null ? rung.getDiscountType() : DiscountType.PERCENTAGE;
        if (type == DiscountType.PERCENTAGE) {
            return value;
        }
        if (price.signum() <= 0) {
            return BigDecimal.ZERO;
        }

        final BigDecimal fraction = switch (type) {
            case FIXED_AMOUNT -> value.divide(price, 6, RoundingMode.HALF_UP);
            case FIXED_PRICE -> BigDecimal.ONE.subtract(value.divide(price, 6, RoundingMode.HALF_UP));
            default -> BigDecimal.ZERO;
        };
        return fraction.max(BigDecimal.ZERO).min(BigDecimal.ONE);
    }

    private BigDecimal enforceBounds(BigDecimal price, List<String> trail) {
        final BigDecimal floor = config.getGlobalFloorCpm();
        final BigDecimal ceiling = config.getGlobalCeilingCpm();

        BigDecimal bounded = price;
        if (bounded.compareTo(floor) < 0) {
            bounded = floor;
            trail.add("Floor enforced: " + money(floor));
        } else if (ceiling != null && bounded.compareTo(ceiling) > 0) {
            bounded = ceiling;
            trail.add("Ceiling enforced: " + money(ceiling));
        }

        // rounding must not step outside of bounds
        BigDecimal rounded = bounded.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        if (rounded.compareTo(floor) < 0) {
            rounded = floor.setScale(PRICE_SCALE, RoundingMode.CEILING);
        } else if (ceiling != null && rounded.compareTo(ceiling) > 0) {
            rounded = ceiling.setScale(PRICE_SCALE, RoundingMode.FLOOR);
        }
        return rounded;
    }

    private static String rationale(BigDecimal basePrice,
                                    BigDecimal finalPrice,
                                    PricingTier tierConfig,
                                    BigDecimal tierDiscount,
                                    boolean ruleApplied,
                                    BigDecimal volumeDiscount) {

        final List<String> parts = new ArrayList<>();
        parts.add("Base price: %s CPM".formatted(money(basePrice)));

        if (tierDiscount.signum() > 0) {
            parts.add("%s tier: -%s%%".formatted(
                    StringUtils.defaultIfEmpty(tierConfig.getTierName(), String.valueOf(tierConfig.getTier())),
                    percent(tierDiscount)));
        }
        if (ruleApplied) {
            parts.add("Custom rule");
        }
        if (volumeDiscount.signum() > 0) {
            parts.add("Volume discount");
        }

        parts.add("Final price: %s CPM".formatted(money(finalPrice)));

        if (basePrice.signum() > 0 && finalPrice.compareTo(basePrice) < 0) {
            final BigDecimal savings = basePrice.subtract(finalPrice)
                    .multiply(HUNDRED)
                    .divide(basePrice, 1, RoundingMode.HALF_UP);
            parts.add("(Total savings: %s%%)".formatted(savings.toPlainString()));
        }

        return String.join(" | ", parts);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static BigDecimal discount(BigDecimal price, BigDecimal fraction) {
        return price.multiply(BigDecimal.ONE.subtract(fraction));
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : BigDecimal.ZERO;
    }

    private static String percent(BigDecimal fraction) {
        return fraction.multiply(HUNDRED).stripTrailingZeros().toPlainString();
    }

    private static String money(BigDecimal value) {
        return "$" + value.setScale(PRICE_SCALE, RoundingMode.HALF_UP).toPlainString();
    }
}
