package org.adseller.server.buyer;

import java.util.Objects;
import java.util.Optional;

/**
 * Buyer on whose behalf a proposal is evaluated: either an unauthenticated caller, whose claimed identity never
 * unlocks a tier, or an authenticated one.
 */
public sealed interface BuyerContext permits BuyerContext.Anonymous, BuyerContext.Authenticated {

    static BuyerContext anonymous() {
        return new Anonymous(BuyerIdentity.empty());
    }

    static BuyerContext anonymous(BuyerIdentity claimedIdentity) {
        return new Anonymous(claimedIdentity);
    }

    static BuyerContext authenticated(BuyerIdentity identity) {
        return new Authenticated(identity, null, null);
    }

    static BuyerContext authenticated(BuyerIdentity identity, BuyerRelationship relationship) {
        return new Authenticated(identity, relationship, null);
    }

    Optional<BuyerRelationship> relationship();

    record Anonymous(BuyerIdentity claimedIdentity) implements BuyerContext {

        public Anonymous {
            claimedIdentity = claimedIdentity != null ? claimedIdentity : BuyerIdentity.empty();
        }

        @Override
        public Optional<BuyerRelationship> relationship() {
            return Optional.empty();
        }
    }

    record Authenticated(BuyerIdentity identity,
                         BuyerRelationship buyerRelationship,
                         String authenticationMethod) implements BuyerContext {

        public Authenticated {
            Objects.requireNonNull(identity);
        }

        @Override
        public Optional<BuyerRelationship> relationship() {
            return Optional.ofNullable(buyerRelationship);
        }
    }
}
