package org.adseller.server.proposal;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ProposalSerializerTest {

    private final ProposalSerializer target = new ProposalSerializer();

    @Test
    public void serializeShouldDelaySecondEvaluationOfSameProposalUntilFirstCompletes() {
        // given
        final List<String> started = new ArrayList<>();
        final Promise<String> first = Promise.promise();

        // when
        final Future<String> firstResult = target.serialize("proposal-1", () -> {
            started.add("first");
            return first.future();
        });
        final Future<String> secondResult = target.serialize("proposal-1", () -> {
            started.add("second");
            return Future.succeededFuture("second");
        });

        // then
        assertThat(started).containsExactly("first");
        assertThat(secondResult.isComplete()).isFalse();

        first.complete("first");

        assertThat(firstResult.result()).isEqualTo("first");
        assertThat(started).containsExactly("first", "second");
        assertThat(secondResult.result()).isEqualTo("second");
        assertThat(target.inFlight()).isZero();
    }

    @Test
    public void serializeShouldNotDelayEvaluationsOfDifferentProposals() {
        // given
        final Promise<String> first = Promise.promise();
        target.serialize("proposal-1", first::future);

        // when
        final Future<String> result = target.serialize("proposal-2", () -> Future.succeededFuture("other"));

        // then
        assertThat(result.result()).isEqualTo("other");
        assertThat(target.inFlight()).isEqualTo(1);
    }

    @Test
    public void serializeShouldReleaseProposalWhenEvaluationFails() {
        // given
        final Future<String> failed = target.serialize("proposal-1", () -> {
            throw new IllegalStateException("boom");
        });

        // when
        final Future<String> result = target.serialize("proposal-1", () -> Future.succeededFuture("next"));

        // then
        assertThat(failed.cause()).hasMessage("boom");
        assertThat(result.result()).isEqualTo("next");
        assertThat(target.inFlight()).isZero();
    }

    @Test
    public void serializeShouldFailWhenActionReturnsNull() {
        // when
        final Future<String> result = target.serialize("proposal-1", () -> null);

        // then
        assertThat(result.cause()).isInstanceOf(IllegalStateException.class).hasMessage("Action returned null");
    }
}
