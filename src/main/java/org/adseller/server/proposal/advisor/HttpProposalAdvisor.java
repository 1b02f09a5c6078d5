package org.adseller.server.proposal.advisor;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpHeaders;
import org.adseller.server.exception.SellerException;
import org.adseller.server.execution.Timeout;
import org.adseller.server.json.DecodeException;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.log.Logger;
import org.adseller.server.log.LoggerFactory;
import org.adseller.server.proposal.model.ProposalEvaluation;
import org.adseller.server.proposal.model.ProposalRequest;
import org.adseller.server.vertx.httpclient.HttpClient;
import org.adseller.server.vertx.httpclient.model.HttpClientResponse;
import org.adseller.server.yield.model.Recommendation;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Objects;

/**
 * Delegates the decision to a remote advisory agent. Its answer is either an explicit recommendation or free
 * text that is searched for "accept", then "counter"; anything else is a rejection.
 */
public class HttpProposalAdvisor implements ProposalAdvisor {

    private static final Logger logger = LoggerFactory.getLogger(HttpProposalAdvisor.class);

    public static final String NAME = "advisory_agent";

    private final String endpoint;
    private final HttpClient httpClient;
    private final JacksonMapper mapper;

    public HttpProposalAdvisor(String endpoint, HttpClient httpClient, JacksonMapper mapper) {
        this.endpoint = Objects.requireNonNull(endpoint);
        this.httpClient = Objects.requireNonNull(httpClient);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @Override
    public Future<Recommendation> advise(ProposalRequest request, ProposalEvaluation evaluation, Timeout timeout) {
        final AdvisoryRequest advisoryRequest = AdvisoryRequest.of(
                request.getProposalId(),
                request.getDealType(),
                request.getStartDate(),
                request.getEndDate(),
                evaluation);

        final MultiMap headers = MultiMap.caseInsensitiveMultiMap()
                .add(HttpHeaders.CONTENT_TYPE, "application/json")
                .add(HttpHeaders.ACCEPT, "application/json");

        return httpClient.post(endpoint, headers, mapper.encodeToString(advisoryRequest), timeout.remaining())
                .map(this::processResponse);
    }

    private Recommendation processResponse(HttpClientResponse response) {
        final int statusCode = response.getStatusCode();
        if (statusCode != HttpResponseStatus.OK.code()) {
            throw new SellerException("Advisory agent responded with status code " + statusCode);
        }

        final AdvisoryResponse advisoryResponse;
        try {
            advisoryResponse = mapper.decodeValue(response.getBody(), AdvisoryResponse.class);
        } catch (DecodeException e) {
            throw new SellerException("Cannot parse advisory agent response: " + e.getMessage(), e);
        }

        if (advisoryResponse == null) {
            throw new SellerException("Advisory agent returned empty response");
        }

        final Recommendation recommendation = StringUtils.isNotBlank(advisoryResponse.getRecommendation())
                ? parseRecommendation(advisoryResponse.getRecommendation())
                : parseRecommendation(advisoryResponse.getReasoning());

        logger.debug("Advisory agent recommended {0}", recommendation);
        return recommendation;
    }

    static Recommendation parseRecommendation(String text) {
        final String normalized = StringUtils.defaultString(text).toLowerCase(Locale.ROOT);
        if (normalized.contains("accept")) {
            return Recommendation.ACCEPT;
        } else if (normalized.contains("counter")) {
            return Recommendation.COUNTER;
        }
        return Recommendation.REJECT;
    }

    @Override
    public String name() {
        return NAME;
    }
}
