package org.adseller.server.audience;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpHeaders;
import org.adseller.server.audience.model.Embedding;
import org.adseller.server.audience.model.EmbeddingRequest;
import org.adseller.server.audience.model.EmbeddingType;
import org.adseller.server.catalog.model.ProductDefinition;
import org.adseller.server.exception.SellerException;
import org.adseller.server.execution.Timeout;
import org.adseller.server.json.DecodeException;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.log.Logger;
import org.adseller.server.log.LoggerFactory;
import org.adseller.server.vertx.httpclient.HttpClient;
import org.adseller.server.vertx.httpclient.model.HttpClientResponse;
import org.apache.commons.collections4.CollectionUtils;

import java.util.Map;
import java.util.Objects;

/**
 * {@link EmbeddingService} fetching embeddings from a remote UCP endpoint.
 */
public class HttpEmbeddingService implements EmbeddingService {

    private static final Logger logger = LoggerFactory.getLogger(HttpEmbeddingService.class);

    public static final String UCP_CONTENT_TYPE = "application/vnd.ucp.embedding+json; v=1";

    private final String endpoint;
    private final HttpClient httpClient;
    private final JacksonMapper mapper;

    public HttpEmbeddingService(String endpoint, HttpClient httpClient, JacksonMapper mapper) {
        this.endpoint = Objects.requireNonNull(endpoint);
        this.httpClient = Objects.requireNonNull(httpClient);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @Override
    public Future<Embedding> queryEmbedding(Map<String, Object> audienceTargeting, Timeout timeout) {
        final EmbeddingRequest request = EmbeddingRequest.builder()
                .embeddingType(EmbeddingType.QUERY)
                .audienceTargeting(audienceTargeting)
                .build();

        return fetch(request, timeout);
    }

    @Override
    public Future<Embedding> inventoryEmbedding(ProductDefinition product, Timeout timeout) {
        final EmbeddingRequest request = EmbeddingRequest.builder()
                .embeddingType(EmbeddingType.INVENTORY)
                .productId(product.getProductId())
                .inventoryType(product.getInventoryType())
                .audienceTargeting(product.getAudienceTargeting())
                .contentTargeting(product.getContentTargeting())
                .build();

        return fetch(request, timeout);
    }

    private Future<Embedding> fetch(EmbeddingRequest request, Timeout timeout) {
        final MultiMap headers = MultiMap.caseInsensitiveMultiMap()
                .add(HttpHeaders.CONTENT_TYPE, UCP_CONTENT_TYPE)
                .add(HttpHeaders.ACCEPT, UCP_CONTENT_TYPE);

        return httpClient.post(endpoint, headers, mapper.encodeToString(request), timeout.remaining())
                .map(this::processResponse);
    }

    private Embedding processResponse(HttpClientResponse response) {
        final int statusCode = response.getStatusCode();
        if (statusCode != HttpResponseStatus.OK.code()) {
            throw new SellerException("Embedding service responded with status code " + statusCode);
        }

        final Embedding embedding;
        try {
            embedding = mapper.decodeValue(response.getBody(), Embedding.class);
        } catch (DecodeException e) {
            throw new SellerException("Cannot parse embedding service response: " + e.getMessage(), e);
        }

        if (embedding == null || CollectionUtils.isEmpty(embedding.getVector())) {
            throw new SellerException("Embedding service returned an embedding without vector");
        }
        if (embedding.effectiveDimension() != embedding.getVector().size()) {
            throw new SellerException("Embedding dimension %d does not match vector size %d"
                    .formatted(embedding.getDimension(), embedding.getVector().size()));
        }

        logger.debug("Received {0} embedding of dimension {1}", embedding.getEmbeddingType(),
                embedding.effectiveDimension());
        return embedding;
    }
}
