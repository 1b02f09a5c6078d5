package org.adseller.server.audience;

import io.vertx.core.Future;
import org.adseller.server.audience.model.Embedding;
import org.adseller.server.catalog.model.ProductDefinition;
import org.adseller.server.execution.Timeout;

import java.util.Map;

/**
 * Source of buyer query and product inventory embeddings.
 */
public interface EmbeddingService {

    Future<Embedding> queryEmbedding(Map<String, Object> audienceTargeting, Timeout timeout);

    Future<Embedding> inventoryEmbedding(ProductDefinition product, Timeout timeout);
}
