package org.adseller.server.catalog;

import org.adseller.server.catalog.model.ProductDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog built once from configuration.
 */
public class InMemoryProductCatalog implements ProductCatalog {

    private final Map<String, ProductDefinition> products;

    public InMemoryProductCatalog(List<ProductDefinition> products) {
        final Map<String, ProductDefinition> byId = new LinkedHashMap<>();
        for (ProductDefinition product : products) {
            if (byId.putIfAbsent(product.getProductId(), product) != null) {
                throw new IllegalArgumentException("Duplicated product id: " + product.getProductId());
            }
        }
        this.products = Collections.unmodifiableMap(byId);
    }

    @Override
    public Optional<ProductDefinition> getProduct(String productId) {
        return productId != null ? Optional.ofNullable(products.get(productId)) : Optional.empty();
    }

    @Override
    public Collection<ProductDefinition> getProducts() {
        return products.values();
    }
}
