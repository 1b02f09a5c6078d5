package org.adseller.server.catalog;

import org.adseller.server.catalog.model.ProductDefinition;

import java.util.Collection;
import java.util.Optional;

public interface ProductCatalog {

    Optional<ProductDefinition> getProduct(String productId);

    Collection<ProductDefinition> getProducts();
}
