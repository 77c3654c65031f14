package com.products.lookup.catalog;

import com.products.lookup.model.Language;
import com.products.lookup.model.ProductRecord;
import com.products.lookup.model.ProductType;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogRegistryTest {

    private static CatalogClient catalog(final ProductType type) {
        return new CatalogClient() {
            @Override
            public ProductType productType() {
                return type;
            }

            @Override
            public Mono<ProductRecord> fetchProduct(final String barcode, final Language language) {
                return Mono.empty();
            }
        };
    }

    @Test
    void findsCatalogByProductType() {
        CatalogClient food = catalog(ProductType.FOOD);
        CatalogRegistry registry = new CatalogRegistry(List.of(food, catalog(ProductType.BEAUTY)));

        assertThat(registry.find(ProductType.FOOD)).containsSame(food);
        assertThat(registry.find(ProductType.GENERAL)).isEmpty();
        assertThat(registry.supportedTypes()).containsExactlyInAnyOrder(ProductType.FOOD, ProductType.BEAUTY);
    }
}
