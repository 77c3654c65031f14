package com.products.lookup;

import com.products.lookup.catalog.CatalogRegistry;
import com.products.lookup.model.ProductType;
import com.products.lookup.service.PricingSessionBootstrap;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "lookup.auto-initialize=false",
        "pricing.credentials.search-test-resources=false",
        "pricing.credentials.file=no-such-credentials.json"
})
class ProductLookupApplicationTests {

    @Autowired
    private CatalogRegistry catalogs;

    @Autowired
    private PricingSessionBootstrap bootstrap;

    @Test
    void contextLoads() {
        assertThat(catalogs.supportedTypes())
                .containsExactlyInAnyOrder(ProductType.FOOD, ProductType.BEAUTY, ProductType.GENERAL);
        assertThat(bootstrap.isInitialized()).isFalse();
    }
}
