package com.shopsense.catalog.repository;

import com.shopsense.catalog.entity.Product;
import com.shopsense.catalog.entity.Product.ProductStatus;
import com.shopsense.catalog.entity.ProductAnalytics;
import org.hibernate.SessionFactory;
import org.hibernate.stat.Statistics;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest(properties = "spring.jpa.properties.hibernate.generate_statistics=true")
class ProductRepositoryTest {

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void findTrendingOrdersByScoreThenViewsAndSkipsInactive() {
        Product low = save("SKU-LOW", ProductStatus.ACTIVE, false, 0.2, 500);
        Product highFewViews = save("SKU-HIGH-1", ProductStatus.ACTIVE, false, 0.9, 10);
        Product highManyViews = save("SKU-HIGH-2", ProductStatus.ACTIVE, false, 0.9, 90);
        save("SKU-ARCHIVED", ProductStatus.ARCHIVED, false, 1.0, 1000);

        List<Product> trending = productRepository.findTrending(ProductStatus.ACTIVE, PageRequest.of(0, 10));

        assertThat(trending).extracting(Product::getId)
                .containsExactly(highManyViews.getId(), highFewViews.getId(), low.getId());
    }

    @Test
    void findFeaturedReturnsOnlyActiveFeaturedByViews() {
        Product featuredFew = save("SKU-F1", ProductStatus.ACTIVE, true, 0, 5);
        Product featuredMany = save("SKU-F2", ProductStatus.ACTIVE, true, 0, 50);
        save("SKU-PLAIN", ProductStatus.ACTIVE, false, 0, 500);
        save("SKU-DRAFT", ProductStatus.DRAFT, true, 0, 500);

        List<Product> featured = productRepository.findFeatured(ProductStatus.ACTIVE, PageRequest.of(0, 1));

        assertThat(featured).extracting(Product::getId).containsExactly(featuredMany.getId());
        assertThat(productRepository.findFeatured(ProductStatus.ACTIVE, PageRequest.of(0, 10)))
                .extracting(Product::getId)
                .containsExactly(featuredMany.getId(), featuredFew.getId());
    }

    @Test
    void purchaseIncrementRecomputesConversionRate() {
        Product product = save("SKU-CONV", ProductStatus.ACTIVE, false, 0, 4);

        int updated = productRepository.incrementPurchaseCount(product.getId());

        assertThat(updated).isEqualTo(1);
        ProductAnalytics analytics = productRepository.findById(product.getId()).orElseThrow().getAnalytics();
        assertThat(analytics.getPurchaseCount()).isEqualTo(1);
        assertThat(analytics.getConversionRate()).isCloseTo(25.0, within(1e-9));
    }

    @Test
    void purchaseWithoutViewsKeepsConversionAtZero() {
        Product product = save("SKU-NOVIEWS", ProductStatus.ACTIVE, false, 0, 0);

        productRepository.incrementPurchaseCount(product.getId());

        ProductAnalytics analytics = productRepository.findById(product.getId()).orElseThrow().getAnalytics();
        assertThat(analytics.getPurchaseCount()).isEqualTo(1);
        assertThat(analytics.getConversionRate()).isZero();
    }

    @Test
    void counterIncrementsTouchOnlyTheirColumn() {
        Product product = save("SKU-COUNTERS", ProductStatus.ACTIVE, false, 0, 0);

        productRepository.incrementViewCount(product.getId());
        productRepository.incrementViewCount(product.getId());
        productRepository.incrementAddToCartCount(product.getId());
        productRepository.incrementAddToWishlistCount(product.getId());

        ProductAnalytics analytics = productRepository.findBySku("SKU-COUNTERS").orElseThrow().getAnalytics();
        assertThat(analytics.getViewCount()).isEqualTo(2);
        assertThat(analytics.getAddToCartCount()).isEqualTo(1);
        assertThat(analytics.getAddToWishlistCount()).isEqualTo(1);
        assertThat(analytics.getPurchaseCount()).isZero();
    }

    @Test
    void incrementOnUnknownProductTouchesNothing() {
        assertThat(productRepository.incrementViewCount(UUID.randomUUID())).isZero();
    }

    @Test
    void activeScanLoadsAttributeListsInBatches() {
        for (int i = 0; i < 4; i++) {
            Product product = Product.builder()
                    .sku("SKU-ATTR-" + i)
                    .name("Tee " + i)
                    .price(new BigDecimal("19.99"))
                    .colors(new ArrayList<>(List.of("red", "blue")))
                    .sizes(new ArrayList<>(List.of("M")))
                    .materials(new ArrayList<>(List.of("cotton")))
                    .seasons(new ArrayList<>(List.of("summer")))
                    .features(new ArrayList<>(List.of("organic", "slim-fit")))
                    .build();
            productRepository.save(product);
        }
        entityManager.flush();
        entityManager.clear();

        Statistics statistics = entityManager.getEntityManager().getEntityManagerFactory()
                .unwrap(SessionFactory.class).getStatistics();
        statistics.clear();

        List<Product> active = productRepository.findByStatus(ProductStatus.ACTIVE);
        for (Product product : active) {
            assertThat(product.getColors()).containsExactlyInAnyOrder("red", "blue");
            assertThat(product.getSizes()).containsExactly("M");
            assertThat(product.getMaterials()).containsExactly("cotton");
            assertThat(product.getSeasons()).containsExactly("summer");
            assertThat(product.getFeatures()).containsExactlyInAnyOrder("organic", "slim-fit");
        }

        assertThat(active).hasSize(4);
        // one product query plus one per attribute list, independent of the product count
        assertThat(statistics.getPrepareStatementCount()).isLessThanOrEqualTo(6);
    }

    private Product save(String sku, ProductStatus status, boolean featured, double trendingScore, long views) {
        Product product = Product.builder()
                .sku(sku)
                .name("Product " + sku)
                .price(new BigDecimal("49.99"))
                .category("tops")
                .status(status)
                .featured(featured)
                .analytics(ProductAnalytics.builder()
                        .trendingScore(trendingScore)
                        .viewCount(views)
                        .build())
                .build();
        return productRepository.saveAndFlush(product);
    }
}
