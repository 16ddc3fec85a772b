package com.shopsense.catalog.repository;

import com.shopsense.catalog.entity.Product;
import com.shopsense.catalog.entity.Product.ProductStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProductRepository extends JpaRepository<Product, UUID> {

    Optional<Product> findBySku(String sku);

    List<Product> findByStatus(ProductStatus status);

    List<Product> findByIdIn(Collection<UUID> ids);

    /**
     * Most popular products first: trending score, then views.
     * p.id keeps the order deterministic when both are equal.
     */
    @Query("SELECT p FROM Product p WHERE p.status = :status " +
           "ORDER BY p.analytics.trendingScore DESC, p.analytics.viewCount DESC, p.id ASC")
    List<Product> findTrending(@Param("status") ProductStatus status, Pageable pageable);

    /**
     * Featured products by views, used as cold-start defaults.
     */
    @Query("SELECT p FROM Product p WHERE p.status = :status AND p.featured = true " +
           "ORDER BY p.analytics.viewCount DESC, p.id ASC")
    List<Product> findFeatured(@Param("status") ProductStatus status, Pageable pageable);

    // Counter updates. Each returns the number of rows touched (0 when the product is unknown).

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Product p SET p.analytics.viewCount = p.analytics.viewCount + 1 WHERE p.id = :id")
    int incrementViewCount(@Param("id") UUID id);

    /**
     * Increments purchases and recomputes the conversion rate as purchases per 100 views.
     * Assignments read the pre-update row, hence the explicit + 1.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Product p SET p.analytics.purchaseCount = p.analytics.purchaseCount + 1, " +
           "p.analytics.conversionRate = CASE WHEN p.analytics.viewCount > 0 " +
           "THEN (p.analytics.purchaseCount + 1) * 100.0 / p.analytics.viewCount ELSE 0.0 END " +
           "WHERE p.id = :id")
    int incrementPurchaseCount(@Param("id") UUID id);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Product p SET p.analytics.addToCartCount = p.analytics.addToCartCount + 1 WHERE p.id = :id")
    int incrementAddToCartCount(@Param("id") UUID id);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Product p SET p.analytics.addToWishlistCount = p.analytics.addToWishlistCount + 1 WHERE p.id = :id")
    int incrementAddToWishlistCount(@Param("id") UUID id);
}
