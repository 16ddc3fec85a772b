package com.shopsense.catalog.dto;

import com.shopsense.catalog.entity.Product;
import com.shopsense.catalog.entity.ProductAnalytics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductDTO {

    private UUID id;
    private String sku;
    private String name;
    private String description;
    private BigDecimal price;
    private String category;
    private String brand;
    private String status;
    private Boolean featured;
    private List<String> colors;
    private List<String> sizes;
    private List<String> materials;
    private List<String> seasons;
    private List<String> features;
    private long viewCount;
    private long purchaseCount;
    private long addToCartCount;
    private long addToWishlistCount;
    private double averageRating;
    private double trendingScore;

    public boolean isActive() {
        return Product.ProductStatus.ACTIVE.name().equals(status);
    }

    public static ProductDTO fromEntity(Product product) {
        ProductAnalytics analytics = product.getAnalytics() != null
                ? product.getAnalytics()
                : new ProductAnalytics();
        return ProductDTO.builder()
                .id(product.getId())
                .sku(product.getSku())
                .name(product.getName())
                .description(product.getDescription())
                .price(product.getPrice())
                .category(product.getCategory())
                .brand(product.getBrand())
                .status(product.getStatus().name())
                .featured(product.getFeatured())
                .colors(List.copyOf(product.getColors()))
                .sizes(List.copyOf(product.getSizes()))
                .materials(List.copyOf(product.getMaterials()))
                .seasons(List.copyOf(product.getSeasons()))
                .features(List.copyOf(product.getFeatures()))
                .viewCount(analytics.getViewCount())
                .purchaseCount(analytics.getPurchaseCount())
                .addToCartCount(analytics.getAddToCartCount())
                .addToWishlistCount(analytics.getAddToWishlistCount())
                .averageRating(analytics.getAverageRating())
                .trendingScore(analytics.getTrendingScore())
                .build();
    }
}
