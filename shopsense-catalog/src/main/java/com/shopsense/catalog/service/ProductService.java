package com.shopsense.catalog.service;

import com.shopsense.catalog.dto.ProductDTO;
import com.shopsense.catalog.entity.Product.ProductStatus;
import com.shopsense.catalog.exception.CatalogException;
import com.shopsense.catalog.repository.ProductRepository;
import com.shopsense.common.enums.InteractionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductService {

    private final ProductRepository productRepository;

    @Transactional(readOnly = true)
    public List<ProductDTO> getActiveProducts() {
        return productRepository.findByStatus(ProductStatus.ACTIVE).stream()
                .map(ProductDTO::fromEntity)
                .toList();
    }

    /**
     * Batch lookup keyed by id. Unknown ids are simply absent from the result.
     */
    @Transactional(readOnly = true)
    public Map<UUID, ProductDTO> getProductsByIds(Collection<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return Map.of();
        }
        Map<UUID, ProductDTO> byId = new LinkedHashMap<>();
        productRepository.findByIdIn(ids)
                .forEach(product -> byId.put(product.getId(), ProductDTO.fromEntity(product)));
        return byId;
    }

    @Transactional(readOnly = true)
    public List<ProductDTO> getTrendingProducts(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return productRepository.findTrending(ProductStatus.ACTIVE, PageRequest.of(0, limit)).stream()
                .map(ProductDTO::fromEntity)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ProductDTO> getFeaturedProducts(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return productRepository.findFeatured(ProductStatus.ACTIVE, PageRequest.of(0, limit)).stream()
                .map(ProductDTO::fromEntity)
                .toList();
    }

    /**
     * Bumps the analytics counter matching the interaction type.
     * A purchase also refreshes the product's conversion rate.
     */
    @Transactional
    public void recordInteraction(UUID productId, InteractionType type) {
        int updated = switch (type) {
            case VIEW -> productRepository.incrementViewCount(productId);
            case PURCHASE -> productRepository.incrementPurchaseCount(productId);
            case ADD_TO_CART -> productRepository.incrementAddToCartCount(productId);
            case ADD_TO_WISHLIST -> productRepository.incrementAddToWishlistCount(productId);
        };
        if (updated == 0) {
            throw CatalogException.productNotFound(productId.toString());
        }
        log.debug("Recorded {} for productId={}", type, productId);
    }
}
