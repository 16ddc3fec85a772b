package com.shopsense.engine.controller;

import com.shopsense.engine.dto.ProductViewRequest;
import com.shopsense.engine.dto.RecommendationResponse;
import com.shopsense.engine.dto.TrackInteractionRequest;
import com.shopsense.engine.dto.TrackInteractionResponse;
import com.shopsense.engine.service.InteractionTracker;
import com.shopsense.engine.service.RecommendationDeliveryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Interaction tracking endpoints.
 *
 * Endpoints:
 * - POST /api/interactions - record a view, purchase, cart or wishlist add
 * - POST /api/interactions/product-view - record a view and get fresh recommendations
 */
@RestController
@RequestMapping("/api/interactions")
@RequiredArgsConstructor
@Slf4j
public class InteractionController {

    private final InteractionTracker interactionTracker;
    private final RecommendationDeliveryService deliveryService;

    @PostMapping
    public ResponseEntity<TrackInteractionResponse> track(@Valid @RequestBody TrackInteractionRequest request) {
        log.debug("POST /api/interactions - userId={}, productId={}, type={}",
                request.getUserId(), request.getProductId(), request.getType());

        TrackInteractionResponse response = interactionTracker.track(
                request.getUserId(), request.getProductId(), request.getType(), request.toMetadata());

        return ResponseEntity.ok(response);
    }

    @PostMapping("/product-view")
    public ResponseEntity<RecommendationResponse> productView(@Valid @RequestBody ProductViewRequest request) {
        log.debug("POST /api/interactions/product-view - userId={}, productId={}",
                request.getUserId(), request.getProductId());

        RecommendationResponse response = deliveryService.onProductViewed(
                request.getUserId(), request.getProductId(), request.toMetadata());

        return ResponseEntity.ok(response);
    }
}
