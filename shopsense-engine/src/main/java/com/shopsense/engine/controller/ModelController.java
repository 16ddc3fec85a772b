package com.shopsense.engine.controller;

import com.shopsense.engine.model.ModelGeneration;
import com.shopsense.engine.model.ModelHandle;
import com.shopsense.engine.service.ModelRefreshService;
import com.shopsense.engine.service.ModelRefreshService.RefreshResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Internal controller for the recommendation model.
 * Protected by API key.
 *
 * Endpoints:
 * - GET /api/internal/model/status - Current generation and refresh state
 * - POST /api/internal/model/refresh - Rebuild the model now
 */
@Slf4j
@RestController
@RequestMapping("/api/internal/model")
@RequiredArgsConstructor
public class ModelController {

    private final ModelHandle modelHandle;
    private final ModelRefreshService modelRefreshService;

    @Value("${shopsense.internal.api-key:}")
    private String internalApiKey;

    /**
     * Rebuild the model synchronously. Returns "skipped" when a refresh is already running.
     *
     * POST /api/internal/model/refresh
     */
    @PostMapping("/refresh")
    public ResponseEntity<?> refresh(
            @RequestHeader(value = "X-Internal-Api-Key", required = false) String apiKey) {

        if (!isValidApiKey(apiKey)) {
            log.warn("Unauthorized model refresh attempt - invalid API key");
            return unauthorizedResponse();
        }

        log.info("Manual model refresh requested");
        RefreshResult result = modelRefreshService.refresh();

        return switch (result.status()) {
            case REFRESHED, SKIPPED -> ResponseEntity.ok(result);
            case FAILED -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        };
    }

    /**
     * GET /api/internal/model/status
     */
    @GetMapping("/status")
    public ResponseEntity<?> getStatus(
            @RequestHeader(value = "X-Internal-Api-Key", required = false) String apiKey) {

        if (!isValidApiKey(apiKey)) {
            return unauthorizedResponse();
        }

        Optional<ModelGeneration> current = modelHandle.find();

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("ready", current.isPresent());
        current.ifPresent(generation -> {
            status.put("generation", generation.generation());
            status.put("builtAt", generation.builtAt().toString());
            status.put("users", generation.matrix().userCount());
            status.put("products", generation.matrix().productCount());
            status.put("dimensions", generation.embeddings().getDimensions());
            status.put("eventCount", generation.eventCount());
        });
        status.put("refreshInProgress", modelRefreshService.isRefreshInProgress());
        status.put("eventsSinceRefresh", modelRefreshService.getEventsSinceRefresh());
        status.put("lastAttemptAt", modelRefreshService.getLastAttemptAt() != null
                ? modelRefreshService.getLastAttemptAt().toString()
                : null);
        status.put("lastAttemptFailed", modelRefreshService.isLastAttemptFailed());
        status.put("lastError", modelRefreshService.getLastError());

        return ResponseEntity.ok(status);
    }

    private boolean isValidApiKey(String apiKey) {
        if (internalApiKey == null || internalApiKey.isBlank()) {
            log.warn("Internal API key not configured - rejecting request");
            return false;
        }
        return internalApiKey.equals(apiKey);
    }

    private ResponseEntity<?> unauthorizedResponse() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("message", "Invalid or missing API key"));
    }
}
