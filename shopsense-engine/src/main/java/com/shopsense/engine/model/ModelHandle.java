package com.shopsense.engine.model;

import com.shopsense.engine.exception.RecommendationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the current model generation. Reads are lock-free.
 */
@Slf4j
@Component
public class ModelHandle {

    private final AtomicReference<ModelGeneration> current = new AtomicReference<>();

    /**
     * @throws RecommendationException MODEL_NOT_READY before the first generation is published
     */
    public ModelGeneration current() {
        ModelGeneration generation = current.get();
        if (generation == null) {
            throw RecommendationException.modelNotReady();
        }
        return generation;
    }

    public Optional<ModelGeneration> find() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Publishes a new generation and returns the one it replaced, if any.
     */
    public Optional<ModelGeneration> swap(ModelGeneration generation) {
        ModelGeneration previous = current.getAndSet(generation);
        log.info("Published model generation {} (previous={})",
                generation.generation(), previous != null ? previous.generation() : "none");
        return Optional.ofNullable(previous);
    }
}
