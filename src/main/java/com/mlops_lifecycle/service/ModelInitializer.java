package com.mlops_lifecycle.service;

import com.mlops_lifecycle.model.ServerModelState;
import com.mlops_lifecycle.strategy.AcquisitionResult;
import com.mlops_lifecycle.strategy.ModelAcquisitionStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot model acquisition for the serving API. Strategies are tried in priority order
 * (registry, then local file); the first success makes the server READY, exhausting them
 * leaves it UNAVAILABLE. Never throws for a failed acquisition.
 */
@Slf4j
@Service
public class ModelInitializer {

    private final List<ModelAcquisitionStrategy> strategies;
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private volatile ServerModelState state = ServerModelState.uninitialized();

    public ModelInitializer(List<ModelAcquisitionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * UNINITIALIZED until {@link #initialize()} has finished, then its result.
     */
    public ServerModelState getState() {
        return state;
    }

    public ServerModelState initialize() {
        if (!initialized.compareAndSet(false, true)) {
            throw new IllegalStateException("Model server is already initialized, state is " + state.getStatus());
        }
        log.info("🚀 Initializing model server (state {})", state.getStatus());

        List<String> failures = new ArrayList<>();
        for (ModelAcquisitionStrategy strategy : strategies) {
            log.info("🔎 Trying to load model from {}", strategy.source().getLabel());
            AcquisitionResult result;
            try {
                result = strategy.acquire();
            } catch (RuntimeException e) {
                result = AcquisitionResult.failed(e.getMessage());
            }

            if (result.isSuccess()) {
                state = ServerModelState.ready(result.model(), strategy.source(), result.versionLabel(), result.modelName());
                log.info("✅ Model loaded from {} (version={}, features={}, classes={})",
                        strategy.source().getLabel(), result.versionLabel(),
                        result.model().numFeatures(), result.model().getClassLabels());
                return state;
            }

            log.warn("⚠️ Could not load model from {}: {}", strategy.source().getLabel(), result.failureReason());
            failures.add(strategy.source().getLabel() + ": " + result.failureReason());
        }

        log.error("❌ No model could be loaded, serving in UNAVAILABLE state. Attempts: {}", failures);
        state = ServerModelState.unavailable();
        return state;
    }
}
