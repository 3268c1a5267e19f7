package com.demo.altcredit.model;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Loads the classifier into {@link ModelState} once the application is up; clears it on shutdown. */
@Slf4j
@Component
public class ModelLifecycle {

    private final ModelArtifactLoader loader;
    private final ModelState state;
    private final String modelPath;

    public ModelLifecycle(ModelArtifactLoader loader, ModelState state,
                          @Value("${model.path:file:./credit_model.json}") String modelPath) {
        this.loader = loader;
        this.state = state;
        this.modelPath = modelPath;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (state.isLoaded()) return;
        try {
            state.install(loader.load(modelPath));
            log.info("[startup] Model {} loaded", state.require().version());
        } catch (ModelLoadException e) {
            // no retry: the service keeps answering health checks and refuses to score
            log.warn("[startup] Model not available ({}). Scoring requests will be rejected.", e.getMessage());
            state.markFailed(e.getMessage());
        }
    }

    @PreDestroy
    public void onShutdown() {
        state.clear();
        log.info("[shutdown] Model state cleared");
    }
}
