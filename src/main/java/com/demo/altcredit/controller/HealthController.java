package com.demo.altcredit.controller;

import com.demo.altcredit.model.CreditClassifier;
import com.demo.altcredit.model.ModelState;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "meta")
public class HealthController {

    private final ModelState modelState;

    @Value("${app.api-version:6.0.0}")
    private String apiVersion;

    /** Liveness plus readiness: model_loaded is true once scoring is possible. */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "ok");
        out.put("model_loaded", modelState.isLoaded());
        out.put("model_version", modelState.current().map(CreditClassifier::version).orElse(null));
        modelState.failureReason().ifPresent(r -> out.put("model_error", r));
        out.put("version", apiVersion);
        return out;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("message", "Alternative Credit Scoring API");
        out.put("version", apiVersion);
        out.put("docs", "/swagger-ui.html");
        out.put("health", "/health");
        return out;
    }
}
