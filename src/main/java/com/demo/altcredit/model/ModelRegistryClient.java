package com.demo.altcredit.model;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/** Pulls the published model artifact from a model registry over HTTP. */
@Service
public class ModelRegistryClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public ModelRegistryClient(RestTemplate restTemplate, @Value("${model.base-url:}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl == null ? "" : baseUrl.trim().replaceAll("/+$", "");
    }

    public boolean isConfigured() {
        return !baseUrl.isEmpty();
    }

    public String artifactUrl() {
        return baseUrl + "/model/artifact";
    }

    public ModelArtifact fetchArtifact() {
        if (!isConfigured()) {
            throw new ModelLoadException("model.base-url is not configured");
        }
        try {
            ResponseEntity<ModelArtifact> resp = restTemplate.getForEntity(artifactUrl(), ModelArtifact.class);
            if (resp.getBody() == null) {
                throw new ModelLoadException("Model registry returned an empty body from " + artifactUrl());
            }
            return resp.getBody();
        } catch (RestClientException ex) {
            throw new ModelLoadException("Model registry call failed: " + ex.getMessage(), ex);
        }
    }
}
