package com.demo.altcredit.controller;

import com.demo.altcredit.controller.dto.BatchScoreRequest;
import com.demo.altcredit.controller.dto.PredictRequest;
import com.demo.altcredit.controller.dto.ScoreRequest;
import com.demo.altcredit.service.ScoringService;
import com.demo.altcredit.service.dto.BatchScoreResponse;
import com.demo.altcredit.service.dto.ScoreResponse;
import com.demo.altcredit.service.features.Feature;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "scoring")
public class ScoringController {

    private final ScoringService scoringService;

    public ScoringController(ScoringService scoringService) {
        this.scoringService = scoringService;
    }

    /** Primary endpoint: raw form fields, features are derived server-side. */
    @Operation(summary = "Score one borrower from raw signals")
    @PostMapping(value = "/score", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ScoreResponse score(@Valid @RequestBody ScoreRequest req) {
        return scoringService.score(req);
    }

    /** Same as /score for up to 50 borrowers; results keep the input order. */
    @Operation(summary = "Score up to 50 borrowers")
    @PostMapping(value = "/score/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BatchScoreResponse scoreBatch(@Valid @RequestBody BatchScoreRequest req) {
        return scoringService.scoreBatch(req.getBorrowers());
    }

    /** Legacy: pre-computed f_* columns, scored with the salaried threshold. */
    @Operation(summary = "Legacy scoring from pre-computed feature columns")
    @PostMapping(value = "/predict", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ScoreResponse predict(@Valid @RequestBody PredictRequest req) {
        return scoringService.scoreLegacy(req);
    }

    /** Canonical feature order, for building forms or checking a trained artifact. */
    @GetMapping("/model/schema")
    public Map<String, Object> schema() {
        Map<String, String> labels = new LinkedHashMap<>();
        for (Feature f : Feature.canonicalOrder()) {
            labels.put(f.columnName(), f.label());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("count", Feature.COUNT);
        out.put("features", Feature.columnNames());
        out.put("labels", labels);
        return out;
    }
}
