package com.demo.altcredit.service.dto;

import lombok.Value;

import java.util.List;

@Value
public class BatchScoreResponse {
    List<ScoreResponse> results;
    int count;

    public static BatchScoreResponse of(List<ScoreResponse> results) {
        return new BatchScoreResponse(List.copyOf(results), results.size());
    }
}
