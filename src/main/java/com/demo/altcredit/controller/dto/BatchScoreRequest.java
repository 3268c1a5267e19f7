package com.demo.altcredit.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Up to 50 borrowers scored in one call. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchScoreRequest {

    @NotNull
    @Size(min = 1, max = 50)
    private List<@Valid ScoreRequest> borrowers;
}
