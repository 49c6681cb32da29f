package dev.medimatch.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** Request body for {@code POST /api/score}. */
public record ScoreRequest(
    @NotNull List<@NotNull String> queryTerms, @NotNull @Valid MedicationPayload medication) {}
