package dev.medimatch.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** Request body for {@code POST /api/identify}. */
public record IdentifyRequest(
    @NotNull @Valid SignalsPayload signals,
    @NotNull List<@NotNull @Valid MedicationPayload> candidates) {}
