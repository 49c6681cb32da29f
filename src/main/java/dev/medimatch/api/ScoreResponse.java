package dev.medimatch.api;

/** Response body for {@code POST /api/score}. */
public record ScoreResponse(double score) {}
