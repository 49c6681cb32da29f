package dev.medimatch.api;

import dev.medimatch.medication.PillColor;
import dev.medimatch.medication.PillShape;
import dev.medimatch.signal.QuerySignals;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON form of {@link QuerySignals}. Colour and shape are canonical lowercase labels; an
 * unrecognised label is a client error. Lists may be absent but never hold null entries.
 */
public record SignalsPayload(
    @Nullable List<@NotNull @Valid RecognizedTextPayload> recognizedText,
    @Nullable List<@NotNull String> labels,
    @Nullable String color,
    @Nullable String shape,
    @Nullable String externalCode,
    @Nullable List<@NotNull String> aiTerms) {

  QuerySignals toSignals() {
    return QuerySignals.builder()
        .recognizedText(
            recognizedText == null
                ? List.of()
                : recognizedText.stream().map(RecognizedTextPayload::toRecognizedText).toList())
        .labels(labels == null ? List.of() : labels)
        .detectedColor(parseColor(color))
        .detectedShape(parseShape(shape))
        .externalCode(externalCode)
        .aiTerms(aiTerms == null ? List.of() : aiTerms)
        .build();
  }

  static @Nullable PillColor parseColor(@Nullable String label) {
    if (label == null || label.isBlank()) {
      return null;
    }
    return PillColor.fromLabel(label)
        .orElseThrow(() -> new IllegalArgumentException("Unknown pill color: " + label));
  }

  static @Nullable PillShape parseShape(@Nullable String label) {
    if (label == null || label.isBlank()) {
      return null;
    }
    return PillShape.fromLabel(label)
        .orElseThrow(() -> new IllegalArgumentException("Unknown pill shape: " + label));
  }
}
