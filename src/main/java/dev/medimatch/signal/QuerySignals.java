package dev.medimatch.signal;

import dev.medimatch.medication.PillColor;
import dev.medimatch.medication.PillShape;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Evidence captured for a single identification attempt. Request-scoped and never persisted.
 *
 * @param recognizedText strings read from the image by the text recognizer
 * @param labels semantic labels from the image classifier
 * @param detectedColor pill colour from the colour classifier, if any
 * @param detectedShape pill shape from the contour classifier, if any
 * @param externalCode decoded barcode payload (National Drug Code), if any
 * @param aiTerms terms suggested by the optional language-model analysis
 */
public record QuerySignals(
    List<RecognizedText> recognizedText,
    List<String> labels,
    @Nullable PillColor detectedColor,
    @Nullable PillShape detectedShape,
    @Nullable String externalCode,
    List<String> aiTerms) {

  public QuerySignals {
    recognizedText = recognizedText == null ? List.of() : List.copyOf(recognizedText);
    labels = labels == null ? List.of() : List.copyOf(labels);
    aiTerms = aiTerms == null ? List.of() : List.copyOf(aiTerms);
  }

  /** Signals carrying nothing. */
  public static QuerySignals empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns true if a non-blank barcode payload is present. */
  public boolean hasExternalCode() {
    return externalCode != null && !externalCode.isBlank();
  }

  /**
   * Returns a copy keeping only recognized text at or above the given confidence. The aggregator
   * never filters by confidence itself; callers that want filtering apply it here first.
   *
   * @param minConfidence minimum confidence in [0.0, 1.0]
   * @return filtered signals; all other fields unchanged
   */
  public QuerySignals withMinimumConfidence(double minConfidence) {
    if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
      throw new IllegalArgumentException(
          "minConfidence must be in [0.0, 1.0], got: " + minConfidence);
    }
    List<RecognizedText> kept =
        recognizedText.stream().filter(t -> t.confidence() >= minConfidence).toList();
    return new QuerySignals(kept, labels, detectedColor, detectedShape, externalCode, aiTerms);
  }

  /** Builder so callers only set the signals their collaborators produced. */
  public static final class Builder {

    private List<RecognizedText> recognizedText = List.of();
    private List<String> labels = List.of();
    private @Nullable PillColor detectedColor;
    private @Nullable PillShape detectedShape;
    private @Nullable String externalCode;
    private List<String> aiTerms = List.of();

    private Builder() {}

    public Builder recognizedText(List<RecognizedText> recognizedText) {
      this.recognizedText = recognizedText;
      return this;
    }

    public Builder recognizedText(String... texts) {
      this.recognizedText = Arrays.stream(texts).map(RecognizedText::of).toList();
      return this;
    }

    public Builder labels(List<String> labels) {
      this.labels = labels;
      return this;
    }

    public Builder labels(String... labels) {
      this.labels = List.of(labels);
      return this;
    }

    public Builder detectedColor(@Nullable PillColor detectedColor) {
      this.detectedColor = detectedColor;
      return this;
    }

    public Builder detectedShape(@Nullable PillShape detectedShape) {
      this.detectedShape = detectedShape;
      return this;
    }

    public Builder externalCode(@Nullable String externalCode) {
      this.externalCode = externalCode;
      return this;
    }

    public Builder aiTerms(List<String> aiTerms) {
      this.aiTerms = aiTerms;
      return this;
    }

    public Builder aiAnalysis(AiAnalysis analysis) {
      this.aiTerms = analysis.searchTerms();
      return this;
    }

    public QuerySignals build() {
      return new QuerySignals(
          recognizedText, labels, detectedColor, detectedShape, externalCode, aiTerms);
    }
  }
}
