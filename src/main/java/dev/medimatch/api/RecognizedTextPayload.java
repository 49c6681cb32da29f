package dev.medimatch.api;

import dev.medimatch.signal.RecognizedText;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;

/**
 * JSON form of a recognized-text entry. A missing confidence means the recognizer reported none
 * and is treated as full confidence.
 */
public record RecognizedTextPayload(@NotNull String text, @Nullable Double confidence) {

  RecognizedText toRecognizedText() {
    return new RecognizedText(text, confidence == null ? 1.0 : confidence);
  }
}
