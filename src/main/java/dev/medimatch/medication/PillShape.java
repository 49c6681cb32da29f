package dev.medimatch.medication;

import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Pill shapes recognised by the contour classifier and stored on medication metadata. */
public enum PillShape {
  ROUND,
  OVAL,
  CAPSULE,
  OBLONG,
  RECTANGLE,
  TRIANGLE,
  DIAMOND,
  PENTAGON,
  HEXAGON,
  OCTAGON,
  OTHER;

  /** Lowercase label used as a searchable term (e.g. {@code "capsule"}). */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public String displayName() {
    String label = label();
    return Character.toUpperCase(label.charAt(0)) + label.substring(1);
  }

  /**
   * Parses a canonical shape label, ignoring case and surrounding whitespace.
   *
   * @param label the classifier output (may be null)
   * @return the matching shape, or empty for null or unknown labels
   */
  public static Optional<PillShape> fromLabel(@Nullable String label) {
    if (label == null || label.isBlank()) {
      return Optional.empty();
    }
    String normalised = label.trim().toLowerCase(Locale.ROOT);
    for (PillShape shape : values()) {
      if (shape.label().equals(normalised)) {
        return Optional.of(shape);
      }
    }
    return Optional.empty();
  }
}
