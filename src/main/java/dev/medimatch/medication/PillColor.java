package dev.medimatch.medication;

import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Pill colours recognised by the colour classifier and stored on medication metadata. */
public enum PillColor {
  WHITE,
  YELLOW,
  ORANGE,
  RED,
  PINK,
  BLUE,
  GREEN,
  PURPLE,
  BROWN,
  GRAY,
  BLACK,
  MULTICOLOR;

  /** Lowercase label used as a searchable term (e.g. {@code "white"}). */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Capitalised label for display (e.g. {@code "White"}). */
  public String displayName() {
    String label = label();
    return Character.toUpperCase(label.charAt(0)) + label.substring(1);
  }

  /**
   * Parses a canonical colour label, ignoring case and surrounding whitespace.
   *
   * @param label the classifier output (may be null)
   * @return the matching colour, or empty for null or unknown labels
   */
  public static Optional<PillColor> fromLabel(@Nullable String label) {
    if (label == null || label.isBlank()) {
      return Optional.empty();
    }
    String normalised = label.trim().toLowerCase(Locale.ROOT);
    for (PillColor color : values()) {
      if (color.label().equals(normalised)) {
        return Optional.of(color);
      }
    }
    return Optional.empty();
  }
}
