package dev.medimatch.signal;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A string produced by the text recognizer together with its recognition confidence. The bounding
 * region the recognizer also reports is not used for matching and is not carried.
 *
 * @param text the recognized text
 * @param confidence recognizer confidence in [0.0, 1.0]
 */
public record RecognizedText(String text, double confidence) {

  private static final Pattern DOSAGE =
      Pattern.compile("\\d+\\s?(mg|mcg|g|ml|IU|units?)", Pattern.CASE_INSENSITIVE);

  private static final int MAX_NAME_WORDS = 3;

  /** Compact constructor validating input. */
  public RecognizedText {
    if (text == null) {
      throw new IllegalArgumentException("Recognized text must not be null");
    }
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException(
          "Recognized text confidence must be in [0.0, 1.0], got: " + confidence);
    }
  }

  /** Text recognized with full confidence, for callers that have no confidence value. */
  public static RecognizedText of(String text) {
    return new RecognizedText(text, 1.0);
  }

  /**
   * Extracts the first dosage expression, such as {@code "500mg"} or {@code "10 ml"}.
   *
   * @return the dosage exactly as it appears in the text, or empty if none is present
   */
  public Optional<String> dosage() {
    Matcher matcher = DOSAGE.matcher(text);
    return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
  }

  /**
   * Heuristic for label text that names a medication rather than a count or a dosage: has an
   * uppercase letter, more letters than digits, and at most three words.
   */
  public boolean looksLikeMedicationName() {
    boolean hasUppercase = text.chars().anyMatch(Character::isUpperCase);
    long letters = text.chars().filter(Character::isLetter).count();
    long digits = text.chars().filter(Character::isDigit).count();
    int words = text.split("\\s", -1).length;
    return hasUppercase && letters > digits && words <= MAX_NAME_WORDS;
  }
}
