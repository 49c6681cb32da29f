package dev.medimatch.signal;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Normalisation applied to every string before it takes part in term comparison: lowercase
 * (root locale) and trim surrounding whitespace. Blank strings are not terms.
 */
public final class Terms {

  private Terms() {}

  /**
   * Normalises a single raw string.
   *
   * @param raw the raw text (may be null)
   * @return the normalised term, or empty if the input is null or blank
   */
  public static Optional<String> normalise(@Nullable String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String term = raw.trim().toLowerCase(Locale.ROOT);
    return term.isEmpty() ? Optional.empty() : Optional.of(term);
  }

  /**
   * Normalises and deduplicates a collection of raw strings, preserving first-seen order.
   *
   * @param raw raw strings; null and blank entries are skipped
   * @return an ordered set of distinct normalised terms
   */
  public static Set<String> normaliseAll(Collection<String> raw) {
    Set<String> terms = new LinkedHashSet<>();
    for (String value : raw) {
      normalise(value).ifPresent(terms::add);
    }
    return terms;
  }
}
