package dev.medimatch.reference;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * A well-known medication in the built-in reference catalog.
 *
 * @param name common name
 * @param genericName generic name where it differs from the common name
 * @param brandNames brand names
 * @param activeIngredient active ingredient
 * @param commonDosages dosages the medication is commonly sold in
 * @param category therapeutic category
 */
public record CommonMedication(
    String name,
    @Nullable String genericName,
    List<String> brandNames,
    String activeIngredient,
    List<String> commonDosages,
    MedicationCategory category) {

  public CommonMedication {
    brandNames = List.copyOf(brandNames);
    commonDosages = List.copyOf(commonDosages);
  }

  /** True if name, generic name, any brand name or the active ingredient contains the term. */
  boolean mentions(String lowercaseTerm) {
    return Stream.concat(names(), Stream.of(activeIngredient))
        .anyMatch(value -> lower(value).contains(lowercaseTerm));
  }

  /** True if name, generic name or any brand name starts with the term. */
  boolean hasNameStartingWith(String lowercaseTerm) {
    return names().anyMatch(value -> lower(value).startsWith(lowercaseTerm));
  }

  private Stream<String> names() {
    Stream<String> primary = genericName == null ? Stream.of(name) : Stream.of(name, genericName);
    return Stream.concat(primary, brandNames.stream());
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
