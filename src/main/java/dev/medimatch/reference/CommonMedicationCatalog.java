package dev.medimatch.reference;

import dev.medimatch.medication.Medication;
import dev.medimatch.medication.MedicationMetadata;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Built-in reference list of common medications, used for autocomplete while the user types a
 * name and as a fallback candidate set when the user has not stored any medications yet.
 */
public final class CommonMedicationCatalog {

  /** Default number of suggestions returned for a partial name. */
  public static final int DEFAULT_SUGGESTION_LIMIT = 5;

  private static final List<CommonMedication> ENTRIES =
      List.of(
          // Pain relief
          new CommonMedication(
              "Aspirin",
              "Acetylsalicylic Acid",
              List.of("Bayer", "Bufferin", "Ecotrin"),
              "Aspirin",
              List.of("81mg", "325mg", "500mg"),
              MedicationCategory.PAIN_RELIEF),
          new CommonMedication(
              "Ibuprofen",
              null,
              List.of("Advil", "Motrin", "Nurofen"),
              "Ibuprofen",
              List.of("200mg", "400mg", "600mg", "800mg"),
              MedicationCategory.PAIN_RELIEF),
          new CommonMedication(
              "Acetaminophen",
              null,
              List.of("Tylenol", "Paracetamol"),
              "Acetaminophen",
              List.of("325mg", "500mg", "650mg"),
              MedicationCategory.PAIN_RELIEF),
          // Vitamins
          new CommonMedication(
              "Vitamin D",
              "Cholecalciferol",
              List.of("Vitamin D3"),
              "Vitamin D3",
              List.of("1000 IU", "2000 IU", "5000 IU"),
              MedicationCategory.VITAMIN),
          new CommonMedication(
              "Multivitamin",
              null,
              List.of("Centrum", "One A Day", "Nature Made"),
              "Mixed vitamins",
              List.of("Daily"),
              MedicationCategory.VITAMIN),
          new CommonMedication(
              "Fish Oil",
              "Omega-3 Fatty Acids",
              List.of("Nordic Naturals", "Nature Made"),
              "EPA/DHA",
              List.of("1000mg", "1200mg"),
              MedicationCategory.VITAMIN),
          // Antibiotics
          new CommonMedication(
              "Amoxicillin",
              null,
              List.of("Amoxil", "Moxatag"),
              "Amoxicillin",
              List.of("250mg", "500mg", "875mg"),
              MedicationCategory.ANTIBIOTIC),
          // Allergy
          new CommonMedication(
              "Cetirizine",
              null,
              List.of("Zyrtec", "Alleroff"),
              "Cetirizine",
              List.of("5mg", "10mg"),
              MedicationCategory.ALLERGY),
          new CommonMedication(
              "Loratadine",
              null,
              List.of("Claritin", "Alavert"),
              "Loratadine",
              List.of("10mg"),
              MedicationCategory.ALLERGY));

  private CommonMedicationCatalog() {}

  /** All catalog entries in catalog order. */
  public static List<CommonMedication> entries() {
    return ENTRIES;
  }

  /**
   * Finds the first entry mentioning the term in its name, generic name, a brand name or its
   * active ingredient (case-insensitive substring match).
   *
   * @param term the search term
   * @return the first matching entry, or empty for a blank or unknown term
   */
  public static Optional<CommonMedication> find(@Nullable String term) {
    if (term == null || term.isBlank()) {
      return Optional.empty();
    }
    String lowercaseTerm = normalise(term);
    return ENTRIES.stream().filter(entry -> entry.mentions(lowercaseTerm)).findFirst();
  }

  /**
   * Suggests entries whose name, generic name or a brand name starts with the given prefix.
   *
   * @param prefix what the user has typed so far
   * @param limit maximum number of suggestions (must be >= 1)
   * @return matching entries in catalog order; empty for a blank prefix
   */
  public static List<CommonMedication> suggestions(@Nullable String prefix, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    if (prefix == null || prefix.isBlank()) {
      return List.of();
    }
    String lowercasePrefix = normalise(prefix);
    return ENTRIES.stream()
        .filter(entry -> entry.hasNameStartingWith(lowercasePrefix))
        .limit(limit)
        .toList();
  }

  /** Suggestions with the default limit of {@value #DEFAULT_SUGGESTION_LIMIT}. */
  public static List<CommonMedication> suggestions(String prefix) {
    return suggestions(prefix, DEFAULT_SUGGESTION_LIMIT);
  }

  /**
   * Converts a catalog entry into a candidate medication with a fresh identifier. The first common
   * dosage becomes the dosage amount.
   *
   * @param entry the catalog entry
   * @return a medication carrying the entry's names, ingredient and dosage as metadata
   */
  public static Medication toMedication(CommonMedication entry) {
    MedicationMetadata metadata =
        MedicationMetadata.builder()
            .genericName(entry.genericName())
            .brandNames(entry.brandNames())
            .activeIngredient(entry.activeIngredient())
            .dosageAmount(entry.commonDosages().isEmpty() ? null : entry.commonDosages().get(0))
            .build();
    return Medication.named(entry.name(), metadata);
  }

  /** The whole catalog as candidate medications, in catalog order. */
  public static List<Medication> asCandidates() {
    return ENTRIES.stream().map(CommonMedicationCatalog::toMedication).toList();
  }

  private static String normalise(String term) {
    return term.trim().toLowerCase(Locale.ROOT);
  }
}
