package dev.medimatch.matching;

import dev.medimatch.medication.Medication;
import dev.medimatch.medication.MedicationMetadata;
import dev.medimatch.signal.Terms;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Derives the searchable term set of a medication: display name, then (when metadata is present)
 * generic name, brand names, active ingredient, dosage, colour label and shape label. Absent or
 * blank fields contribute nothing; notes and the external code are never terms.
 */
public final class SearchableTerms {

  private SearchableTerms() {}

  /**
   * Extracts the searchable terms of a medication.
   *
   * @param medication the medication
   * @return distinct normalised terms in extraction order; never empty since the name is always
   *     included
   */
  public static Set<String> of(Medication medication) {
    List<String> raw = new ArrayList<>();
    raw.add(medication.name());

    MedicationMetadata metadata = medication.metadata();
    if (metadata != null) {
      raw.add(metadata.genericName());
      raw.addAll(metadata.brandNames());
      raw.add(metadata.activeIngredient());
      raw.add(metadata.dosageAmount());
      if (metadata.pillColor() != null) {
        raw.add(metadata.pillColor().label());
      }
      if (metadata.pillShape() != null) {
        raw.add(metadata.pillShape().label());
      }
    }
    return Collections.unmodifiableSet(Terms.normaliseAll(raw));
  }
}
