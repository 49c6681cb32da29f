package dev.medimatch.identify;

import dev.medimatch.medication.Medication;
import java.util.List;
import java.util.Optional;

/**
 * Exact external-code lookup that short-circuits relevance ranking. Comparison is plain string
 * equality on the decoded payload; no normalisation is applied to barcode data.
 */
final class BarcodeShortcut {

  private BarcodeShortcut() {}

  /**
   * Finds the first candidate whose metadata external code equals the scanned code.
   *
   * @param externalCode the decoded barcode payload
   * @param candidates candidate medications in store order
   * @return the matching medication, or empty if none carries this code
   */
  static Optional<Medication> find(String externalCode, List<Medication> candidates) {
    for (Medication candidate : candidates) {
      if (externalCode.equals(candidate.externalCode())) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
