package dev.medimatch.identify;

import dev.medimatch.matching.ScoredCandidate;
import dev.medimatch.medication.Medication;

/**
 * A medication returned by identification, with the score it was ranked by.
 *
 * @param medication the identified medication
 * @param score relevance score in [0.0, 1.0]; 1.0 for a barcode match
 */
public record RankedMedication(Medication medication, double score) {

  static RankedMedication from(ScoredCandidate candidate) {
    return new RankedMedication(candidate.medication(), candidate.score());
  }

  static RankedMedication exact(Medication medication) {
    return new RankedMedication(medication, 1.0);
  }
}
