package dev.medimatch.matching;

import dev.medimatch.medication.Medication;

/**
 * A candidate medication paired with its relevance score. Lives only inside the ranking pipeline.
 *
 * @param medication the candidate
 * @param score relevance score in [0.0, 1.0]
 * @param position index of the candidate in the original candidate list, used as the tie-break
 */
public record ScoredCandidate(Medication medication, double score, int position) {}
