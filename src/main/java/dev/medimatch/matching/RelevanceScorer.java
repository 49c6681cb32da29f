package dev.medimatch.matching;

import dev.medimatch.medication.Medication;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Scores how well a query term list matches a medication's searchable terms.
 *
 * <p>Each query term is classified into a single {@link MatchTier} (exact, then partial, then
 * fuzzy; first match wins) and contributes that tier's weight. The score is the sum of
 * contributions divided by the number of query terms, so it always lies in [0.0, 1.0]. An empty
 * query scores 0.0.
 *
 * <p>Stateless apart from the configured fuzzy cutoff; safe to call from any thread.
 */
@Component
public class RelevanceScorer {

  private final int fuzzyMaxDistance;

  public RelevanceScorer(MatchingProperties properties) {
    this.fuzzyMaxDistance = properties.getFuzzyMaxDistance();
  }

  /**
   * Scores a query against a medication, deriving its terms with {@link SearchableTerms}.
   *
   * @param queryTerms normalised query terms
   * @param medication the candidate medication
   * @return relevance score in [0.0, 1.0]
   */
  public double score(Set<String> queryTerms, Medication medication) {
    return score(queryTerms, SearchableTerms.of(medication));
  }

  /**
   * Scores a query against an already extracted term set.
   *
   * @param queryTerms normalised query terms
   * @param recordTerms the medication's searchable terms
   * @return relevance score in [0.0, 1.0]
   */
  public double score(Set<String> queryTerms, Set<String> recordTerms) {
    if (queryTerms.isEmpty()) {
      return 0.0;
    }
    double total = 0.0;
    for (String query : queryTerms) {
      total += classify(query, recordTerms).weight();
    }
    return total / queryTerms.size();
  }

  /**
   * Classifies a single query term against a term set.
   *
   * @param query a normalised query term
   * @param recordTerms the medication's searchable terms
   * @return the first tier that matches, or {@link MatchTier#NONE}
   */
  public MatchTier classify(String query, Set<String> recordTerms) {
    if (recordTerms.contains(query)) {
      return MatchTier.EXACT;
    }
    for (String term : recordTerms) {
      if (term.contains(query) || query.contains(term)) {
        return MatchTier.PARTIAL;
      }
    }
    for (String term : recordTerms) {
      if (EditDistance.levenshtein(term, query) <= fuzzyMaxDistance) {
        return MatchTier.FUZZY;
      }
    }
    return MatchTier.NONE;
  }
}
