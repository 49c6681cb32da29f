package dev.medimatch.matching;

import dev.medimatch.medication.Medication;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ranks a candidate set against a query term list.
 *
 * <p>Pipeline: score every candidate with {@link RelevanceScorer} -> drop candidates scoring at or
 * below the minimum relevance -> sort by score descending, ties keeping original candidate order
 * -> truncate to the maximum result count.
 *
 * <p>From {@code parallel-threshold} candidates upward the scoring step runs on a parallel stream.
 * Each score is written to the slot of its candidate's original index, so the ordering key is
 * fixed before any reordering and the output is identical to the sequential path.
 */
@Component
public class CandidateRanker {

  private static final Logger log = LoggerFactory.getLogger(CandidateRanker.class);

  private static final Comparator<ScoredCandidate> BY_SCORE_THEN_POSITION =
      Comparator.comparingDouble(ScoredCandidate::score)
          .reversed()
          .thenComparingInt(ScoredCandidate::position);

  private final RelevanceScorer scorer;
  private final double minRelevance;
  private final int defaultMaxResults;
  private final int parallelThreshold;

  public CandidateRanker(RelevanceScorer scorer, MatchingProperties properties) {
    this.scorer = scorer;
    this.minRelevance = properties.getMinRelevance();
    this.defaultMaxResults = properties.getMaxResults();
    this.parallelThreshold = properties.getParallelThreshold();
  }

  /**
   * Ranks candidates using the configured maximum result count.
   *
   * @param candidates candidate medications in store order
   * @param queryTerms normalised query terms
   * @return ranked candidates, best first; empty if either input is empty
   */
  public List<ScoredCandidate> rank(List<Medication> candidates, Set<String> queryTerms) {
    return rank(candidates, queryTerms, defaultMaxResults);
  }

  /**
   * Ranks candidates with an explicit maximum result count.
   *
   * @param candidates candidate medications in store order
   * @param queryTerms normalised query terms
   * @param maxResults maximum number of results to return (must be >= 1)
   * @return ranked candidates, best first; empty if either input is empty
   */
  public List<ScoredCandidate> rank(
      List<Medication> candidates, Set<String> queryTerms, int maxResults) {
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be at least 1");
    }
    if (candidates.isEmpty() || queryTerms.isEmpty()) {
      return List.of();
    }

    double[] scores = scoreAll(candidates, queryTerms);

    List<ScoredCandidate> relevant = new ArrayList<>();
    for (int i = 0; i < scores.length; i++) {
      if (scores[i] > minRelevance) {
        relevant.add(new ScoredCandidate(candidates.get(i), scores[i], i));
      }
    }
    log.debug(
        "Ranked {} candidates against {} terms: {} above threshold {}",
        candidates.size(),
        queryTerms.size(),
        relevant.size(),
        minRelevance);

    return relevant.stream().sorted(BY_SCORE_THEN_POSITION).limit(maxResults).toList();
  }

  private double[] scoreAll(List<Medication> candidates, Set<String> queryTerms) {
    double[] scores = new double[candidates.size()];
    IntStream indices = IntStream.range(0, candidates.size());
    if (candidates.size() >= parallelThreshold) {
      indices = indices.parallel();
    }
    indices.forEach(i -> scores[i] = scorer.score(queryTerms, candidates.get(i)));
    return scores;
  }
}
