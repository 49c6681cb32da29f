package dev.medimatch.identify;

import dev.medimatch.matching.CandidateRanker;
import dev.medimatch.matching.RelevanceScorer;
import dev.medimatch.medication.Medication;
import dev.medimatch.signal.QuerySignals;
import dev.medimatch.signal.SignalAggregator;
import dev.medimatch.signal.Terms;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Identification entry point: turns one request's recognition signals and the caller's candidate
 * set into an ordered list of likely medications.
 *
 * <p>Pipeline: barcode shortcut (if the signals carry an external code and a candidate has it,
 * return that candidate alone at score 1.0) -> aggregate signals into query terms -> score and rank
 * candidates via {@link CandidateRanker}.
 *
 * <p>Holds no per-request state; concurrent requests need no coordination.
 */
@Service
public class IdentificationService {

  private static final Logger log = LoggerFactory.getLogger(IdentificationService.class);

  private final CandidateRanker ranker;
  private final RelevanceScorer scorer;

  public IdentificationService(CandidateRanker ranker, RelevanceScorer scorer) {
    this.ranker = ranker;
    this.scorer = scorer;
  }

  /**
   * Identifies the medications that best match the signals.
   *
   * @param signals the evidence captured for this request
   * @param candidates the caller's current medications, in store order
   * @return matching medications, best first, at most the configured maximum
   */
  public List<Medication> identify(QuerySignals signals, List<Medication> candidates) {
    return identifyScored(signals, candidates).stream().map(RankedMedication::medication).toList();
  }

  /**
   * Same as {@link #identify} but keeps each result's score.
   *
   * @param signals the evidence captured for this request
   * @param candidates the caller's current medications, in store order
   * @return ranked medications with scores, best first
   * @throws IllegalArgumentException if two candidates share an id
   */
  public List<RankedMedication> identifyScored(QuerySignals signals, List<Medication> candidates) {
    Objects.requireNonNull(signals, "signals");
    Objects.requireNonNull(candidates, "candidates");
    requireUniqueIds(candidates);

    if (signals.hasExternalCode()) {
      Optional<Medication> barcodeMatch = BarcodeShortcut.find(signals.externalCode(), candidates);
      if (barcodeMatch.isPresent()) {
        log.debug("Barcode shortcut matched medication {}", barcodeMatch.get().id());
        return List.of(RankedMedication.exact(barcodeMatch.get()));
      }
      log.debug("No candidate carries the scanned code; falling back to relevance ranking");
    }

    Set<String> queryTerms = SignalAggregator.aggregate(signals);
    if (queryTerms.isEmpty()) {
      log.debug("Signals produced no query terms; returning no matches");
      return List.of();
    }
    return ranker.rank(candidates, queryTerms).stream().map(RankedMedication::from).toList();
  }

  /**
   * Scores a single medication against raw query terms, for callers that apply their own ranking
   * policy. Terms are normalised and deduplicated before scoring.
   *
   * @param queryTerms raw query terms
   * @param medication the medication to score
   * @return relevance score in [0.0, 1.0]
   */
  public double score(Collection<String> queryTerms, Medication medication) {
    Objects.requireNonNull(queryTerms, "queryTerms");
    Objects.requireNonNull(medication, "medication");
    return scorer.score(Terms.normaliseAll(queryTerms), medication);
  }

  private static void requireUniqueIds(List<Medication> candidates) {
    Set<UUID> seen = new HashSet<>();
    for (Medication candidate : candidates) {
      if (!seen.add(candidate.id())) {
        throw new IllegalArgumentException("Duplicate medication id: " + candidate.id());
      }
    }
  }
}
