package dev.medimatch.matching;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for relevance scoring and ranking.
 *
 * <p>Properties are bound from {@code medimatch.matching.*} in application.yml.
 *
 * <ul>
 *   <li>{@code min-relevance} - candidates must score strictly above this to be returned (default
 *       0.1, bounded [0.0, 1.0))
 *   <li>{@code max-results} - maximum number of ranked results (default 10, bounded [1, 100])
 *   <li>{@code fuzzy-max-distance} - largest edit distance still counted as a fuzzy match,
 *       inclusive (default 2, bounded [0, 10])
 *   <li>{@code parallel-threshold} - candidate count from which scores are computed on a parallel
 *       stream (default 512, at least 1)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "medimatch.matching")
public class MatchingProperties {

  private static final Logger log = LoggerFactory.getLogger(MatchingProperties.class);

  private double minRelevance = 0.1;
  private int maxResults = 10;
  private int fuzzyMaxDistance = 2;
  private int parallelThreshold = 512;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (minRelevance < 0.0 || minRelevance >= 1.0) {
      throw new IllegalStateException(
          "medimatch.matching.min-relevance must be in [0.0, 1.0), got: " + minRelevance);
    }
    if (maxResults < 1 || maxResults > 100) {
      throw new IllegalStateException(
          "medimatch.matching.max-results must be in [1, 100], got: " + maxResults);
    }
    if (fuzzyMaxDistance < 0 || fuzzyMaxDistance > 10) {
      throw new IllegalStateException(
          "medimatch.matching.fuzzy-max-distance must be in [0, 10], got: " + fuzzyMaxDistance);
    }
    if (parallelThreshold < 1) {
      throw new IllegalStateException(
          "medimatch.matching.parallel-threshold must be at least 1, got: " + parallelThreshold);
    }
    log.info(
        "Matching configured: min-relevance={}, max-results={}, fuzzy-max-distance={}, "
            + "parallel-threshold={}",
        minRelevance,
        maxResults,
        fuzzyMaxDistance,
        parallelThreshold);
  }

  public double getMinRelevance() {
    return minRelevance;
  }

  public void setMinRelevance(double minRelevance) {
    this.minRelevance = minRelevance;
  }

  public int getMaxResults() {
    return maxResults;
  }

  public void setMaxResults(int maxResults) {
    this.maxResults = maxResults;
  }

  public int getFuzzyMaxDistance() {
    return fuzzyMaxDistance;
  }

  public void setFuzzyMaxDistance(int fuzzyMaxDistance) {
    this.fuzzyMaxDistance = fuzzyMaxDistance;
  }

  public int getParallelThreshold() {
    return parallelThreshold;
  }

  public void setParallelThreshold(int parallelThreshold) {
    this.parallelThreshold = parallelThreshold;
  }
}
