package dev.medimatch.matching;

/**
 * How a single query term matched a medication's term set. Tiers are tried in declaration order
 * and the first one that matches decides the term's contribution.
 */
public enum MatchTier {
  /** The query term equals one of the medication's terms. */
  EXACT(1.0),
  /** The query term contains, or is contained in, one of the medication's terms. */
  PARTIAL(0.5),
  /** The query term is within the fuzzy edit-distance cutoff of one of the medication's terms. */
  FUZZY(0.3),
  NONE(0.0);

  private final double weight;

  MatchTier(double weight) {
    this.weight = weight;
  }

  /** Contribution of one query term matched at this tier. */
  public double weight() {
    return weight;
  }
}
