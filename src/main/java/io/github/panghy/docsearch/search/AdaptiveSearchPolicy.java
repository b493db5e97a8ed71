package io.github.panghy.docsearch.search;

/**
 * Knobs of the threshold-relaxing search loop.
 *
 * @param attemptLimit     maximum number of searches
 * @param minDocuments     stop as soon as at least this many documents are found
 * @param initialThreshold score threshold of the first attempt
 * @param step             amount the threshold grows after each short attempt
 */
public record AdaptiveSearchPolicy(int attemptLimit, int minDocuments, double initialThreshold, double step) {

  public static final AdaptiveSearchPolicy DEFAULT = new AdaptiveSearchPolicy(10, 1, 0.6, 0.05);

  public AdaptiveSearchPolicy {
    if (attemptLimit <= 0) throw new IllegalArgumentException("attemptLimit must be positive");
    if (minDocuments <= 0) throw new IllegalArgumentException("minDocuments must be positive");
    if (Double.isNaN(initialThreshold)) throw new IllegalArgumentException("initialThreshold must be a number");
    if (!(step >= 0.0)) throw new IllegalArgumentException("step must be >= 0");
  }

  /** Upper bound the threshold never exceeds: {@code initial + step * attemptLimit}. */
  public double maxThreshold() {
    return initialThreshold + step * attemptLimit;
  }
}
