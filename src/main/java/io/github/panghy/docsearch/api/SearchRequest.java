package io.github.panghy.docsearch.api;

import io.github.panghy.docsearch.model.Metadata;

/**
 * Per-call search options.
 *
 * <ul>
 *   <li>k: maximum number of documents returned; {@code null} uses the store default</li>
 *   <li>filter: metadata whose tags are expanded into accepted tag orderings; {@code null} or no
 *       tags means unfiltered</li>
 *   <li>fetchK: candidates pulled from the index when a filter applies; {@code null} uses the
 *       store default</li>
 *   <li>scoreThreshold: keep only candidates whose distance is at most this value; {@code null}
 *       disables the check</li>
 *   <li>powerset: expand tags with the full powerset strategy (true) or the priority strategy</li>
 * </ul>
 */
public record SearchRequest(Integer k, Metadata filter, Integer fetchK, Double scoreThreshold, boolean powerset) {

  public SearchRequest {
    if (k != null && k <= 0) throw new IllegalArgumentException("k must be positive");
    if (fetchK != null && fetchK <= 0) throw new IllegalArgumentException("fetchK must be positive");
    if (scoreThreshold != null && scoreThreshold.isNaN()) {
      throw new IllegalArgumentException("scoreThreshold must be a number");
    }
  }

  /** Unfiltered request using store defaults. */
  public static SearchRequest defaults() {
    return builder().build();
  }

  public static SearchRequest ofK(int k) {
    return builder().k(k).build();
  }

  /** Copy with a different score threshold. */
  public SearchRequest withScoreThreshold(Double threshold) {
    return new SearchRequest(k, filter, fetchK, threshold, powerset);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Fluent builder for per-call options. */
  public static final class Builder {
    private Integer k;
    private Metadata filter;
    private Integer fetchK;
    private Double scoreThreshold;
    private boolean powerset = true;

    public Builder k(int v) {
      this.k = v;
      return this;
    }

    public Builder filter(Metadata v) {
      this.filter = v;
      return this;
    }

    /** Filter on the given tags, in priority order. */
    public Builder tags(String... tags) {
      this.filter = Metadata.builder().tags(tags).build();
      return this;
    }

    public Builder fetchK(int v) {
      this.fetchK = v;
      return this;
    }

    public Builder scoreThreshold(Double v) {
      this.scoreThreshold = v;
      return this;
    }

    public Builder powerset(boolean v) {
      this.powerset = v;
      return this;
    }

    public SearchRequest build() {
      return new SearchRequest(k, filter, fetchK, scoreThreshold, powerset);
    }
  }
}
