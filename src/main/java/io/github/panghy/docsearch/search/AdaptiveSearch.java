package io.github.panghy.docsearch.search;

import io.github.panghy.docsearch.api.SearchRequest;
import io.github.panghy.docsearch.api.VectorStore;
import io.github.panghy.docsearch.model.Document;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repeats a search with a progressively looser score threshold until enough documents are found
 * or the attempt limit is reached.
 */
public final class AdaptiveSearch {
  private static final Logger LOG = LoggerFactory.getLogger(AdaptiveSearch.class);

  private final VectorStore store;
  private final AdaptiveSearchPolicy policy;

  public AdaptiveSearch(VectorStore store, AdaptiveSearchPolicy policy) {
    this.store = Objects.requireNonNull(store, "store");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public AdaptiveSearch(VectorStore store) {
    this(store, AdaptiveSearchPolicy.DEFAULT);
  }

  /**
   * Runs the loop. {@code base} supplies everything but the score threshold, which starts at the
   * policy's initial value.
   *
   * @return the documents of the last attempt
   */
  public List<Document> search(String query, SearchRequest base) {
    SearchRequest request = base == null ? SearchRequest.defaults() : base;
    double threshold = policy.initialThreshold();
    List<Document> found = List.of();
    int attempt = 0;
    while (attempt < policy.attemptLimit() && found.size() < policy.minDocuments()) {
      found = store.search(query, request.withScoreThreshold(threshold));
      LOG.debug("adaptive search attempt={} threshold={} found={}", attempt, threshold, found.size());
      threshold = Math.min(threshold + policy.step(), policy.maxThreshold());
      attempt++;
    }
    return found;
  }

  public AdaptiveSearchPolicy policy() {
    return policy;
  }
}
