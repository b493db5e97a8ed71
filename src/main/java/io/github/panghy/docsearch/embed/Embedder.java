package io.github.panghy.docsearch.embed;

import java.util.List;

/**
 * Text to fixed-dimension vector function. Implementations wrap an embedding model and must be
 * deterministic for a given model version.
 */
public interface Embedder {

  /**
   * Output dimension of every vector produced by {@link #embedMany(List)}. Queried once when a
   * store is opened; the store's index dimension never changes afterwards.
   */
  int dimension();

  /**
   * Embeds {@code texts} in one batch.
   *
   * @param texts input texts
   * @return one vector per input, in input order, each of length {@link #dimension()}
   */
  List<float[]> embedMany(List<String> texts);

  /** Embeds a single text. */
  default float[] embed(String text) {
    return embedMany(List.of(text)).get(0);
  }
}
