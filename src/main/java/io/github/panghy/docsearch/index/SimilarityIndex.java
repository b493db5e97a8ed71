package io.github.panghy.docsearch.index;

import java.util.List;
import java.util.Set;

/**
 * Vectors held in insertion-ordered, dense slots {@code 0..count()-1}.
 *
 * <p>Implementations are not thread-safe; the owning store serializes access. The dimension is
 * fixed at construction and never changes.</p>
 */
public interface SimilarityIndex {

  int dimension();

  /** Number of vectors currently held. */
  int count();

  /**
   * Appends {@code vectors} in order, assigning slots {@code count() .. count()+n-1}.
   *
   * @throws IllegalArgumentException if any vector has the wrong dimension
   */
  void add(List<float[]> vectors);

  /**
   * Returns exactly {@code k} entries ordered by ascending distance. When the index holds fewer
   * than {@code k} vectors the tail is padded with {@link Neighbor#EMPTY}.
   */
  List<Neighbor> search(float[] query, int k);

  /**
   * Removes {@code slots} and compacts the survivors into {@code 0..count()-1}, preserving their
   * relative order. Unknown slots are ignored.
   *
   * @return number of vectors actually removed
   */
  int remove(Set<Integer> slots);

  /** Removes every vector. */
  void reset();

  /** Copy of the vector stored at {@code slot}. */
  float[] reconstruct(int slot);

  /** Copies of all vectors in slot order. */
  float[][] reconstructAll();
}
