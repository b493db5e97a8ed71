package io.github.panghy.docsearch.index;

import io.github.panghy.docsearch.util.Distances;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Exact nearest-neighbor index scoring every stored vector by squared L2 distance.
 *
 * <p>Removal compacts eagerly, so slot numbers are always dense.</p>
 */
public final class FlatL2Index implements SimilarityIndex {
  private final int dimension;
  private final List<float[]> vectors = new ArrayList<>();

  public FlatL2Index(int dimension) {
    if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
    this.dimension = dimension;
  }

  /** Creates an index pre-populated with {@code rows} in slot order. */
  public static FlatL2Index of(int dimension, float[][] rows) {
    FlatL2Index ix = new FlatL2Index(dimension);
    List<float[]> list = new ArrayList<>(rows.length);
    Collections.addAll(list, rows);
    ix.add(list);
    return ix;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public int count() {
    return vectors.size();
  }

  @Override
  public void add(List<float[]> batch) {
    for (float[] v : batch) checkDimension(v);
    for (float[] v : batch) vectors.add(v.clone());
  }

  @Override
  public List<Neighbor> search(float[] query, int k) {
    if (k <= 0) throw new IllegalArgumentException("k must be positive");
    checkDimension(query);
    // max-heap of the best k seen so far
    PriorityQueue<Neighbor> best =
        new PriorityQueue<>(Math.max(1, Math.min(k, vectors.size())), Comparator.reverseOrder());
    for (int slot = 0; slot < vectors.size(); slot++) {
      Neighbor n = new Neighbor(slot, Distances.l2Squared(query, vectors.get(slot)));
      if (best.size() < k) {
        best.add(n);
      } else if (n.compareTo(best.peek()) < 0) {
        best.poll();
        best.add(n);
      }
    }
    List<Neighbor> out = new ArrayList<>(best);
    Collections.sort(out);
    while (out.size() < k) out.add(Neighbor.EMPTY);
    return out;
  }

  @Override
  public int remove(Set<Integer> slots) {
    if (slots.isEmpty()) return 0;
    List<float[]> kept = new ArrayList<>(vectors.size());
    for (int slot = 0; slot < vectors.size(); slot++) {
      if (!slots.contains(slot)) kept.add(vectors.get(slot));
    }
    int removed = vectors.size() - kept.size();
    vectors.clear();
    vectors.addAll(kept);
    return removed;
  }

  @Override
  public void reset() {
    vectors.clear();
  }

  @Override
  public float[] reconstruct(int slot) {
    return vectors.get(slot).clone();
  }

  @Override
  public float[][] reconstructAll() {
    float[][] out = new float[vectors.size()][];
    for (int i = 0; i < out.length; i++) out[i] = vectors.get(i).clone();
    return out;
  }

  private void checkDimension(float[] v) {
    if (v == null || v.length != dimension) {
      throw new IllegalArgumentException(
          "vector dimension " + (v == null ? "null" : v.length) + " != index dimension " + dimension);
    }
  }
}
