package io.github.panghy.docsearch.index;

/**
 * One search hit from a {@link SimilarityIndex}.
 *
 * @param slot     dense 0-based position in the index, or {@code -1} for an empty result slot
 * @param distance squared L2 distance to the query (lower is more similar)
 */
public record Neighbor(int slot, double distance) implements Comparable<Neighbor> {

  /** Padding entry returned when the index holds fewer than {@code k} vectors. */
  public static final Neighbor EMPTY = new Neighbor(-1, Double.POSITIVE_INFINITY);

  public boolean isEmpty() {
    return slot < 0;
  }

  /** Ascending by distance, ties broken by lower slot. */
  @Override
  public int compareTo(Neighbor other) {
    int c = Double.compare(distance, other.distance);
    return c != 0 ? c : Integer.compare(slot, other.slot);
  }
}
