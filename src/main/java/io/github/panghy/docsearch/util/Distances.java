package io.github.panghy.docsearch.util;

/**
 * Distance and similarity functions used by the flat index and near-duplicate detection.
 */
public final class Distances {
  private Distances() {}

  /**
   * Squared Euclidean distance, the score reported by the exact index (lower is more similar).
   *
   * @param a vector A (must be same length as B)
   * @param b vector B
   * @return sum of squared component differences
   */
  public static double l2Squared(float[] a, float[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      double d = (double) a[i] - b[i];
      sum += d * d;
    }
    return sum;
  }

  public static double dot(float[] a, float[] b) {
    double s = 0.0;
    for (int i = 0; i < a.length; i++) s += (double) a[i] * b[i];
    return s;
  }

  public static double norm(float[] a) {
    double s = 0.0;
    for (float v : a) s += (double) v * v;
    return Math.sqrt(s);
  }

  /**
   * Cosine similarity of two vectors.
   *
   * @return similarity in [-1, 1] (0 if either has zero norm)
   */
  public static double cosine(float[] a, float[] b) {
    double n = norm(a) * norm(b);
    if (n == 0.0) return 0.0;
    return dot(a, b) / n;
  }
}
