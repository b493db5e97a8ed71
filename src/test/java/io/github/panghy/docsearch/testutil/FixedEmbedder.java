package io.github.panghy.docsearch.testutil;

import io.github.panghy.docsearch.embed.Embedder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic embedder for tests. Registered texts map to fixed vectors (zero-padded); any other
 * text maps to a pseudo-random Gaussian vector seeded by the text, which in 32 dimensions is
 * practically never within the default dedup threshold of another text.
 */
public final class FixedEmbedder implements Embedder {
  public static final int DEFAULT_DIMENSION = 32;

  private final int dimension;
  private final Map<String, float[]> fixed = new ConcurrentHashMap<>();
  private final AtomicInteger calls = new AtomicInteger();
  private final AtomicInteger texts = new AtomicInteger();
  private volatile RuntimeException failure;
  private volatile long delayMillis;

  public FixedEmbedder(int dimension) {
    this.dimension = dimension;
  }

  public FixedEmbedder() {
    this(DEFAULT_DIMENSION);
  }

  /** Maps {@code text} to {@code prefix} followed by zeros. */
  public FixedEmbedder put(String text, float... prefix) {
    float[] v = new float[dimension];
    System.arraycopy(prefix, 0, v, 0, prefix.length);
    fixed.put(text, v);
    return this;
  }

  /** Every later call throws {@code e}; {@code null} restores normal behavior. */
  public void failWith(RuntimeException e) {
    this.failure = e;
  }

  public void delay(long millis) {
    this.delayMillis = millis;
  }

  /** Number of {@link #embedMany(List)} calls. */
  public int calls() {
    return calls.get();
  }

  /** Total texts embedded across all calls. */
  public int textsEmbedded() {
    return texts.get();
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public List<float[]> embedMany(List<String> input) {
    calls.incrementAndGet();
    texts.addAndGet(input.size());
    RuntimeException f = failure;
    if (f != null) throw f;
    if (delayMillis > 0) {
      try {
        Thread.sleep(delayMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(e);
      }
    }
    List<float[]> out = new ArrayList<>(input.size());
    for (String t : input) out.add(vectorOf(t));
    return out;
  }

  public float[] vectorOf(String text) {
    float[] v = fixed.get(text);
    if (v != null) return v.clone();
    Random r = new Random(text.hashCode());
    float[] h = new float[dimension];
    for (int i = 0; i < dimension; i++) h[i] = (float) r.nextGaussian();
    return h;
  }
}
