package io.github.panghy.docsearch.embed;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.panghy.docsearch.util.Metrics;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Caffeine-backed decorator that memoizes text embeddings.
 *
 * <p>Near-duplicate detection re-embeds the text of each nearest neighbor; wrapping the store's
 * embedder with this cache turns those calls into lookups. Because embedders are deterministic,
 * cached and uncached embedders yield the same vectors.</p>
 */
public final class CachingEmbedder implements Embedder {
  private final Embedder delegate;
  private final Cache<String, float[]> cache;

  public CachingEmbedder(Embedder delegate, long maximumSize, Duration expireAfterAccess) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.cache = Caffeine.newBuilder()
        .maximumSize(maximumSize)
        .expireAfterAccess(expireAfterAccess)
        .recordStats()
        .build();
  }

  public CachingEmbedder(Embedder delegate) {
    this(delegate, 100_000, Duration.ofMinutes(10));
  }

  @Override
  public int dimension() {
    return delegate.dimension();
  }

  /** Embeds only the texts that are not cached, in one delegate batch, and fills the cache. */
  @Override
  public List<float[]> embedMany(List<String> texts) {
    Map<String, float[]> present = cache.getAllPresent(texts);
    LinkedHashSet<String> missing = new LinkedHashSet<>();
    for (String t : texts) if (!present.containsKey(t)) missing.add(t);
    Map<String, float[]> loaded = new HashMap<>(present);
    if (!missing.isEmpty()) {
      List<String> batch = new ArrayList<>(missing);
      List<float[]> vectors = delegate.embedMany(batch);
      if (vectors.size() != batch.size()) {
        throw new IllegalStateException(
            "embedder returned " + vectors.size() + " vectors for " + batch.size() + " texts");
      }
      for (int i = 0; i < batch.size(); i++) {
        cache.put(batch.get(i), vectors.get(i));
        loaded.put(batch.get(i), vectors.get(i));
      }
    }
    List<float[]> out = new ArrayList<>(texts.size());
    for (String t : texts) out.add(loaded.get(t).clone());
    return out;
  }

  public long estimatedSize() {
    return cache.estimatedSize();
  }

  public long hitCount() {
    return cache.stats().hitCount();
  }

  public long missCount() {
    return cache.stats().missCount();
  }

  /** Registers OTel observable gauges for cache size and hit/miss statistics. */
  public void registerMetrics(OpenTelemetry openTelemetry, Attributes base) {
    Meter meter = openTelemetry.getMeter(Metrics.INSTRUMENTATION_NAME);
    meter.gaugeBuilder("docsearch.embedding_cache.size")
        .ofLongs()
        .setDescription("Estimated cache size")
        .setUnit("entries")
        .buildWithCallback(obs -> obs.record(cache.estimatedSize(), base));
    meter.gaugeBuilder("docsearch.embedding_cache.hit_count")
        .ofLongs()
        .buildWithCallback(obs -> obs.record(cache.stats().hitCount(), base));
    meter.gaugeBuilder("docsearch.embedding_cache.miss_count")
        .ofLongs()
        .buildWithCallback(obs -> obs.record(cache.stats().missCount(), base));
  }
}
