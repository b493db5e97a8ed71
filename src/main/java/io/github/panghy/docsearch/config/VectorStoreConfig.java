package io.github.panghy.docsearch.config;

import io.github.panghy.docsearch.embed.Embedder;
import io.github.panghy.docsearch.filter.TagFilterEngine;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.nio.file.Path;
import java.time.Duration;
import java.time.InstantSource;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a vector store instance rooted in a local folder.
 *
 * <p>Uses a builder, validates inputs, and exposes getters only. The config carries both the
 * retrieval parameters (dedup threshold, default k/fetch_k) and operational settings (rebuild pool,
 * persistence queue, time source, telemetry).</p>
 */
public final class VectorStoreConfig {

  private final Path folder;
  private final Embedder embedder;
  private final String indexName;

  private final double similarityThreshold;
  private final int dedupNeighbors;
  private final int defaultK;
  private final int defaultFetchK;
  private final double scoreThresholdOffset;
  private final int maxFilterTags;

  private final int rebuildThreads;
  private final int rebuildBatchSize;
  private final Duration embeddingTimeout;
  private final int saveQueueCapacity;
  private final boolean loadExisting;

  private final InstantSource instantSource;
  private final OpenTelemetry openTelemetry;
  private final Map<String, String> metricAttributes;

  private VectorStoreConfig(Builder b) {
    this.folder = Objects.requireNonNull(b.folder, "folder must not be null");
    this.embedder = Objects.requireNonNull(b.embedder, "embedder must not be null");
    this.indexName = requireFileName(b.indexName, "indexName");

    if (!(b.similarityThreshold > -1.0 && b.similarityThreshold <= 1.0)) {
      throw new IllegalArgumentException("similarityThreshold must be in (-1, 1]");
    }
    this.similarityThreshold = b.similarityThreshold;
    if (b.dedupNeighbors < 0) throw new IllegalArgumentException("dedupNeighbors must be >= 0");
    this.dedupNeighbors = b.dedupNeighbors;
    if (b.defaultK <= 0) throw new IllegalArgumentException("defaultK must be positive");
    this.defaultK = b.defaultK;
    if (b.defaultFetchK <= 0) throw new IllegalArgumentException("defaultFetchK must be positive");
    this.defaultFetchK = b.defaultFetchK;
    if (Double.isNaN(b.scoreThresholdOffset)) {
      throw new IllegalArgumentException("scoreThresholdOffset must be a number");
    }
    this.scoreThresholdOffset = b.scoreThresholdOffset;
    if (b.maxFilterTags <= 0) throw new IllegalArgumentException("maxFilterTags must be positive");
    this.maxFilterTags = b.maxFilterTags;

    if (b.rebuildThreads <= 0) throw new IllegalArgumentException("rebuildThreads must be positive");
    this.rebuildThreads = b.rebuildThreads;
    if (b.rebuildBatchSize <= 0) throw new IllegalArgumentException("rebuildBatchSize must be positive");
    this.rebuildBatchSize = b.rebuildBatchSize;
    this.embeddingTimeout = requirePositive(b.embeddingTimeout, "embeddingTimeout");
    if (b.saveQueueCapacity <= 0) throw new IllegalArgumentException("saveQueueCapacity must be positive");
    this.saveQueueCapacity = b.saveQueueCapacity;
    this.loadExisting = b.loadExisting;

    this.instantSource = Objects.requireNonNull(b.instantSource, "instantSource must not be null");
    this.openTelemetry = Objects.requireNonNull(b.openTelemetry, "openTelemetry must not be null");
    this.metricAttributes = Map.copyOf(b.metricAttributes);
  }

  private static String requireFileName(String s, String name) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
    if (s.contains("/") || s.contains("\\")) {
      throw new IllegalArgumentException(name + " must not contain path separators");
    }
    return s;
  }

  private static Duration requirePositive(Duration d, String name) {
    if (d == null) throw new IllegalArgumentException(name + " must not be null");
    if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive");
    return d;
  }

  /** Returns the folder holding {@code <name>.vectors} and {@code <name>.meta}. */
  public Path getFolder() {
    return folder;
  }

  /** Returns the embedder; its dimension fixes the index dimension. */
  public Embedder getEmbedder() {
    return embedder;
  }

  /** Returns the index name loaded on open and saved by default. */
  public String getIndexName() {
    return indexName;
  }

  /** Returns the cosine similarity above which a new document is a near-duplicate. */
  public double getSimilarityThreshold() {
    return similarityThreshold;
  }

  /** Returns how many nearest neighbors are compared for near-duplicates. */
  public int getDedupNeighbors() {
    return dedupNeighbors;
  }

  public int getDefaultK() {
    return defaultK;
  }

  public int getDefaultFetchK() {
    return defaultFetchK;
  }

  /** Returns the amount added to every caller-supplied score threshold. */
  public double getScoreThresholdOffset() {
    return scoreThresholdOffset;
  }

  /** Returns the largest tag list a search filter may expand. */
  public int getMaxFilterTags() {
    return maxFilterTags;
  }

  /** Returns the size of the worker pool used to re-embed documents during rebuild. */
  public int getRebuildThreads() {
    return rebuildThreads;
  }

  /** Returns how many documents each rebuild task embeds at once. */
  public int getRebuildBatchSize() {
    return rebuildBatchSize;
  }

  /** Returns the maximum time an embedding call may take. */
  public Duration getEmbeddingTimeout() {
    return embeddingTimeout;
  }

  /** Returns the capacity of the persistence request channel. */
  public int getSaveQueueCapacity() {
    return saveQueueCapacity;
  }

  /** Returns whether existing index files are loaded on open. */
  public boolean isLoadExisting() {
    return loadExisting;
  }

  /** Returns the time source (injectable for tests). */
  public InstantSource getInstantSource() {
    return instantSource;
  }

  public OpenTelemetry getOpenTelemetry() {
    return openTelemetry;
  }

  /** Additional metric attributes to add to emitted metrics. */
  public Map<String, String> getMetricAttributes() {
    return metricAttributes;
  }

  /** Creates a new builder for {@link VectorStoreConfig}. */
  public static Builder builder(Path folder, Embedder embedder) {
    return new Builder(folder, embedder);
  }

  /** Builder for {@link VectorStoreConfig}. */
  public static final class Builder {
    private final Path folder;
    private final Embedder embedder;

    private String indexName = "index";
    private double similarityThreshold = 0.9;
    private int dedupNeighbors = 2;
    private int defaultK = 5;
    private int defaultFetchK = 20;
    private double scoreThresholdOffset = 0.0;
    private int maxFilterTags = TagFilterEngine.DEFAULT_MAX_TAGS;
    private int rebuildThreads = 4;
    private int rebuildBatchSize = 64;
    private Duration embeddingTimeout = Duration.ofSeconds(60);
    private int saveQueueCapacity = 1024;
    private boolean loadExisting = true;
    private InstantSource instantSource = InstantSource.system();
    private OpenTelemetry openTelemetry;
    private final Map<String, String> metricAttributes = new HashMap<>();

    private Builder(Path folder, Embedder embedder) {
      this.folder = folder;
      this.embedder = embedder;
    }

    /** Sets the default index name. */
    public Builder indexName(String indexName) {
      this.indexName = indexName;
      return this;
    }

    /** Sets the near-duplicate cosine similarity threshold. */
    public Builder similarityThreshold(double similarityThreshold) {
      this.similarityThreshold = similarityThreshold;
      return this;
    }

    /** Sets how many nearest neighbors are compared for near-duplicates (0 disables dedup). */
    public Builder dedupNeighbors(int dedupNeighbors) {
      this.dedupNeighbors = dedupNeighbors;
      return this;
    }

    public Builder defaultK(int defaultK) {
      this.defaultK = defaultK;
      return this;
    }

    public Builder defaultFetchK(int defaultFetchK) {
      this.defaultFetchK = defaultFetchK;
      return this;
    }

    /** Sets the amount added to caller-supplied score thresholds. */
    public Builder scoreThresholdOffset(double offset) {
      this.scoreThresholdOffset = offset;
      return this;
    }

    public Builder maxFilterTags(int maxFilterTags) {
      this.maxFilterTags = maxFilterTags;
      return this;
    }

    /** Sets the rebuild worker pool size. */
    public Builder rebuildThreads(int rebuildThreads) {
      this.rebuildThreads = rebuildThreads;
      return this;
    }

    public Builder rebuildBatchSize(int rebuildBatchSize) {
      this.rebuildBatchSize = rebuildBatchSize;
      return this;
    }

    public Builder embeddingTimeout(Duration embeddingTimeout) {
      this.embeddingTimeout = embeddingTimeout;
      return this;
    }

    public Builder saveQueueCapacity(int saveQueueCapacity) {
      this.saveQueueCapacity = saveQueueCapacity;
      return this;
    }

    /** Enables/disables loading existing index files on open. */
    public Builder loadExisting(boolean loadExisting) {
      this.loadExisting = loadExisting;
      return this;
    }

    /**
     * Sets the time source used for validity checks at search time. Default document start times
     * are stamped when the {@link io.github.panghy.docsearch.model.Metadata} is built, from the
     * clock given to {@code Metadata.Builder#instantSource}; pass the same clock there when this
     * one is not the system clock.
     */
    public Builder instantSource(InstantSource instantSource) {
      this.instantSource = instantSource;
      return this;
    }

    /** Sets the telemetry handle; defaults to {@link GlobalOpenTelemetry#get()}. */
    public Builder openTelemetry(OpenTelemetry openTelemetry) {
      this.openTelemetry = openTelemetry;
      return this;
    }

    /** Adds a metric attribute (key/value) to be included on metrics. */
    public Builder metricAttribute(String key, String value) {
      this.metricAttributes.put(key, value);
      return this;
    }

    /** Builds the immutable {@link VectorStoreConfig}. */
    public VectorStoreConfig build() {
      if (openTelemetry == null) openTelemetry = GlobalOpenTelemetry.get();
      return new VectorStoreConfig(this);
    }
  }
}
