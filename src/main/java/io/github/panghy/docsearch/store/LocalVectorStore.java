package io.github.panghy.docsearch.store;

import io.github.panghy.docsearch.DocumentNotFoundException;
import io.github.panghy.docsearch.EmbeddingUnavailableException;
import io.github.panghy.docsearch.IndexConfigurationException;
import io.github.panghy.docsearch.PersistenceException;
import io.github.panghy.docsearch.StoreConsistencyException;
import io.github.panghy.docsearch.ValidationException;
import io.github.panghy.docsearch.VectorStoreException;
import io.github.panghy.docsearch.api.RemovalResult;
import io.github.panghy.docsearch.api.ScoredDocument;
import io.github.panghy.docsearch.api.SearchRequest;
import io.github.panghy.docsearch.api.StoreStats;
import io.github.panghy.docsearch.api.VectorStore;
import io.github.panghy.docsearch.config.VectorStoreConfig;
import io.github.panghy.docsearch.embed.CachingEmbedder;
import io.github.panghy.docsearch.embed.Embedder;
import io.github.panghy.docsearch.filter.MetadataFilter;
import io.github.panghy.docsearch.filter.TagFilterEngine;
import io.github.panghy.docsearch.index.DocStore;
import io.github.panghy.docsearch.index.FlatL2Index;
import io.github.panghy.docsearch.index.IndexMapping;
import io.github.panghy.docsearch.index.Neighbor;
import io.github.panghy.docsearch.index.SimilarityIndex;
import io.github.panghy.docsearch.model.Document;
import io.github.panghy.docsearch.persist.IndexFiles;
import io.github.panghy.docsearch.persist.PersistedState;
import io.github.panghy.docsearch.persist.PersistenceManager;
import io.github.panghy.docsearch.persist.SnapshotCodec;
import io.github.panghy.docsearch.proto.StoreSnapshot;
import io.github.panghy.docsearch.util.Distances;
import io.github.panghy.docsearch.util.Hashing;
import io.github.panghy.docsearch.util.Metrics;
import io.opentelemetry.api.metrics.ObservableLongGauge;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VectorStore} holding an exact L2 index, the document table and the slot mapping in memory,
 * persisted to a local folder by a {@link PersistenceManager}.
 *
 * <p>Every mutation validates its input and computes all embeddings and dedup verdicts before it
 * touches a shared structure, then applies index, table and mapping changes under the write lock
 * with no further fallible step.</p>
 */
public final class LocalVectorStore implements VectorStore {
  private static final Logger LOG = LoggerFactory.getLogger(LocalVectorStore.class);

  private final VectorStoreConfig config;
  private final Embedder embedder;
  private final int dimension;
  private final Metrics metrics;
  private final IndexFiles files;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final DocStore docs = new DocStore();
  private SimilarityIndex index;
  private IndexMapping mapping = new IndexMapping();
  private final AtomicInteger documentCount = new AtomicInteger();

  private final ExecutorService embedPool;
  private final ExecutorService rebuildPool;
  private final PersistenceManager persistence;
  private final ObservableLongGauge documentsGauge;

  LocalVectorStore(VectorStoreConfig config, IndexFiles files) throws IndexConfigurationException {
    this.config = Objects.requireNonNull(config, "config");
    this.files = Objects.requireNonNull(files, "files");
    this.embedder = config.getEmbedder();
    this.dimension = embedder.dimension();
    if (dimension <= 0) {
      throw new IndexConfigurationException("embedder dimension must be positive, got " + dimension);
    }
    this.metrics = new Metrics(config.getOpenTelemetry(), config.getMetricAttributes());
    this.index = new FlatL2Index(dimension);
    try {
      Files.createDirectories(config.getFolder());
    } catch (IOException e) {
      throw new IndexConfigurationException("cannot create store folder " + config.getFolder(), e);
    }
    if (config.isLoadExisting()) load(config.getIndexName());

    this.embedPool = Executors.newCachedThreadPool(daemonThreads("docsearch-embed"));
    this.rebuildPool =
        Executors.newFixedThreadPool(config.getRebuildThreads(), daemonThreads("docsearch-rebuild"));
    this.persistence = new PersistenceManager(files, this::captureForSave, config.getSaveQueueCapacity(), metrics);
    this.documentsGauge = metrics.gauge(
        "docsearch.store.documents", "Documents held by the store", documentCount::get);
    if (embedder instanceof CachingEmbedder) {
      ((CachingEmbedder) embedder).registerMetrics(config.getOpenTelemetry(), metrics.base());
    }
  }

  /** Opens a store over {@code config.getFolder()} and starts its persistence worker. */
  public static LocalVectorStore open(VectorStoreConfig config) throws IndexConfigurationException {
    return open(config, new IndexFiles(config.getFolder()));
  }

  /** Opens a store with a caller-provided file layer. */
  public static LocalVectorStore open(VectorStoreConfig config, IndexFiles files)
      throws IndexConfigurationException {
    LocalVectorStore store = new LocalVectorStore(config, files);
    store.persistence.start();
    LOG.info("opened store folder={} index={} dimension={} documents={}", config.getFolder(),
        config.getIndexName(), store.dimension, store.documentCount.get());
    return store;
  }

  private void load(String name) throws IndexConfigurationException {
    if (!files.exists(name)) {
      if (files.anyExists(name)) {
        throw new IndexConfigurationException(
            "index " + name + " in " + files.folder() + " is incomplete: need both .vectors and .meta");
      }
      LOG.debug("no persisted index {} in {}; starting empty", name, files.folder());
      return;
    }
    IndexFiles.VectorsFile vectors;
    StoreSnapshot snapshot;
    try {
      vectors = files.readVectors(name);
      snapshot = files.readMeta(name);
    } catch (IOException e) {
      throw new IndexConfigurationException("cannot read index " + name + " from " + files.folder(), e);
    }
    if (vectors.dimension() != dimension || snapshot.getDimension() != dimension) {
      throw new IndexConfigurationException("index " + name + " has dimension " + vectors.dimension()
          + " but the embedder produces " + dimension);
    }
    Map<String, Document> loadedDocs = SnapshotCodec.decodeDocuments(snapshot);
    IndexMapping loadedMapping;
    try {
      loadedMapping = IndexMapping.fromEntries(SnapshotCodec.decodeMapping(snapshot));
    } catch (StoreConsistencyException e) {
      throw new IndexConfigurationException("index " + name + " has an invalid slot mapping", e);
    }
    if (loadedMapping.size() != vectors.rows().length || loadedMapping.size() != loadedDocs.size()) {
      throw new IndexConfigurationException("index " + name + " is inconsistent: documents="
          + loadedDocs.size() + " mapping=" + loadedMapping.size() + " vectors=" + vectors.rows().length);
    }
    for (int slot = 0; slot < loadedMapping.size(); slot++) {
      if (!loadedDocs.containsKey(loadedMapping.idAt(slot))) {
        throw new IndexConfigurationException(
            "index " + name + " maps slot " + slot + " to unknown document " + loadedMapping.idAt(slot));
      }
    }
    loadedDocs.forEach(docs::put);
    this.index = FlatL2Index.of(dimension, vectors.rows());
    this.mapping = loadedMapping;
    documentCount.set(docs.size());
    LOG.info("loaded index {} documents={}", name, docs.size());
  }

  @Override
  public List<Document> addDocuments(List<Document> documents) {
    return addDocuments(documents, null);
  }

  @Override
  public List<Document> addDocuments(List<Document> documents, List<String> ids) {
    return addDocuments(documents, ids, config.getSimilarityThreshold());
  }

  @Override
  public List<Document> addDocuments(List<Document> documents, List<String> ids, double similarityThreshold) {
    if (!(similarityThreshold > -1.0 && similarityThreshold <= 1.0)) {
      throw new ValidationException("similarityThreshold must be in (-1, 1], got " + similarityThreshold);
    }
    if (documents == null) throw new ValidationException("documents must not be null");
    for (Document d : documents) {
      if (d == null) throw new ValidationException("documents must not contain null");
    }
    List<String> storageIds = resolveIds(documents, ids);
    if (documents.isEmpty()) return List.of();

    List<String> texts = new ArrayList<>(documents.size());
    for (Document d : documents) texts.add(d.pageContent());
    List<float[]> vectors = embed(texts);

    lock.writeLock().lock();
    try {
      for (String id : storageIds) {
        if (docs.contains(id)) throw new ValidationException("storage id already stored: " + id);
      }
      boolean[] duplicate = findDuplicates(vectors, similarityThreshold);

      List<float[]> acceptedVectors = new ArrayList<>();
      List<String> acceptedIds = new ArrayList<>();
      List<Document> accepted = new ArrayList<>();
      for (int i = 0; i < documents.size(); i++) {
        if (duplicate[i]) continue;
        acceptedVectors.add(vectors.get(i));
        acceptedIds.add(storageIds.get(i));
        accepted.add(documents.get(i));
      }
      index.add(acceptedVectors);
      for (int i = 0; i < accepted.size(); i++) docs.put(acceptedIds.get(i), accepted.get(i));
      mapping.extend(acceptedIds);
      documentCount.set(docs.size());

      int skipped = documents.size() - accepted.size();
      metrics.addAccepted.add(accepted.size(), metrics.base());
      if (skipped > 0) metrics.addDuplicates.add(skipped, metrics.base());
      LOG.debug("added {} document(s), skipped {} near-duplicate(s)", accepted.size(), skipped);
      return List.copyOf(accepted);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private static List<String> resolveIds(List<Document> documents, List<String> ids) {
    if (ids == null) {
      List<String> generated = new ArrayList<>(documents.size());
      for (int i = 0; i < documents.size(); i++) generated.add(Hashing.randomStorageId());
      return generated;
    }
    if (ids.size() != documents.size()) {
      throw new ValidationException(
          "got " + ids.size() + " ids for " + documents.size() + " documents");
    }
    Set<String> seen = new HashSet<>();
    for (String id : ids) {
      if (id == null || id.isEmpty()) throw new ValidationException("storage ids must not be empty");
      if (!seen.add(id)) throw new ValidationException("duplicate storage id in request: " + id);
    }
    return List.copyOf(ids);
  }

  /**
   * Marks each new vector that is too similar to one of its nearest stored neighbors or to a vector
   * accepted earlier in the same batch. Neighbor vectors are recomputed from their text. Caller holds
   * the write lock; nothing is mutated.
   */
  private boolean[] findDuplicates(List<float[]> vectors, double threshold) {
    boolean[] duplicate = new boolean[vectors.size()];
    int neighbors = config.getDedupNeighbors();
    if (neighbors == 0) return duplicate;

    List<List<Integer>> neighborSlots = new ArrayList<>(vectors.size());
    LinkedHashSet<Integer> uniqueSlots = new LinkedHashSet<>();
    for (float[] v : vectors) {
      List<Integer> slots = new ArrayList<>(neighbors);
      if (index.count() > 0) {
        for (Neighbor n : index.search(v, neighbors)) {
          if (n.isEmpty()) continue;
          slots.add(n.slot());
          uniqueSlots.add(n.slot());
        }
      }
      neighborSlots.add(slots);
    }

    Map<Integer, float[]> neighborVectors = new HashMap<>();
    if (!uniqueSlots.isEmpty()) {
      List<Integer> ordered = new ArrayList<>(uniqueSlots);
      List<String> texts = new ArrayList<>(ordered.size());
      for (int slot : ordered) texts.add(resolve(slot).pageContent());
      List<float[]> recomputed = embed(texts);
      for (int i = 0; i < ordered.size(); i++) neighborVectors.put(ordered.get(i), recomputed.get(i));
    }

    List<float[]> acceptedInBatch = new ArrayList<>();
    for (int i = 0; i < vectors.size(); i++) {
      float[] v = vectors.get(i);
      for (int slot : neighborSlots.get(i)) {
        double sim = Distances.cosine(v, neighborVectors.get(slot));
        if (sim > threshold) {
          LOG.debug("near-duplicate of slot {} (similarity {})", slot, sim);
          duplicate[i] = true;
          break;
        }
      }
      if (!duplicate[i]) {
        for (float[] earlier : acceptedInBatch) {
          if (Distances.cosine(v, earlier) > threshold) {
            duplicate[i] = true;
            break;
          }
        }
      }
      if (!duplicate[i]) acceptedInBatch.add(v);
    }
    return duplicate;
  }

  @Override
  public RemovalResult removeDocumentsById(List<String> ids) {
    lock.writeLock().lock();
    try {
      if (ids == null) return clearLocked();
      return removeLocked(ids);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private RemovalResult clearLocked() {
    int total = docs.size();
    Map<String, Document> all = docs.snapshot();
    index.reset();
    mapping.clear();
    docs.clear();
    documentCount.set(0);
    metrics.removeCount.add(total, metrics.base());
    LOG.info("cleared store; removed {} document(s)", total);
    return new RemovalResult(total, total, new ArrayList<>(all.keySet()), new ArrayList<>(all.values()));
  }

  private RemovalResult removeLocked(List<String> ids) {
    if (ids.isEmpty()) throw new ValidationException("ids must not be empty");
    Set<String> unique = new LinkedHashSet<>(ids);
    if (unique.size() != ids.size()) throw new ValidationException("ids must not contain duplicates");

    int total = docs.size();
    Set<Integer> slots = new HashSet<>();
    for (String id : ids) {
      if (!docs.contains(id)) throw new DocumentNotFoundException("no document with storage id " + id);
      int slot = mapping.slotOf(id);
      if (slot < 0) throw new StoreConsistencyException("document " + id + " has no index slot");
      slots.add(slot);
    }

    int removedVectors = index.remove(slots);
    mapping.removeSlots(slots);
    List<Document> removed = new ArrayList<>(ids.size());
    for (String id : ids) removed.add(docs.remove(id));
    documentCount.set(docs.size());
    if (removedVectors != slots.size() || index.count() != mapping.size()) {
      throw new StoreConsistencyException("index removed " + removedVectors + " of " + slots.size()
          + " slots; index=" + index.count() + " mapping=" + mapping.size());
    }
    metrics.removeCount.add(removed.size(), metrics.base());
    LOG.debug("removed {} of {} document(s)", removed.size(), total);
    return new RemovalResult(removed.size(), total, ids, removed);
  }

  @Override
  public RemovalResult deleteDocumentsByIds(Collection<String> metadataIds) {
    if (metadataIds == null || metadataIds.isEmpty()) {
      throw new ValidationException("metadata ids must not be empty");
    }
    Set<String> targets = new HashSet<>(metadataIds);
    lock.writeLock().lock();
    try {
      List<String> storageIds = new ArrayList<>();
      for (var e : docs.snapshot().entrySet()) {
        if (targets.contains(e.getValue().metadata().getIds())) storageIds.add(e.getKey());
      }
      if (storageIds.isEmpty()) {
        LOG.debug("no documents match metadata ids {}", metadataIds);
        return RemovalResult.none(docs.size());
      }
      return removeLocked(storageIds);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<Document> search(String query, SearchRequest request) {
    List<ScoredDocument> hits = similaritySearchWithScore(query, request);
    List<Document> out = new ArrayList<>(hits.size());
    for (ScoredDocument h : hits) out.add(h.document());
    return out;
  }

  @Override
  public List<ScoredDocument> similaritySearchWithScore(String query, SearchRequest request) {
    Objects.requireNonNull(query, "query");
    SearchRequest req = request == null ? SearchRequest.defaults() : request;
    int k = req.k() != null ? req.k() : config.getDefaultK();
    int fetchK = req.fetchK() != null ? req.fetchK() : config.getDefaultFetchK();
    Optional<MetadataFilter> filter = req.filter() == null
        ? Optional.empty()
        : TagFilterEngine.toFilter(req.filter(), req.powerset(), config.getMaxFilterTags());

    Span span = metrics.tracer()
        .spanBuilder("docsearch.search")
        .setSpanKind(SpanKind.INTERNAL)
        .setAttribute("k", k)
        .setAttribute("filtered", filter.isPresent())
        .startSpan();
    long t0 = System.nanoTime();
    try {
      float[] q = embed(List.of(query)).get(0);
      int wanted = filter.isPresent() ? fetchK : k;

      List<ScoredDocument> hits = new ArrayList<>();
      lock.readLock().lock();
      try {
        if (index.count() > 0) {
          int candidates = Math.min(wanted, index.count());
          for (Neighbor n : index.search(q, candidates)) {
            if (n.isEmpty()) continue;
            String id = mapping.idAt(n.slot());
            Document doc = id == null ? null : docs.get(id);
            if (doc == null) {
              throw new StoreConsistencyException("index slot " + n.slot() + " resolves to no document");
            }
            hits.add(new ScoredDocument(doc, id, n.distance()));
          }
        }
      } finally {
        lock.readLock().unlock();
      }

      Double threshold = req.scoreThreshold() == null
          ? null
          : req.scoreThreshold() + config.getScoreThresholdOffset();
      Instant now = config.getInstantSource().instant();
      List<ScoredDocument> out = new ArrayList<>(Math.min(k, hits.size()));
      for (ScoredDocument h : hits) {
        if (out.size() == k) break;
        if (filter.isPresent() && !filter.get().matches(h.document())) continue;
        if (threshold != null && h.distance() > threshold) continue;
        if (!h.document().isValid(now)) continue;
        out.add(h);
      }
      span.setAttribute("candidates", hits.size());
      span.setAttribute("results", out.size());
      LOG.debug("search k={} candidates={} results={}", k, hits.size(), out.size());
      return out;
    } catch (RuntimeException e) {
      span.recordException(e);
      span.setStatus(StatusCode.ERROR);
      throw e;
    } finally {
      metrics.searchCount.add(1, metrics.base());
      metrics.searchDurationMs.record(Metrics.elapsedMs(t0), metrics.base());
      span.end();
    }
  }

  @Override
  public void saveIndex() {
    saveIndex(config.getIndexName());
  }

  @Override
  public void saveIndex(String name) {
    if (name == null || name.isBlank() || name.contains("/") || name.contains("\\")) {
      throw new ValidationException("invalid index name: " + name);
    }
    persistence.enqueue(name);
  }

  @Override
  public void rebuildIndex() {
    lock.writeLock().lock();
    try {
      rebuildLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Re-embeds the document table into a fresh index and mapping and swaps them in. */
  private void rebuildLocked() {
    Span span = metrics.tracer()
        .spanBuilder("docsearch.rebuild")
        .setSpanKind(SpanKind.INTERNAL)
        .setAttribute("documents", docs.size())
        .startSpan();
    long t0 = System.nanoTime();
    try {
      Map<String, Document> snapshot = docs.snapshot();
      List<String> ids = new ArrayList<>(snapshot.keySet());
      List<String> texts = new ArrayList<>(ids.size());
      for (Document d : snapshot.values()) texts.add(d.pageContent());

      List<float[]> vectors = embedParallel(texts);
      FlatL2Index fresh = new FlatL2Index(dimension);
      fresh.add(vectors);
      IndexMapping freshMapping = IndexMapping.enumerate(ids);

      this.index = fresh;
      this.mapping = freshMapping;
      LOG.info("rebuilt index with {} document(s)", ids.size());
    } catch (RuntimeException e) {
      span.recordException(e);
      span.setStatus(StatusCode.ERROR);
      throw e;
    } finally {
      metrics.rebuildDurationMs.record(Metrics.elapsedMs(t0), metrics.base());
      span.end();
    }
  }

  /** Called on the persistence worker: rebuild, then copy everything a save writes. */
  PersistedState captureForSave() {
    lock.writeLock().lock();
    try {
      rebuildLocked();
      StoreSnapshot snapshot = SnapshotCodec.encode(dimension, docs.snapshot(), mapping.asMap(),
          config.getInstantSource().millis());
      return new PersistedState(dimension, index.reconstructAll(), snapshot);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public Map<String, Document> getAllDocuments() {
    lock.readLock().lock();
    try {
      return docs.snapshot();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public StoreStats getStats() {
    lock.readLock().lock();
    try {
      return StoreStats.builder()
          .documents(docs.size())
          .mappedSlots(mapping.size())
          .indexedVectors(index.count())
          .mappingContiguous(mapping.isContiguous())
          .pendingSaves(persistence.pendingCount())
          .build();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public CompletableFuture<Void> awaitPersistence() {
    return persistence.awaitIdle();
  }

  /** Most recent background save failure, if any. */
  public Optional<PersistenceException> lastPersistenceFailure() {
    return persistence.lastFailure();
  }

  public int dimension() {
    return dimension;
  }

  @Override
  public void close() {
    persistence.close();
    rebuildPool.shutdown();
    embedPool.shutdown();
    try {
      if (!rebuildPool.awaitTermination(5, TimeUnit.SECONDS)) rebuildPool.shutdownNow();
      if (!embedPool.awaitTermination(5, TimeUnit.SECONDS)) embedPool.shutdownNow();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      rebuildPool.shutdownNow();
      embedPool.shutdownNow();
    }
    documentsGauge.close();
    LOG.info("closed store folder={}", config.getFolder());
  }

  private Document resolve(int slot) {
    String id = mapping.idAt(slot);
    Document doc = id == null ? null : docs.get(id);
    if (doc == null) throw new StoreConsistencyException("index slot " + slot + " resolves to no document");
    return doc;
  }

  /** Embeds {@code texts} on the embedding pool, bounded by the configured timeout. */
  private List<float[]> embed(List<String> texts) {
    if (texts.isEmpty()) return List.of();
    CompletableFuture<List<float[]>> f = CompletableFuture.supplyAsync(() -> embedder.embedMany(texts), embedPool);
    return checked(texts.size(), await(f));
  }

  /**
   * Embeds {@code texts} in batches across the rebuild pool and concatenates the batches in input
   * order.
   */
  private List<float[]> embedParallel(List<String> texts) {
    if (texts.isEmpty()) return List.of();
    int batch = config.getRebuildBatchSize();
    List<CompletableFuture<List<float[]>>> parts = new ArrayList<>();
    for (int from = 0; from < texts.size(); from += batch) {
      List<String> slice = List.copyOf(texts.subList(from, Math.min(texts.size(), from + batch)));
      parts.add(CompletableFuture.supplyAsync(() -> checked(slice.size(), embedder.embedMany(slice)), rebuildPool));
    }
    List<float[]> out = new ArrayList<>(texts.size());
    try {
      for (CompletableFuture<List<float[]>> part : parts) out.addAll(await(part));
    } catch (RuntimeException e) {
      parts.forEach(p -> p.cancel(true));
      throw e;
    }
    return out;
  }

  private <T> T await(CompletableFuture<T> f) {
    try {
      return f.get(config.getEmbeddingTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      f.cancel(true);
      throw new EmbeddingUnavailableException(
          "embedding timed out after " + config.getEmbeddingTimeout(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      f.cancel(true);
      throw new EmbeddingUnavailableException("interrupted while embedding", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof VectorStoreException) throw (VectorStoreException) cause;
      throw new EmbeddingUnavailableException("embedder failed: " + cause, cause);
    }
  }

  private List<float[]> checked(int expected, List<float[]> vectors) {
    if (vectors == null || vectors.size() != expected) {
      throw new EmbeddingUnavailableException("embedder returned " + (vectors == null ? 0 : vectors.size())
          + " vectors for " + expected + " texts");
    }
    for (float[] v : vectors) {
      if (v == null || v.length != dimension) {
        throw new EmbeddingUnavailableException("embedder returned a vector of length "
            + (v == null ? 0 : v.length) + ", expected " + dimension);
      }
    }
    return vectors;
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
