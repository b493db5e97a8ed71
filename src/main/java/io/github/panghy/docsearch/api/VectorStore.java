package io.github.panghy.docsearch.api;

import io.github.panghy.docsearch.IndexConfigurationException;
import io.github.panghy.docsearch.config.VectorStoreConfig;
import io.github.panghy.docsearch.model.Document;
import io.github.panghy.docsearch.store.LocalVectorStore;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Primary entry point to a document vector store kept in a local folder.
 *
 * <p>A store keeps three structures consistent as one unit: the similarity index (vectors in dense
 * slots), the document table (storage id to {@link Document}) and the slot mapping between them.
 * After every completed add, remove or rebuild the three have the same size and the mapping keys
 * are exactly {@code 0..N-1}.</p>
 *
 * <p>Concurrency:
 * <ul>
 *   <li>Mutations (add, remove, rebuild, the capture step of a save) are serialized behind one
 *       write lock held for the whole mutation.</li>
 *   <li>Searches and snapshot reads share a read lock, so they never observe a half-applied
 *       mutation.</li>
 *   <li>Saves run on a single background worker and persist whatever the live state is when the
 *       request is dequeued.</li>
 * </ul>
 *
 * <p>Call {@link #close()} to drain pending saves and stop background threads.</p>
 */
public interface VectorStore extends AutoCloseable {

  /**
   * Opens the store described by {@code config}: loads {@code <indexName>.vectors} and
   * {@code <indexName>.meta} when both exist and loading is enabled, then starts the persistence
   * worker.
   *
   * @throws IndexConfigurationException if the persisted files cannot be read or their dimension
   *                                     differs from the embedder's
   */
  static VectorStore open(VectorStoreConfig config) throws IndexConfigurationException {
    return LocalVectorStore.open(config);
  }

  /** Adds documents under freshly generated storage ids. See {@link #addDocuments(List, List)}. */
  List<Document> addDocuments(List<Document> documents);

  /**
   * Embeds and inserts {@code documents}, skipping near-duplicates.
   *
   * <p>A document is a near-duplicate when its cosine similarity to one of its nearest stored
   * neighbors, or to a document accepted earlier in the same call, exceeds the configured
   * threshold. Near-duplicates are skipped silently.</p>
   *
   * @param documents documents to add
   * @param ids       storage ids, one per document, or {@code null} to generate them
   * @return the documents actually inserted, in input order
   * @throws io.github.panghy.docsearch.ValidationException if ids and documents differ in length,
   *                                                        ids repeat, or an id is already stored
   * @throws io.github.panghy.docsearch.EmbeddingUnavailableException if the embedder fails or
   *                                                                  returns malformed vectors
   */
  List<Document> addDocuments(List<Document> documents, List<String> ids);

  /**
   * Same as {@link #addDocuments(List, List)} with a dedup threshold for this call only, in place
   * of the configured one. A document whose similarity equals the threshold is kept.
   *
   * @param similarityThreshold cosine similarity above which a document is a near-duplicate, in
   *                            {@code (-1, 1]}
   * @throws io.github.panghy.docsearch.ValidationException if the threshold is out of range
   */
  List<Document> addDocuments(List<Document> documents, List<String> ids, double similarityThreshold);

  /**
   * Removes documents by storage id and renumbers the remaining slots.
   *
   * @param ids storage ids, or {@code null} to remove everything
   * @throws io.github.panghy.docsearch.ValidationException if {@code ids} is empty or has repeats
   * @throws io.github.panghy.docsearch.DocumentNotFoundException if an id is not stored; nothing is
   *                                                              removed in that case
   */
  RemovalResult removeDocumentsById(List<String> ids);

  /**
   * Removes every document whose {@code metadata.ids} is in {@code metadataIds}.
   *
   * @return the removal outcome; zero removed when no document matched
   * @throws io.github.panghy.docsearch.ValidationException if {@code metadataIds} is empty
   */
  RemovalResult deleteDocumentsByIds(Collection<String> metadataIds);

  /** Documents closest to {@code query}, closest first. */
  List<Document> search(String query, SearchRequest request);

  /**
   * Like {@link #search(String, SearchRequest)} but keeps storage ids and distances.
   *
   * @throws io.github.panghy.docsearch.StoreConsistencyException if a returned slot has no document
   */
  List<ScoredDocument> similaritySearchWithScore(String query, SearchRequest request);

  /** Queues a save under the configured index name. */
  void saveIndex();

  /** Queues a save under {@code name}; returns without waiting for the write. */
  void saveIndex(String name);

  /**
   * Re-embeds every stored document into a fresh index and mapping, in document table order, and
   * swaps them in.
   */
  void rebuildIndex();

  /** Insertion-ordered copy of the document table. */
  Map<String, Document> getAllDocuments();

  StoreStats getStats();

  /** Completes once every save queued before this call has been handled. */
  CompletableFuture<Void> awaitPersistence();

  /** Drains pending saves and stops background threads. */
  @Override
  void close();
}
