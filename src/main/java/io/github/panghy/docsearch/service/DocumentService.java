package io.github.panghy.docsearch.service;

import io.github.panghy.docsearch.DocumentNotFoundException;
import io.github.panghy.docsearch.DuplicateDocumentException;
import io.github.panghy.docsearch.ValidationException;
import io.github.panghy.docsearch.api.RemovalResult;
import io.github.panghy.docsearch.api.SearchRequest;
import io.github.panghy.docsearch.api.VectorStore;
import io.github.panghy.docsearch.model.Document;
import io.github.panghy.docsearch.model.Metadata;
import io.github.panghy.docsearch.search.AdaptiveSearch;
import io.github.panghy.docsearch.search.AdaptiveSearchPolicy;
import io.github.panghy.docsearch.util.Hashing;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document operations used by request handlers: editor-attributed ingestion, update and deletion
 * with audit records, and retrieval followed by reranking.
 *
 * <p>Every mutation queues a save of the store's default index. Audit failures are logged and never
 * fail the operation that produced them.</p>
 */
public final class DocumentService {
  private static final Logger LOG = LoggerFactory.getLogger(DocumentService.class);

  static final String ADDED = "Document added.";
  static final String UPDATED = "Document updated.";
  static final String DELETED = "Document deleted.";
  static final int ADAPTIVE_K = 10;

  private final VectorStore store;
  private final AuditLog auditLog;
  private final Reranker reranker;
  private final List<String> defaultTags;
  private final AdaptiveSearch adaptiveSearch;
  private final InstantSource clock;

  public DocumentService(
      VectorStore store,
      AuditLog auditLog,
      Reranker reranker,
      List<String> defaultTags,
      AdaptiveSearchPolicy policy,
      InstantSource clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    this.reranker = Objects.requireNonNull(reranker, "reranker");
    this.defaultTags = defaultTags == null ? List.of() : List.copyOf(defaultTags);
    this.adaptiveSearch = new AdaptiveSearch(store, policy);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public DocumentService(VectorStore store, AuditLog auditLog, Reranker reranker, List<String> defaultTags) {
    this(store, auditLog, reranker, defaultTags, AdaptiveSearchPolicy.DEFAULT, InstantSource.system());
  }

  /**
   * Ingests one document.
   *
   * @return the stored document
   * @throws ValidationException        if the editor is missing or the metadata has no tags
   * @throws DuplicateDocumentException if the store rejected the content as a near-duplicate
   */
  public Document addDocument(String content, Metadata metadata, String editorId) {
    requireEditor(editorId);
    Document doc = newDocument(content, metadata);
    String storageId = Hashing.randomStorageId();
    List<Document> accepted = store.addDocuments(List.of(doc), List.of(storageId));
    if (accepted.isEmpty()) {
      LOG.warn("document from editor {} rejected as a near-duplicate", editorId);
      throw new DuplicateDocumentException("document is a near-duplicate of a stored document");
    }
    store.saveIndex();
    audit(storageId, editorId, ADDED);
    LOG.info("document {} added by {}", doc.metadata().getIds(), editorId);
    return accepted.get(0);
  }

  /**
   * Replaces the documents whose {@code metadata.ids} equals {@code metadataId} with a new one.
   *
   * @throws DocumentNotFoundException  if no document carries {@code metadataId}
   * @throws DuplicateDocumentException if the replacement was rejected as a near-duplicate; the old
   *                                    document stays removed
   */
  public Document updateDocument(String metadataId, String content, Metadata metadata, String editorId) {
    requireEditor(editorId);
    if (metadataId == null || metadataId.isBlank()) throw new ValidationException("metadata id is required");
    Document doc = newDocument(content, metadata);

    RemovalResult removed = store.deleteDocumentsByIds(List.of(metadataId));
    if (removed.removedCount() == 0) {
      throw new DocumentNotFoundException("no document found with id " + metadataId + "; unable to update");
    }
    String storageId = Hashing.randomStorageId();
    List<Document> accepted = store.addDocuments(List.of(doc), List.of(storageId));
    store.saveIndex();
    if (accepted.isEmpty()) {
      LOG.warn("replacement for {} rejected as a near-duplicate", metadataId);
      throw new DuplicateDocumentException("replacement for " + metadataId + " is a near-duplicate");
    }
    audit(storageId, editorId, UPDATED);
    LOG.info("document {} updated by {}", metadataId, editorId);
    return accepted.get(0);
  }

  /** Removes every document carrying one of {@code metadataIds}. */
  public RemovalResult deleteDocuments(Collection<String> metadataIds, String editorId) {
    requireEditor(editorId);
    RemovalResult result = store.deleteDocumentsByIds(metadataIds);
    store.saveIndex();
    for (String id : result.removedIds()) audit(id, editorId, DELETED);
    LOG.info("{} document(s) removed by {}", result.removedCount(), editorId);
    return result;
  }

  /** Searches with caller-chosen options, then reranks. */
  public List<Document> getDocuments(
      String query, int k, Metadata filterMetadata, Double scoreThreshold, boolean powerset) {
    SearchRequest request = SearchRequest.builder()
        .k(k)
        .filter(filterMetadata)
        .scoreThreshold(scoreThreshold)
        .powerset(powerset)
        .build();
    return reranker.rerank(store.search(query, request), query);
  }

  /**
   * Adaptive retrieval: the filter is the default tags followed by {@code tags}; the powerset
   * expansion is used only when {@code tags} is {@code null}.
   */
  public List<Document> findAndOptimizeDocuments(String query, List<String> tags) {
    List<String> all = new ArrayList<>(defaultTags);
    if (tags != null) all.addAll(tags);
    SearchRequest base = SearchRequest.builder()
        .k(ADAPTIVE_K)
        .filter(Metadata.builder().tags(all).build())
        .powerset(tags == null)
        .build();
    return reranker.rerank(adaptiveSearch.search(query, base), query);
  }

  private void audit(String id, String editorId, String description) {
    try {
      auditLog.record(new AuditEntry(id, editorId, clock.instant(), description));
    } catch (RuntimeException e) {
      LOG.warn("audit append failed for document {}", id, e);
    }
  }

  private static void requireEditor(String editorId) {
    if (editorId == null || editorId.isBlank()) throw new ValidationException("editor id is required");
  }

  private static Document newDocument(String content, Metadata metadata) {
    if (content == null) throw new ValidationException("content is required");
    Document doc = new Document(content, metadata);
    if (doc.metadata().getTags().isEmpty()) {
      throw new ValidationException("the document must have at least one tag in its metadata");
    }
    return doc;
  }
}
