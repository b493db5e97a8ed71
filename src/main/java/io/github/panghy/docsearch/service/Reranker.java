package io.github.panghy.docsearch.service;

import io.github.panghy.docsearch.model.Document;
import java.util.List;

/** Reorders search results for a query after retrieval. */
@FunctionalInterface
public interface Reranker {

  /** Keeps the retrieval order. */
  Reranker IDENTITY = (documents, query) -> documents;

  List<Document> rerank(List<Document> documents, String query);
}
