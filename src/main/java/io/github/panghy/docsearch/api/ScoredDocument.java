package io.github.panghy.docsearch.api;

import io.github.panghy.docsearch.model.Document;
import lombok.Builder;

/**
 * A search hit with its distance.
 *
 * @param document  matched document
 * @param storageId key of the document in the store
 * @param distance  squared L2 distance to the query (lower is closer)
 */
@Builder
public record ScoredDocument(Document document, String storageId, double distance) {}
