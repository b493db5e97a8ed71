package io.github.panghy.docsearch.api;

import io.github.panghy.docsearch.model.Document;
import java.util.List;

/**
 * Outcome of a removal.
 *
 * @param removedCount number of documents removed
 * @param totalBefore  number of documents held before the removal
 * @param removedIds   storage ids of the removed documents, in request order
 * @param removed      removed documents, aligned with {@code removedIds}
 */
public record RemovalResult(int removedCount, int totalBefore, List<String> removedIds, List<Document> removed) {
  public RemovalResult {
    removedIds = List.copyOf(removedIds);
    removed = List.copyOf(removed);
    if (removedIds.size() != removed.size() || removedCount != removed.size()) {
      throw new IllegalArgumentException("removal counts disagree");
    }
  }

  public static RemovalResult none(int totalBefore) {
    return new RemovalResult(0, totalBefore, List.of(), List.of());
  }
}
