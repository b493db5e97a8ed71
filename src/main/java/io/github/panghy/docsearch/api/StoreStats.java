package io.github.panghy.docsearch.api;

import lombok.Builder;

/**
 * Point-in-time counters of a store, read under its lock.
 *
 * @param documents          entries in the document table
 * @param mappedSlots        entries in the slot mapping
 * @param indexedVectors     vectors in the similarity index
 * @param mappingContiguous  whether the mapping keys are exactly {@code 0..mappedSlots-1}
 * @param pendingSaves       distinct index names queued for saving
 */
@Builder
public record StoreStats(
    int documents, int mappedSlots, int indexedVectors, boolean mappingContiguous, int pendingSaves) {

  /** True when the table, the mapping and the index agree in size and the mapping is contiguous. */
  public boolean isConsistent() {
    return documents == mappedSlots && mappedSlots == indexedVectors && mappingContiguous;
  }
}
