package io.github.panghy.docsearch;

/**
 * The similarity index, the slot mapping and the document table have diverged, e.g. a slot
 * returned by the index resolves to no stored document. Not recoverable by the caller.
 */
public class StoreConsistencyException extends VectorStoreException {

  private static final long serialVersionUID = 1L;

  public StoreConsistencyException(String message) {
    super(message);
  }
}
