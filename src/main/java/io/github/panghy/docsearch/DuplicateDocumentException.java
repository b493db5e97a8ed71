package io.github.panghy.docsearch;

/**
 * Raised by the document service when the store rejected a submitted document as a near-duplicate
 * of an existing one. The store itself skips such documents silently.
 */
public class DuplicateDocumentException extends VectorStoreException {

  private static final long serialVersionUID = 1L;

  public DuplicateDocumentException(String message) {
    super(message);
  }
}
