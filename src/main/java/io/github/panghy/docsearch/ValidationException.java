package io.github.panghy.docsearch;

/**
 * Raised synchronously before any mutation when a request is malformed: duplicate or empty id
 * lists, mismatched lengths between documents, ids and embeddings, or missing required fields.
 */
public class ValidationException extends VectorStoreException {

  private static final long serialVersionUID = 1L;

  public ValidationException(String message) {
    super(message);
  }
}
