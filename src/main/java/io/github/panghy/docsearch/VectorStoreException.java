package io.github.panghy.docsearch;

/**
 * Base type for runtime failures raised by the vector store and the document service.
 */
public class VectorStoreException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public VectorStoreException(String message) {
    super(message);
  }

  public VectorStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
