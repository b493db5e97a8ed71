package io.github.panghy.docsearch;

/** The embedder failed or timed out. No mutation is performed by the operation that needed it. */
public class EmbeddingUnavailableException extends VectorStoreException {

  private static final long serialVersionUID = 1L;

  public EmbeddingUnavailableException(String message) {
    super(message);
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
