package io.github.panghy.docsearch;

/**
 * I/O failure while writing or reading index files. Raised inside the persistence worker, where it
 * is logged and retained as the worker's last failure; callers of {@code saveIndex} never see it.
 */
public class PersistenceException extends VectorStoreException {

  private static final long serialVersionUID = 1L;

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
