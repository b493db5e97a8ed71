package io.github.panghy.docsearch;

/** An update or delete targeted an id that is not present in the document table. */
public class DocumentNotFoundException extends VectorStoreException {

  private static final long serialVersionUID = 1L;

  public DocumentNotFoundException(String message) {
    super(message);
  }
}
