package io.github.panghy.docsearch.index;

import io.github.panghy.docsearch.model.Document;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Storage-id keyed table of documents, iterated in insertion order. Not thread-safe.
 */
public final class DocStore {
  private final LinkedHashMap<String, Document> docs = new LinkedHashMap<>();

  /** Stores {@code doc} under {@code id}; an existing entry is replaced. */
  public void put(String id, Document doc) {
    docs.put(id, doc);
  }

  public Document get(String id) {
    return docs.get(id);
  }

  public boolean contains(String id) {
    return docs.containsKey(id);
  }

  public Document remove(String id) {
    return docs.remove(id);
  }

  public int size() {
    return docs.size();
  }

  public void clear() {
    docs.clear();
  }

  /** Storage ids in iteration order. */
  public List<String> ids() {
    return new ArrayList<>(docs.keySet());
  }

  /** Insertion-ordered copy of the table. */
  public Map<String, Document> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(docs));
  }
}
