package io.github.panghy.docsearch.filter;

import io.github.panghy.docsearch.model.Document;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Equality filter over document metadata: a mapping from metadata key to accepted values.
 *
 * <p>A document matches when, for every key, its metadata value (see
 * {@link io.github.panghy.docsearch.model.Metadata#toMap()}) is one of the accepted values. For
 * {@code tags} the value is the document's stored tag list, compared by exact order. Accepted
 * values are held in hash sets, so a lookup costs the same however many tag orderings a filter
 * accepts.</p>
 */
public final class MetadataFilter {
  private final Map<String, Set<Object>> accepted;

  private MetadataFilter(Map<String, Set<Object>> accepted) {
    this.accepted = Collections.unmodifiableMap(new LinkedHashMap<>(accepted));
  }

  public boolean matches(Document doc) {
    Map<String, Object> values = doc.metadata().toMap();
    for (Map.Entry<String, Set<Object>> e : accepted.entrySet()) {
      if (!e.getValue().contains(values.get(e.getKey()))) return false;
    }
    return true;
  }

  public Map<String, Set<Object>> accepted() {
    return accepted;
  }

  public boolean isEmpty() {
    return accepted.isEmpty();
  }

  @Override
  public String toString() {
    return "MetadataFilter" + accepted;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link MetadataFilter}. */
  public static final class Builder {
    private final Map<String, List<Object>> accepted = new LinkedHashMap<>();

    private Builder() {}

    /** Accepts exactly {@code value} for {@code key}; a list value is matched as one value. */
    public Builder accept(String key, Object value) {
      accepted.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> new ArrayList<>())
          .add(normalize(value));
      return this;
    }

    /** Accepts any of {@code values} for {@code key}. */
    public Builder acceptAny(String key, Collection<?> values) {
      List<Object> list = accepted.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> new ArrayList<>());
      for (Object v : values) list.add(normalize(v));
      return this;
    }

    public MetadataFilter build() {
      Map<String, Set<Object>> copy = new LinkedHashMap<>();
      accepted.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
      return new MetadataFilter(copy);
    }

    // numeric metadata is held as long
    private static Object normalize(Object v) {
      if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
      return v;
    }
  }
}
