package io.github.panghy.docsearch.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.EqualsAndHashCode;

/**
 * Ordered set of tag strings attached to a document.
 *
 * <p>Insertion order is significant: the first and second entries are the highest and
 * second-highest priority tags for priority-based filter generation. The order is whatever the
 * caller supplied and is never re-derived here.</p>
 */
@EqualsAndHashCode
public final class Tags {
  private final List<String> tags = new ArrayList<>();

  public Tags() {}

  /** Creates tags from {@code initial}, keeping the first occurrence of any repeated value. */
  public Tags(Collection<String> initial) {
    if (initial != null) initial.forEach(this::add);
  }

  /**
   * Appends {@code tag} unless already present.
   *
   * @return true if the tag was added, false if it was a duplicate
   */
  public synchronized boolean add(String tag) {
    if (tag == null) throw new IllegalArgumentException("tag must not be null");
    if (tags.contains(tag)) return false;
    tags.add(tag);
    return true;
  }

  public synchronized void addAll(Collection<String> more) {
    for (String t : more) add(t);
  }

  /** Removes {@code tag}; no-op if absent. */
  public synchronized boolean remove(String tag) {
    return tags.remove(tag);
  }

  public synchronized boolean contains(String tag) {
    return tags.contains(tag);
  }

  public synchronized int size() {
    return tags.size();
  }

  public synchronized boolean isEmpty() {
    return tags.isEmpty();
  }

  /** Immutable copy in insertion order. */
  public synchronized List<String> asList() {
    return List.copyOf(tags);
  }

  @Override
  public synchronized String toString() {
    return tags.toString();
  }
}
