package io.github.panghy.docsearch.index;

import io.github.panghy.docsearch.StoreConsistencyException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bijection between index slots {@code 0..size()-1} and storage ids.
 *
 * <p>Must be mutated in lock-step with the {@link SimilarityIndex}: every {@code add} there is an
 * {@link #extend(List)} here, and every {@code remove} there is a {@link #removeSlots(Set)} here,
 * which renumbers the survivors identically. Not thread-safe.</p>
 */
public final class IndexMapping {
  private final List<String> slotToId = new ArrayList<>();
  private final Map<String, Integer> idToSlot = new HashMap<>();

  /** Enumerates {@code ids} as slots {@code 0..n-1}. */
  public static IndexMapping enumerate(List<String> ids) {
    IndexMapping m = new IndexMapping();
    m.extend(ids);
    return m;
  }

  /**
   * Rebuilds a mapping from persisted entries.
   *
   * @throws StoreConsistencyException if the keys are not exactly {@code 0..n-1} or an id repeats
   */
  public static IndexMapping fromEntries(Map<Integer, String> entries) {
    List<String> ordered = new ArrayList<>(entries.size());
    for (int slot = 0; slot < entries.size(); slot++) {
      String id = entries.get(slot);
      if (id == null) {
        throw new StoreConsistencyException("slot mapping is not contiguous: missing slot " + slot);
      }
      ordered.add(id);
    }
    IndexMapping m = new IndexMapping();
    m.extend(ordered);
    return m;
  }

  /**
   * Assigns the next sequential slots to {@code ids}.
   *
   * @return the first assigned slot
   * @throws StoreConsistencyException if an id is already mapped
   */
  public int extend(List<String> ids) {
    int first = slotToId.size();
    for (String id : ids) {
      if (idToSlot.containsKey(id)) {
        throw new StoreConsistencyException("storage id already mapped: " + id);
      }
      idToSlot.put(id, slotToId.size());
      slotToId.add(id);
    }
    return first;
  }

  /** Storage id at {@code slot}, or {@code null} when the slot is unmapped. */
  public String idAt(int slot) {
    return slot >= 0 && slot < slotToId.size() ? slotToId.get(slot) : null;
  }

  /** Slot of {@code id}, or {@code -1}. */
  public int slotOf(String id) {
    Integer s = idToSlot.get(id);
    return s == null ? -1 : s;
  }

  /** Removes {@code slots} and renumbers the survivors to stay contiguous, keeping their order. */
  public void removeSlots(Set<Integer> slots) {
    if (slots.isEmpty()) return;
    List<String> kept = new ArrayList<>(slotToId.size());
    for (int slot = 0; slot < slotToId.size(); slot++) {
      if (!slots.contains(slot)) kept.add(slotToId.get(slot));
    }
    clear();
    extend(kept);
  }

  public void clear() {
    slotToId.clear();
    idToSlot.clear();
  }

  public int size() {
    return slotToId.size();
  }

  /** True when forward and reverse views agree on every slot in {@code 0..size()-1}. */
  public boolean isContiguous() {
    if (idToSlot.size() != slotToId.size()) return false;
    for (int slot = 0; slot < slotToId.size(); slot++) {
      Integer back = idToSlot.get(slotToId.get(slot));
      if (back == null || back != slot) return false;
    }
    return true;
  }

  /** Slot-ordered copy of the mapping. */
  public Map<Integer, String> asMap() {
    Map<Integer, String> m = new LinkedHashMap<>();
    for (int slot = 0; slot < slotToId.size(); slot++) m.put(slot, slotToId.get(slot));
    return Collections.unmodifiableMap(m);
  }
}
