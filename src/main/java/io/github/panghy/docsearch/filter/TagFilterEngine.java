package io.github.panghy.docsearch.filter;

import io.github.panghy.docsearch.ValidationException;
import io.github.panghy.docsearch.model.Metadata;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Expands an ordered tag list into the concrete tag orderings a stored document may carry to
 * match.
 *
 * <p>Stored documents match a tag filter only when their exact stored tag ordering equals one of
 * the generated candidates (see {@link MetadataFilter}), so the expansion has to enumerate
 * orderings, not just sets.</p>
 *
 * <ul>
 *   <li>{@link #powersetWithPermutations(List)}: every permutation of every subset, including the
 *       empty one, sorted by length then lexicographically.</li>
 *   <li>{@link #priorityBasedPermutations(List)}: permutations of the full list (and of every
 *       {@code n-1} subset when {@code n > 2}) that start with one of the two highest-priority
 *       tags, followed by every tag as a singleton when {@code n > 1}.</li>
 * </ul>
 */
public final class TagFilterEngine {
  public static final int DEFAULT_MAX_TAGS = 8;

  private static final Comparator<List<String>> LENGTH_THEN_LEXICOGRAPHIC = (a, b) -> {
    if (a.size() != b.size()) return Integer.compare(a.size(), b.size());
    for (int i = 0; i < a.size(); i++) {
      int c = a.get(i).compareTo(b.get(i));
      if (c != 0) return c;
    }
    return 0;
  };

  private TagFilterEngine() {}

  /**
   * Enumerates all {@code 2^n} subsets of {@code tags}, every permutation of each, deduplicated
   * and sorted by {@code (length, lexicographic)}.
   */
  public static List<List<String>> powersetWithPermutations(List<String> tags) {
    LinkedHashSet<List<String>> out = new LinkedHashSet<>();
    int n = tags.size();
    for (int mask = 0; mask < (1 << n); mask++) {
      List<String> subset = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        if ((mask & (1 << i)) != 0) subset.add(tags.get(i));
      }
      out.addAll(permutations(subset));
    }
    List<List<String>> sorted = new ArrayList<>(out);
    sorted.sort(LENGTH_THEN_LEXICOGRAPHIC);
    return sorted;
  }

  /**
   * Priority-weighted expansion. For {@code n} tags, takes combinations of size {@code n} (and
   * {@code n-1} when {@code n > 2}), keeps the permutations whose first element is the first or
   * second tag, deduplicates them in generation order, then appends each tag as a singleton when
   * {@code n > 1}.
   */
  public static List<List<String>> priorityBasedPermutations(List<String> tags) {
    int n = tags.size();
    if (n == 0) return List.of();
    String first = tags.get(0);
    String second = n > 1 ? tags.get(1) : null;
    LinkedHashSet<List<String>> kept = new LinkedHashSet<>();
    int smallest = n > 2 ? n - 1 : n;
    for (int size = n; size >= smallest; size--) {
      for (List<String> combination : combinations(tags, size)) {
        for (List<String> perm : permutations(combination)) {
          String head = perm.get(0);
          if (head.equals(first) || head.equals(second)) kept.add(perm);
        }
      }
    }
    List<List<String>> out = new ArrayList<>(kept);
    if (n > 1) {
      for (String tag : tags) out.add(List.of(tag));
    }
    return out;
  }

  /**
   * Builds the {@code tags} filter for {@code metadata}.
   *
   * @param powerset selects {@link #powersetWithPermutations(List)} when true, otherwise
   *                 {@link #priorityBasedPermutations(List)}
   * @param maxTags  largest tag list accepted for expansion
   * @return empty when the metadata carries no tags, meaning "no filter"
   * @throws ValidationException when more than {@code maxTags} tags would be expanded
   */
  public static Optional<MetadataFilter> toFilter(Metadata metadata, boolean powerset, int maxTags) {
    List<String> tags = metadata.getTags().asList();
    if (tags.isEmpty()) return Optional.empty();
    if (tags.size() > maxTags) {
      throw new ValidationException(
          "filter has " + tags.size() + " tags; at most " + maxTags + " can be expanded");
    }
    List<List<String>> candidates =
        powerset ? powersetWithPermutations(tags) : priorityBasedPermutations(tags);
    return Optional.of(MetadataFilter.builder()
        .acceptAny(Metadata.KEY_TAGS, candidates)
        .build());
  }

  public static Optional<MetadataFilter> toFilter(Metadata metadata, boolean powerset) {
    return toFilter(metadata, powerset, DEFAULT_MAX_TAGS);
  }

  // r-combinations in positional order, like itertools.combinations
  static List<List<String>> combinations(List<String> items, int r) {
    List<List<String>> out = new ArrayList<>();
    combine(items, r, 0, new ArrayList<>(), out);
    return out;
  }

  private static void combine(List<String> items, int r, int start, List<String> cur, List<List<String>> out) {
    if (cur.size() == r) {
      out.add(List.copyOf(cur));
      return;
    }
    for (int i = start; i < items.size(); i++) {
      cur.add(items.get(i));
      combine(items, r, i + 1, cur, out);
      cur.remove(cur.size() - 1);
    }
  }

  // full-length permutations in positional order, like itertools.permutations
  static List<List<String>> permutations(List<String> items) {
    List<List<String>> out = new ArrayList<>();
    permute(items, new boolean[items.size()], new ArrayList<>(), out);
    return out;
  }

  private static void permute(List<String> items, boolean[] used, List<String> cur, List<List<String>> out) {
    if (cur.size() == items.size()) {
      out.add(List.copyOf(cur));
      return;
    }
    for (int i = 0; i < items.size(); i++) {
      if (used[i]) continue;
      used[i] = true;
      cur.add(items.get(i));
      permute(items, used, cur, out);
      cur.remove(cur.size() - 1);
      used[i] = false;
    }
  }
}
