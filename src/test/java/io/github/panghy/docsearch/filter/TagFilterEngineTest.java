package io.github.panghy.docsearch.filter;

/**
 * Tests for tag filter expansion: powerset-with-permutations, priority-based permutations and the
 * resulting MetadataFilter.
 */
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.docsearch.ValidationException;
import io.github.panghy.docsearch.model.Document;
import io.github.panghy.docsearch.model.Metadata;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TagFilterEngineTest {

  @Test
  void powerset_of_two_tags() {
    assertThat(TagFilterEngine.powersetWithPermutations(List.of("a", "b")))
        .containsExactly(List.of(), List.of("a"), List.of("b"), List.of("a", "b"), List.of("b", "a"));
  }

  @Test
  void powerset_of_three_tags_has_every_ordering() {
    List<List<String>> out = TagFilterEngine.powersetWithPermutations(List.of("x", "y", "z"));
    // 1 + 3 + 6 + 6
    assertThat(out).hasSize(16).doesNotHaveDuplicates();
    assertThat(out.get(0)).isEmpty();
    assertThat(out.subList(1, 4)).containsExactly(List.of("x"), List.of("y"), List.of("z"));
    assertThat(out.get(out.size() - 1)).containsExactly("z", "y", "x");
  }

  @Test
  void powerset_of_empty_list_is_the_empty_ordering() {
    assertThat(TagFilterEngine.powersetWithPermutations(List.of())).containsExactly(List.of());
  }

  @Test
  void priority_based_for_three_tags() {
    assertThat(TagFilterEngine.priorityBasedPermutations(List.of("a", "b", "c")))
        .containsExactly(
            List.of("a", "b", "c"),
            List.of("a", "c", "b"),
            List.of("b", "a", "c"),
            List.of("b", "c", "a"),
            List.of("a", "b"),
            List.of("b", "a"),
            List.of("a", "c"),
            List.of("b", "c"),
            List.of("a"),
            List.of("b"),
            List.of("c"));
  }

  @Test
  void priority_based_small_inputs() {
    assertThat(TagFilterEngine.priorityBasedPermutations(List.of()))
        .isEmpty();
    assertThat(TagFilterEngine.priorityBasedPermutations(List.of("a")))
        .containsExactly(List.of("a"));
    assertThat(TagFilterEngine.priorityBasedPermutations(List.of("a", "b")))
        .containsExactly(List.of("a", "b"), List.of("b", "a"), List.of("a"), List.of("b"));
  }

  @Test
  void no_tags_means_no_filter() {
    assertThat(TagFilterEngine.toFilter(Metadata.defaults(), true)).isEmpty();
  }

  @Test
  void filter_matches_exact_stored_order_only() {
    MetadataFilter f = TagFilterEngine.toFilter(Metadata.builder().tags("a", "b").build(), true)
        .orElseThrow();
    assertThat(f.matches(doc("a", "b"))).isTrue();
    assertThat(f.matches(doc("b", "a"))).isTrue();
    assertThat(f.matches(doc("a"))).isTrue();
    assertThat(f.matches(doc())).isTrue();
    // superset of the filter tags is not an accepted ordering
    assertThat(f.matches(doc("a", "b", "c"))).isFalse();
    assertThat(f.matches(doc("c"))).isFalse();
  }

  @Test
  void priority_filter_rejects_orderings_headed_by_low_priority_tags() {
    Optional<MetadataFilter> f =
        TagFilterEngine.toFilter(Metadata.builder().tags("a", "b", "c").build(), false);
    assertThat(f).isPresent();
    assertThat(f.get().matches(doc("c", "a", "b"))).isFalse();
    assertThat(f.get().matches(doc("c"))).isTrue();
    assertThat(f.get().matches(doc("b", "c"))).isTrue();
  }

  @Test
  void too_many_tags_is_a_validation_error() {
    Metadata m = Metadata.builder().tags("1", "2", "3", "4").build();
    assertThatThrownBy(() -> TagFilterEngine.toFilter(m, true, 3))
        .isInstanceOf(ValidationException.class);
    assertThat(TagFilterEngine.toFilter(m, true, 4)).isPresent();
  }

  @Test
  void combinations_and_permutations_follow_positional_order() {
    assertThat(TagFilterEngine.combinations(List.of("a", "b", "c"), 2))
        .containsExactly(List.of("a", "b"), List.of("a", "c"), List.of("b", "c"));
    assertThat(TagFilterEngine.permutations(List.of("a", "b", "c")))
        .first()
        .isEqualTo(List.of("a", "b", "c"));
  }

  private static Document doc(String... tags) {
    return new Document("x", Metadata.builder().tags(tags).build());
  }
}
