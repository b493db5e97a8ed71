package io.github.panghy.docsearch.api;

/**
 * Tests for SearchRequest and RemovalResult validation.
 */
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.docsearch.model.Document;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchRequestTest {

  @Test
  void defaults_leave_options_to_the_store() {
    SearchRequest r = SearchRequest.defaults();
    assertThat(r.k()).isNull();
    assertThat(r.fetchK()).isNull();
    assertThat(r.scoreThreshold()).isNull();
    assertThat(r.filter()).isNull();
    assertThat(r.powerset()).isTrue();
  }

  @Test
  void tags_shortcut_builds_a_filter_and_threshold_copy_keeps_the_rest() {
    SearchRequest r = SearchRequest.builder().k(3).fetchK(30).tags("a", "b").powerset(false).build();
    SearchRequest copy = r.withScoreThreshold(0.5);
    assertThat(copy.filter().getTags().asList()).containsExactly("a", "b");
    assertThat(copy.k()).isEqualTo(3);
    assertThat(copy.fetchK()).isEqualTo(30);
    assertThat(copy.powerset()).isFalse();
    assertThat(copy.scoreThreshold()).isEqualTo(0.5);
  }

  @Test
  void rejects_invalid_values() {
    assertThatThrownBy(() -> SearchRequest.ofK(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SearchRequest.builder().fetchK(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SearchRequest.defaults().withScoreThreshold(Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void removal_result_requires_aligned_lists() {
    assertThat(RemovalResult.none(4).removedCount()).isZero();
    assertThat(RemovalResult.none(4).totalBefore()).isEqualTo(4);
    assertThatThrownBy(() -> new RemovalResult(1, 2, List.of("s1"), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(new RemovalResult(1, 2, List.of("s1"), List.of(new Document("x"))).removed()).hasSize(1);
  }
}
