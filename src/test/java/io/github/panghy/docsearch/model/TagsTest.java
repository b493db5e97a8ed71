package io.github.panghy.docsearch.model;

/**
 * Tests for the ordered, duplicate-free Tags collection.
 */
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TagsTest {

  @Test
  void keeps_insertion_order_and_drops_repeats() {
    Tags tags = new Tags(List.of("hr", "policy", "hr"));
    assertThat(tags.asList()).containsExactly("hr", "policy");
    assertThat(tags.add("policy")).isFalse();
    assertThat(tags.add("2024")).isTrue();
    assertThat(tags.asList()).containsExactly("hr", "policy", "2024");
  }

  @Test
  void remove_and_contains() {
    Tags tags = new Tags();
    tags.addAll(List.of("a", "b"));
    assertThat(tags.contains("a")).isTrue();
    assertThat(tags.remove("a")).isTrue();
    assertThat(tags.remove("a")).isFalse();
    assertThat(tags.size()).isEqualTo(1);
  }

  @Test
  void null_tag_is_rejected() {
    assertThatThrownBy(() -> new Tags().add(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void as_list_is_a_snapshot() {
    Tags tags = new Tags(List.of("a"));
    List<String> snap = tags.asList();
    tags.add("b");
    assertThat(snap).containsExactly("a");
    assertThatThrownBy(() -> snap.add("c")).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void equality_is_order_sensitive() {
    assertThat(new Tags(List.of("a", "b"))).isEqualTo(new Tags(List.of("a", "b")));
    assertThat(new Tags(List.of("a", "b"))).isNotEqualTo(new Tags(List.of("b", "a")));
  }
}
