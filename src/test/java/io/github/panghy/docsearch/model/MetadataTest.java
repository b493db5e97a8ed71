package io.github.panghy.docsearch.model;

/**
 * Tests for Metadata defaults, the validity window and the flat map view.
 */
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.InstantSource;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetadataTest {

  @Test
  void defaults_are_applied() {
    Instant now = Instant.ofEpochSecond(1_700_000_000L);
    Metadata m = Metadata.builder().instantSource(InstantSource.fixed(now)).build();
    assertThat(m.getIds()).hasSize(64).matches("[0-9a-f]+");
    assertThat(m.getSplitter()).isEqualTo("default");
    assertThat(m.getValidTime()).isEqualTo(-1L);
    assertThat(m.getStartTime()).isEqualTo(now.getEpochSecond());
    assertThat(m.isRelated()).isFalse();
    assertThat(m.getTags().isEmpty()).isTrue();
  }

  @Test
  void each_default_gets_a_fresh_id() {
    assertThat(Metadata.defaults().getIds()).isNotEqualTo(Metadata.defaults().getIds());
  }

  @Test
  void validity_window_is_inclusive_on_both_ends() {
    long t = 1_000L;
    Metadata m = Metadata.builder().validTime(5).startTime(t).build();
    assertThat(m.isValidAt(t - 1)).isFalse();
    assertThat(m.isValidAt(t)).isTrue();
    assertThat(m.isValidAt(t + 3)).isTrue();
    assertThat(m.isValidAt(t + 5)).isTrue();
    assertThat(m.isValidAt(t + 6)).isFalse();
  }

  @Test
  void indefinite_validity_never_expires() {
    Metadata m = Metadata.builder().validTime(Metadata.INDEFINITE).startTime(1_000L).build();
    assertThat(m.isValidAt(0)).isTrue();
    assertThat(m.isValidAt(Long.MAX_VALUE)).isTrue();
  }

  @Test
  void valid_time_below_minus_one_is_rejected() {
    assertThatThrownBy(() -> Metadata.builder().validTime(-2).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void to_map_exposes_all_keys_with_ordered_tags() {
    Metadata m = Metadata.builder()
        .ids("abc")
        .splitter("md")
        .validTime(10)
        .startTime(20)
        .related(true)
        .tags("b", "a", "b")
        .build();
    assertThat(m.toMap())
        .containsEntry(Metadata.KEY_IDS, "abc")
        .containsEntry(Metadata.KEY_SPLITTER, "md")
        .containsEntry(Metadata.KEY_VALID_TIME, 10L)
        .containsEntry(Metadata.KEY_START_TIME, 20L)
        .containsEntry(Metadata.KEY_RELATED, true)
        .containsEntry(Metadata.KEY_TAGS, List.of("b", "a"));
  }

  @Test
  void document_without_metadata_gets_defaults() {
    Document d = new Document("text");
    assertThat(d.metadata()).isNotNull();
    assertThat(d.isValid(Instant.now())).isTrue();
    assertThatThrownBy(() -> new Document(null, null)).isInstanceOf(NullPointerException.class);
  }
}
