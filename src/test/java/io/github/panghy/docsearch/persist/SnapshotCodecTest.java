package io.github.panghy.docsearch.persist;

/**
 * Tests for converting the document table and slot mapping to the persisted snapshot.
 */
import static org.assertj.core.api.Assertions.assertThat;

import io.github.panghy.docsearch.model.Document;
import io.github.panghy.docsearch.model.Metadata;
import io.github.panghy.docsearch.proto.StoreSnapshot;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SnapshotCodecTest {

  @Test
  void documents_and_mapping_survive_encoding_in_order() {
    Map<String, Document> docs = new LinkedHashMap<>();
    docs.put("s2", new Document("second", Metadata.builder()
        .ids("m2")
        .splitter("md")
        .validTime(30)
        .startTime(100)
        .related(true)
        .tags("b", "a")
        .build()));
    docs.put("s1", new Document("first", Metadata.builder().ids("m1").startTime(5).build()));
    Map<Integer, String> mapping = Map.of(0, "s2", 1, "s1");

    StoreSnapshot snap = SnapshotCodec.encode(8, docs, mapping, 1234L);
    assertThat(snap.getDimension()).isEqualTo(8);
    assertThat(snap.getSavedAtMs()).isEqualTo(1234L);

    Map<String, Document> back = SnapshotCodec.decodeDocuments(snap);
    assertThat(back.keySet()).containsExactly("s2", "s1");
    assertThat(back).isEqualTo(docs);
    assertThat(back.get("s2").metadata().getTags().asList()).containsExactly("b", "a");
    assertThat(SnapshotCodec.decodeMapping(snap)).isEqualTo(mapping);
  }
}
