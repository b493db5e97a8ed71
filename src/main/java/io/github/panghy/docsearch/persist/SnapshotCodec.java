package io.github.panghy.docsearch.persist;

import io.github.panghy.docsearch.model.Document;
import io.github.panghy.docsearch.model.Metadata;
import io.github.panghy.docsearch.proto.DocumentRecord;
import io.github.panghy.docsearch.proto.MetadataRecord;
import io.github.panghy.docsearch.proto.SlotEntry;
import io.github.panghy.docsearch.proto.StoreSnapshot;
import java.util.LinkedHashMap;
import java.util.Map;

/** Converts the document table and slot mapping to and from {@link StoreSnapshot}. */
public final class SnapshotCodec {
  private SnapshotCodec() {}

  public static StoreSnapshot encode(
      int dimension, Map<String, Document> documents, Map<Integer, String> mapping, long savedAtMs) {
    StoreSnapshot.Builder b = StoreSnapshot.newBuilder().setDimension(dimension).setSavedAtMs(savedAtMs);
    for (var e : documents.entrySet()) {
      b.addDocuments(DocumentRecord.newBuilder()
          .setStorageId(e.getKey())
          .setPageContent(e.getValue().pageContent())
          .setMetadata(encodeMetadata(e.getValue().metadata()))
          .build());
    }
    for (var e : mapping.entrySet()) {
      b.addMapping(
          SlotEntry.newBuilder().setSlot(e.getKey()).setStorageId(e.getValue()).build());
    }
    return b.build();
  }

  /** Documents keyed by storage id, in persisted iteration order. */
  public static Map<String, Document> decodeDocuments(StoreSnapshot snapshot) {
    Map<String, Document> out = new LinkedHashMap<>();
    for (DocumentRecord r : snapshot.getDocumentsList()) {
      out.put(r.getStorageId(), new Document(r.getPageContent(), decodeMetadata(r.getMetadata())));
    }
    return out;
  }

  /** Slot to storage id entries; later duplicates of a slot overwrite earlier ones. */
  public static Map<Integer, String> decodeMapping(StoreSnapshot snapshot) {
    Map<Integer, String> out = new LinkedHashMap<>();
    for (SlotEntry e : snapshot.getMappingList()) out.put(e.getSlot(), e.getStorageId());
    return out;
  }

  static MetadataRecord encodeMetadata(Metadata m) {
    return MetadataRecord.newBuilder()
        .setIds(m.getIds())
        .setSplitter(m.getSplitter())
        .setValidTime(m.getValidTime())
        .setStartTime(m.getStartTime())
        .setRelated(m.isRelated())
        .addAllTags(m.getTags().asList())
        .build();
  }

  static Metadata decodeMetadata(MetadataRecord r) {
    return Metadata.builder()
        .ids(r.getIds())
        .splitter(r.getSplitter())
        .validTime(r.getValidTime())
        .startTime(r.getStartTime())
        .related(r.getRelated())
        .tags(r.getTagsList())
        .build();
  }
}
