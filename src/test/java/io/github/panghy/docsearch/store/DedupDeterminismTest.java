package io.github.panghy.docsearch.store;

/**
 * Near-duplicate verdicts must not depend on whether neighbor embeddings are recomputed by the
 * model or served from the embedding cache.
 */
import static org.assertj.core.api.Assertions.assertThat;

import io.github.panghy.docsearch.config.VectorStoreConfig;
import io.github.panghy.docsearch.embed.CachingEmbedder;
import io.github.panghy.docsearch.embed.Embedder;
import io.github.panghy.docsearch.model.Document;
import io.github.panghy.docsearch.testutil.FixedEmbedder;
import io.opentelemetry.api.OpenTelemetry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DedupDeterminismTest {
  @TempDir
  Path dir;

  private static FixedEmbedder embedder() {
    return new FixedEmbedder()
        .put("policy", 1f, 0f, 0f)
        .put("policy v2", 0.99f, 0.1410674f, 0f)
        .put("handbook", 0f, 1f, 0f)
        .put("handbook draft", 0.3f, 0.85f, 0.4330127f)
        .put("travel", 0f, 0f, 1f)
        .put("travel rules", 0f, 0.5f, 0.8660254f);
  }

  private static List<List<String>> ingest(Path folder, Embedder embedder) throws Exception {
    List<List<String>> accepted = new ArrayList<>();
    try (LocalVectorStore store = LocalVectorStore.open(
        VectorStoreConfig.builder(folder, embedder).openTelemetry(OpenTelemetry.noop()).build())) {
      for (List<String> batch : List.of(
          List.of("policy", "handbook"),
          List.of("policy v2", "travel"),
          List.of("handbook draft", "travel rules"),
          List.of("policy"))) {
        List<Document> docs = new ArrayList<>();
        for (String t : batch) docs.add(new Document(t));
        accepted.add(store.addDocuments(docs).stream().map(Document::pageContent).toList());
      }
    }
    return accepted;
  }

  @Test
  void cached_and_uncached_embedders_accept_the_same_documents() throws Exception {
    FixedEmbedder plain = embedder();
    FixedEmbedder behindCache = embedder();

    List<List<String>> uncached = ingest(dir.resolve("plain"), plain);
    List<List<String>> cached = ingest(dir.resolve("cached"), new CachingEmbedder(behindCache));

    assertThat(cached).isEqualTo(uncached);
    assertThat(uncached).containsExactly(
        List.of("policy", "handbook"),
        List.of("travel"),
        List.of("handbook draft", "travel rules"),
        List.of());
    // neighbor texts are re-embedded by the model only when nothing caches them
    assertThat(behindCache.textsEmbedded()).isLessThan(plain.textsEmbedded());
  }
}
