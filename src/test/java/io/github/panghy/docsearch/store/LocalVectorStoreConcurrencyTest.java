package io.github.panghy.docsearch.store;

/**
 * Concurrent use of LocalVectorStore: parallel writers lose no updates and readers never observe a
 * half-applied mutation.
 */
import static org.assertj.core.api.Assertions.assertThat;

import io.github.panghy.docsearch.api.ScoredDocument;
import io.github.panghy.docsearch.api.SearchRequest;
import io.github.panghy.docsearch.config.VectorStoreConfig;
import io.github.panghy.docsearch.model.Document;
import io.github.panghy.docsearch.model.Metadata;
import io.github.panghy.docsearch.testutil.FixedEmbedder;
import io.opentelemetry.api.OpenTelemetry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalVectorStoreConcurrencyTest {
  @TempDir
  Path dir;

  @Test
  void concurrent_single_document_adds_are_all_kept() throws Exception {
    int writers = 32;
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try (LocalVectorStore store = LocalVectorStore.open(
        VectorStoreConfig.builder(dir, new FixedEmbedder()).openTelemetry(OpenTelemetry.noop()).build())) {
      CountDownLatch start = new CountDownLatch(1);
      List<Future<List<Document>>> results = new ArrayList<>();
      for (int i = 0; i < writers; i++) {
        String id = "doc-" + i;
        Document doc = new Document("content number " + i, Metadata.builder().tags("t").build());
        results.add(pool.submit(() -> {
          start.await();
          return store.addDocuments(List.of(doc), List.of(id));
        }));
      }
      start.countDown();
      for (Future<List<Document>> f : results) assertThat(f.get(10, TimeUnit.SECONDS)).hasSize(1);

      assertThat(store.getStats().documents()).isEqualTo(writers);
      assertThat(store.getStats().isConsistent()).isTrue();
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void readers_see_consistent_state_during_writes_and_removals() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(4);
    AtomicBoolean stop = new AtomicBoolean(false);
    try (LocalVectorStore store = LocalVectorStore.open(
        VectorStoreConfig.builder(dir, new FixedEmbedder()).openTelemetry(OpenTelemetry.noop()).build())) {
      List<Future<Integer>> readers = new ArrayList<>();
      for (int r = 0; r < 3; r++) {
        readers.add(pool.submit(() -> {
          int searches = 0;
          do {
            for (ScoredDocument hit : store.similaritySearchWithScore("reader query", SearchRequest.ofK(5))) {
              assertThat(hit.document()).isNotNull();
            }
            assertThat(store.getStats().isConsistent()).isTrue();
            searches++;
          } while (!stop.get());
          return searches;
        }));
      }

      for (int round = 0; round < 20; round++) {
        List<String> ids = List.of("r" + round + "-a", "r" + round + "-b", "r" + round + "-c");
        store.addDocuments(List.of(
            new Document("round " + round + " a"),
            new Document("round " + round + " b"),
            new Document("round " + round + " c")), ids);
        store.removeDocumentsById(List.of(ids.get(0)));
        if (round % 5 == 0) store.rebuildIndex();
      }
      stop.set(true);

      for (Future<Integer> f : readers) assertThat(f.get(10, TimeUnit.SECONDS)).isPositive();
      assertThat(store.getStats().documents()).isEqualTo(40);
      assertThat(store.getStats().isConsistent()).isTrue();
    } finally {
      pool.shutdownNow();
    }
  }
}
