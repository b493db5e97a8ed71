package io.github.panghy.docsearch.persist;

import io.github.panghy.docsearch.PersistenceException;
import io.github.panghy.docsearch.util.Metrics;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single background writer that drains save requests from a bounded FIFO channel.
 *
 * <p>Each save persists the live state at the time it is dequeued: the {@link StateSource}
 * rebuilds and captures the store, then both files are written. Existing files are copied to
 * {@code .bak} siblings first and restored if anything fails; the copies are removed afterwards
 * either way. A request for a name that is already queued and not yet started is coalesced into the
 * queued one.</p>
 *
 * <p>Failures never reach the caller of {@link #enqueue(String)}. They are logged, counted and
 * kept in {@link #lastFailure()}.</p>
 */
public final class PersistenceManager implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(PersistenceManager.class);
  static final String THREAD_NAME = "docsearch-persist";

  private final IndexFiles files;
  private final StateSource source;
  private final Metrics metrics;
  private final BlockingQueue<SaveRequest> queue;
  private final Set<String> pendingNames = ConcurrentHashMap.newKeySet();
  private final AtomicReference<PersistenceException> lastFailure = new AtomicReference<>();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private Thread worker;

  public PersistenceManager(IndexFiles files, StateSource source, int capacity, Metrics metrics) {
    this.files = Objects.requireNonNull(files, "files");
    this.source = Objects.requireNonNull(source, "source");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  /** Starts the worker thread. No-op if already started. */
  public synchronized void start() {
    if (running.get()) return;
    running.set(true);
    worker = new Thread(this::drain, THREAD_NAME);
    worker.setDaemon(true);
    worker.start();
    LOG.info("persistence worker started folder={}", files.folder());
  }

  /**
   * Requests a save of the live state under {@code name}. Returns without waiting for the write;
   * blocks only while the channel is full.
   *
   * @return true if a new request was queued, false if it was coalesced into a pending one
   */
  public boolean enqueue(String name) {
    Objects.requireNonNull(name, "name");
    ensureRunning();
    if (!pendingNames.add(name)) {
      LOG.debug("save of {} already pending; coalesced", name);
      return false;
    }
    try {
      queue.put(SaveRequest.save(name));
      return true;
    } catch (InterruptedException e) {
      pendingNames.remove(name);
      Thread.currentThread().interrupt();
      throw new PersistenceException("interrupted while queueing save of " + name, e);
    }
  }

  /** Completes once every request queued before this call has been handled. */
  public CompletableFuture<Void> awaitIdle() {
    ensureRunning();
    SaveRequest barrier = SaveRequest.barrier();
    try {
      queue.put(barrier);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return CompletableFuture.failedFuture(e);
    }
    return barrier.done();
  }

  /** Number of distinct names waiting to be saved. */
  public int pendingCount() {
    return pendingNames.size();
  }

  /** Most recent save failure, if any. */
  public Optional<PersistenceException> lastFailure() {
    return Optional.ofNullable(lastFailure.get());
  }

  /** Queues the shutdown sentinel and waits for the worker to drain everything ahead of it. */
  @Override
  public synchronized void close() {
    if (!running.compareAndSet(true, false)) return;
    LOG.debug("persistence worker stopping; signaling sentinel");
    SaveRequest stop = SaveRequest.shutdown();
    try {
      queue.put(stop);
      stop.done().join();
      worker.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      worker.interrupt();
    }
    LOG.info("persistence worker stopped folder={}", files.folder());
  }

  private void ensureRunning() {
    if (!running.get()) throw new IllegalStateException("persistence worker is not running");
  }

  private void drain() {
    while (true) {
      SaveRequest req;
      try {
        req = queue.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOG.warn("persistence worker interrupted; {} request(s) dropped", queue.size());
        return;
      }
      switch (req.kind()) {
        case SAVE -> {
          pendingNames.remove(req.name());
          try {
            save(req.name());
            req.done().complete(null);
          } catch (PersistenceException e) {
            req.done().completeExceptionally(e);
          }
        }
        case BARRIER -> req.done().complete(null);
        case SHUTDOWN -> {
          req.done().complete(null);
          return;
        }
      }
    }
  }

  /**
   * Runs one backup, capture, write and cleanup cycle.
   *
   * @throws PersistenceException after the previous files have been restored
   */
  void save(String name) {
    Attributes attrs = metrics.attrs("index.name", name);
    Span span = metrics.tracer()
        .spanBuilder("docsearch.save")
        .setSpanKind(SpanKind.INTERNAL)
        .setAttribute("index.name", name)
        .startSpan();
    long t0 = System.nanoTime();
    List<IndexFiles.Backup> backups = null;
    try {
      backups = files.backup(name);
      PersistedState state = source.capture();
      files.writeVectors(name, state.dimension(), state.vectors());
      files.writeMeta(name, state.snapshot());
      metrics.saveCount.add(1, attrs);
      span.setAttribute("documents", state.snapshot().getDocumentsCount());
      LOG.info("saved index {} documents={} vectors={}", name, state.snapshot().getDocumentsCount(),
          state.vectors().length);
    } catch (IOException | RuntimeException e) {
      PersistenceException failure = new PersistenceException("save of index " + name + " failed", e);
      if (backups != null) {
        try {
          files.restore(backups);
          LOG.error("save of index {} failed; previous files restored", name, e);
        } catch (IOException restoreFailure) {
          failure.addSuppressed(restoreFailure);
          LOG.error("save of index {} failed and restore from backup also failed", name, e);
        }
      } else {
        LOG.error("save of index {} failed before any file was touched", name, e);
      }
      metrics.saveFailures.add(1, attrs);
      lastFailure.set(failure);
      span.recordException(e);
      span.setStatus(StatusCode.ERROR);
      throw failure;
    } finally {
      if (backups != null) {
        try {
          files.discard(backups);
        } catch (IOException e) {
          LOG.warn("could not remove backup files of index {}", name, e);
        }
      }
      metrics.saveDurationMs.record(Metrics.elapsedMs(t0), attrs);
      span.end();
    }
  }
}
