package io.github.panghy.docsearch.persist;

import java.util.concurrent.CompletableFuture;

/**
 * Message on the persistence channel.
 *
 * @param kind what the worker should do
 * @param name index name for {@link Kind#SAVE}, {@code null} otherwise
 * @param done completed once the worker has handled the message
 */
public record SaveRequest(Kind kind, String name, CompletableFuture<Void> done) {

  public enum Kind {
    /** Persist live state under {@code name}. */
    SAVE,
    /** Completes once every earlier message has been handled. */
    BARRIER,
    /** Stops the worker after everything ahead of it has been handled. */
    SHUTDOWN
  }

  public static SaveRequest save(String name) {
    return new SaveRequest(Kind.SAVE, name, new CompletableFuture<>());
  }

  public static SaveRequest barrier() {
    return new SaveRequest(Kind.BARRIER, null, new CompletableFuture<>());
  }

  public static SaveRequest shutdown() {
    return new SaveRequest(Kind.SHUTDOWN, null, new CompletableFuture<>());
  }
}
