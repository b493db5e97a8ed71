package io.github.panghy.docsearch.persist;

/**
 * Supplies the live state to persist. Called on the persistence worker each time a save request
 * is dequeued, so the result reflects mutations made after the request was enqueued.
 */
@FunctionalInterface
public interface StateSource {

  /** Rebuilds and captures the current state; runs under the owner's mutation lock. */
  PersistedState capture();
}
