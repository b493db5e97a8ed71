package io.github.panghy.docsearch.persist;

import io.github.panghy.docsearch.proto.StoreSnapshot;

/**
 * Host-side copy of everything a save writes: the index vectors in slot order and the
 * document/mapping snapshot.
 */
public record PersistedState(int dimension, float[][] vectors, StoreSnapshot snapshot) {}
