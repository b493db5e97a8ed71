package io.github.panghy.docsearch.service;

/** Append-only sink for {@link AuditEntry} records. The store never reads it back. */
@FunctionalInterface
public interface AuditLog {

  /** Discards every entry. */
  AuditLog NOOP = entry -> {};

  void record(AuditEntry entry);
}
