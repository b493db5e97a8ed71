package io.github.panghy.docsearch.service;

import java.time.Instant;
import lombok.Builder;

/**
 * One append-only audit record of a document change.
 *
 * @param documentStorageId storage id of the affected document
 * @param editorId          who made the change
 * @param timestamp         when the change was applied
 * @param description       human-readable summary
 */
@Builder
public record AuditEntry(String documentStorageId, String editorId, Instant timestamp, String description) {}
