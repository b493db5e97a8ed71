package io.github.panghy.docsearch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Text content plus metadata. Store identity is a separate storage id, not {@code metadata.ids}.
 *
 * @param pageContent document text
 * @param metadata    structured metadata; defaults apply when {@code null}
 */
public record Document(String pageContent, Metadata metadata) {
  public Document {
    Objects.requireNonNull(pageContent, "pageContent must not be null");
    if (metadata == null) metadata = Metadata.defaults();
  }

  public Document(String pageContent) {
    this(pageContent, null);
  }

  /** Whether this document's validity window contains {@code now}. */
  public boolean isValid(Instant now) {
    return metadata.isValidAt(now.getEpochSecond());
  }
}
