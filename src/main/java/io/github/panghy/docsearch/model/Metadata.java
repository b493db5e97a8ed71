package io.github.panghy.docsearch.model;

import io.github.panghy.docsearch.util.Hashing;
import java.time.InstantSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Structured metadata of a document.
 *
 * <p>Every field has a documented default, applied by the {@link Builder}:
 * <ul>
 *   <li>{@code ids}: SHA-256 of a fresh random UUID</li>
 *   <li>{@code splitter}: {@value #DEFAULT_SPLITTER}</li>
 *   <li>{@code validTime}: {@value #INDEFINITE} (never expires)</li>
 *   <li>{@code startTime}: build time in epoch seconds, read from the builder's clock (the system
 *       clock unless {@link Builder#instantSource(InstantSource)} is set)</li>
 *   <li>{@code related}: false</li>
 *   <li>{@code tags}: empty</li>
 * </ul>
 *
 * <p>All fields are fixed at construction except {@link #getTags()}, which may be edited before
 * the owning document is first persisted.</p>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Metadata {
  public static final String DEFAULT_SPLITTER = "default";
  public static final long INDEFINITE = -1L;

  /** Keys used by {@link #toMap()} and by metadata filters. */
  public static final String KEY_IDS = "ids";

  public static final String KEY_SPLITTER = "splitter";
  public static final String KEY_VALID_TIME = "valid_time";
  public static final String KEY_START_TIME = "start_time";
  public static final String KEY_RELATED = "related";
  public static final String KEY_TAGS = "tags";

  private final String ids;
  private final String splitter;
  private final long validTime;
  private final long startTime;
  private final boolean related;
  private final Tags tags;

  private Metadata(Builder b) {
    this.ids = b.ids != null ? b.ids : Hashing.randomMetadataId();
    this.splitter = Objects.requireNonNull(b.splitter, "splitter must not be null");
    if (b.validTime < INDEFINITE) throw new IllegalArgumentException("validTime must be >= -1");
    this.validTime = b.validTime;
    this.startTime =
        b.startTime != null ? b.startTime : b.instantSource.instant().getEpochSecond();
    this.related = b.related;
    this.tags = new Tags(b.tags);
  }

  /** Metadata with every field at its default. */
  public static Metadata defaults() {
    return builder().build();
  }

  /**
   * Whether the document carrying this metadata is current at {@code epochSecond}: always when
   * {@code validTime == -1}, otherwise when {@code startTime <= epochSecond <= startTime + validTime}.
   */
  public boolean isValidAt(long epochSecond) {
    if (validTime == INDEFINITE) return true;
    return epochSecond >= startTime && epochSecond <= startTime + validTime;
  }

  /**
   * Flat view used for filter matching. {@code tags} maps to the ordered tag list.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(KEY_IDS, ids);
    m.put(KEY_SPLITTER, splitter);
    m.put(KEY_VALID_TIME, validTime);
    m.put(KEY_RELATED, related);
    m.put(KEY_START_TIME, startTime);
    m.put(KEY_TAGS, tags.asList());
    return m;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link Metadata}. */
  public static final class Builder {
    private String ids;
    private String splitter = DEFAULT_SPLITTER;
    private long validTime = INDEFINITE;
    private Long startTime;
    private boolean related;
    private List<String> tags = List.of();
    private InstantSource instantSource = InstantSource.system();

    private Builder() {}

    public Builder ids(String ids) {
      this.ids = ids;
      return this;
    }

    public Builder splitter(String splitter) {
      this.splitter = splitter;
      return this;
    }

    /** Validity duration in seconds, or {@code -1} for no expiry. */
    public Builder validTime(long validTime) {
      this.validTime = validTime;
      return this;
    }

    /** Start of the validity window, epoch seconds. */
    public Builder startTime(long startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder related(boolean related) {
      this.related = related;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags = tags == null ? List.of() : tags;
      return this;
    }

    public Builder tags(String... tags) {
      return tags(List.of(tags));
    }

    /**
     * Clock used for the default start time. Stores check validity against their own configured
     * clock, so documents for a store with a fixed or simulated clock should be built with it.
     */
    public Builder instantSource(InstantSource instantSource) {
      this.instantSource = Objects.requireNonNull(instantSource, "instantSource");
      return this;
    }

    public Metadata build() {
      return new Metadata(this);
    }
  }
}
