package io.github.panghy.docsearch.util;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.ObservableLongGauge;
import io.opentelemetry.api.trace.Tracer;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Centralizes OpenTelemetry instruments for one store instance.
 *
 * <p>Instruments are created from the {@link OpenTelemetry} handed in through the store config so
 * tests can bind an in-memory SDK per store.</p>
 */
public final class Metrics {
  public static final String INSTRUMENTATION_NAME = "io.github.panghy.docsearch";

  private final Meter meter;
  private final Tracer tracer;
  private final Attributes baseAttributes;

  // Histograms (ms)
  public final DoubleHistogram searchDurationMs;
  public final DoubleHistogram saveDurationMs;
  public final DoubleHistogram rebuildDurationMs;

  // Counters
  public final LongCounter searchCount;
  public final LongCounter addAccepted;
  public final LongCounter addDuplicates;
  public final LongCounter removeCount;
  public final LongCounter saveCount;
  public final LongCounter saveFailures;

  public Metrics(OpenTelemetry openTelemetry, Map<String, String> metricAttributes) {
    this.meter = openTelemetry.getMeter(INSTRUMENTATION_NAME);
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
    AttributesBuilder b = Attributes.builder();
    for (var e : metricAttributes.entrySet()) b.put(e.getKey(), e.getValue());
    this.baseAttributes = b.build();

    this.searchDurationMs = meter.histogramBuilder("docsearch.search.duration_ms")
        .setUnit("ms")
        .build();
    this.saveDurationMs =
        meter.histogramBuilder("docsearch.save.duration_ms").setUnit("ms").build();
    this.rebuildDurationMs = meter.histogramBuilder("docsearch.rebuild.duration_ms")
        .setUnit("ms")
        .build();

    this.searchCount = meter.counterBuilder("docsearch.search.count").build();
    this.addAccepted = meter.counterBuilder("docsearch.add.accepted").build();
    this.addDuplicates = meter.counterBuilder("docsearch.add.duplicates").build();
    this.removeCount = meter.counterBuilder("docsearch.remove.count").build();
    this.saveCount = meter.counterBuilder("docsearch.save.count").build();
    this.saveFailures = meter.counterBuilder("docsearch.save.failures").build();
  }

  public Tracer tracer() {
    return tracer;
  }

  /** Attributes configured on the store, added to every recorded value. */
  public Attributes base() {
    return baseAttributes;
  }

  public Attributes attrs(String key, String value) {
    return baseAttributes.toBuilder().put(AttributeKey.stringKey(key), value).build();
  }

  /** Registers an observable gauge reporting {@code value} under the base attributes. */
  public ObservableLongGauge gauge(String name, String description, LongSupplier value) {
    return meter.gaugeBuilder(name)
        .ofLongs()
        .setDescription(description)
        .buildWithCallback(obs -> obs.record(value.getAsLong(), baseAttributes));
  }

  public static double elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }
}
