package campus.micrometer;

import campus.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are registered lazily, one per stream (and consumer group where it applies),
 * tagged {@code stream} and {@code group}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code campus.outbox.published} events committed to a stream</li>
 *   <li>{@code campus.processor.delivered} events handled successfully</li>
 *   <li>{@code campus.processor.failed} handler failures (will retry)</li>
 *   <li>{@code campus.processor.skipped} events acknowledged without a handler</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code campus.processor.lag} records between a group's offset and the stream head</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  static final String STREAM_TAG = "stream";
  static final String GROUP_TAG = "group";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, Counter> counters = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> lags = new ConcurrentHashMap<>();
  private final List<Meter> meters = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "campus"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "campus");
  }

  /**
   * @param namePrefix prefix for all meter names (e.g. {@code "eu.campus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementPublished(String streamName, int count) {
    if (closed || count <= 0) return;
    counter(".outbox.published", "Events committed to the outbox", Tags.of(STREAM_TAG, streamName))
        .increment(count);
  }

  @Override
  public void incrementDelivered(String streamName, String consumerGroup) {
    if (closed) return;
    counter(".processor.delivered", "Events handled successfully", tags(streamName, consumerGroup))
        .increment();
  }

  @Override
  public void incrementFailed(String streamName, String consumerGroup) {
    if (closed) return;
    counter(".processor.failed", "Handler failures (will retry)", tags(streamName, consumerGroup))
        .increment();
  }

  @Override
  public void incrementSkipped(String streamName, String consumerGroup) {
    if (closed) return;
    counter(".processor.skipped", "Events acknowledged without a handler", tags(streamName, consumerGroup))
        .increment();
  }

  @Override
  public void recordLag(String streamName, String consumerGroup, long lag) {
    if (closed) return;
    lags.computeIfAbsent(streamName + '/' + consumerGroup, key -> {
      AtomicLong value = new AtomicLong();
      meters.add(Gauge.builder(namePrefix + ".processor.lag", value, AtomicLong::get)
          .description("Records behind the stream head")
          .tags(tags(streamName, consumerGroup))
          .register(registry));
      return value;
    }).set(lag);
  }

  private Counter counter(String suffix, String description, Tags tags) {
    String key = suffix + tags;
    return counters.computeIfAbsent(key, k -> {
      Counter counter = Counter.builder(namePrefix + suffix)
          .description(description)
          .tags(tags)
          .register(registry);
      meters.add(counter);
      return counter;
    });
  }

  private static Tags tags(String streamName, String consumerGroup) {
    return Tags.of(STREAM_TAG, streamName, GROUP_TAG, consumerGroup);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    counters.clear();
    lags.clear();
    if (first != null) throw first;
  }
}
