package campus.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trace and baggage context carried inside a domain event.
 *
 * <p>The producer captures the ambient OpenTelemetry context with {@link #propagate(Context)}
 * when the event is created; a consumer rebuilds it with {@link #extract()}, possibly in
 * another process long after the producing request finished. Entries use the W3C
 * {@code traceparent}, {@code tracestate} and {@code baggage} formats.
 */
public final class TracingCarrier {
  private static final TextMapPropagator PROPAGATOR = TextMapPropagator.composite(
      W3CTraceContextPropagator.getInstance(),
      W3CBaggagePropagator.getInstance());

  private static final TracingCarrier EMPTY = new TracingCarrier(Map.of());

  private final Map<String, String> carrier;

  @JsonCreator
  TracingCarrier(@JsonProperty("carrier") Map<String, String> carrier) {
    this.carrier = carrier == null ? Map.of() : Map.copyOf(carrier);
  }

  public static TracingCarrier empty() {
    return EMPTY;
  }

  /** Captures {@link Context#current()}. */
  public static TracingCarrier current() {
    return propagate(Context.current());
  }

  public static TracingCarrier propagate(Context context) {
    Map<String, String> entries = new LinkedHashMap<>();
    PROPAGATOR.inject(context, entries, (map, key, value) -> {
      if (map != null) {
        map.put(key, value);
      }
    });
    return entries.isEmpty() ? EMPTY : new TracingCarrier(entries);
  }

  /**
   * Rebuilds the producer's context on top of {@link Context#root()}. Returns the root
   * context when nothing was captured.
   */
  public Context extract() {
    return PROPAGATOR.extract(Context.root(), carrier, MapGetter.INSTANCE);
  }

  @JsonProperty("carrier")
  public Map<String, String> carrier() {
    return carrier;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return carrier.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TracingCarrier other)) return false;
    return carrier.equals(other.carrier);
  }

  @Override
  public int hashCode() {
    return carrier.hashCode();
  }

  @Override
  public String toString() {
    return "TracingCarrier" + carrier;
  }

  private enum MapGetter implements TextMapGetter<Map<String, String>> {
    INSTANCE;

    @Override
    public Iterable<String> keys(Map<String, String> carrier) {
      return carrier.keySet();
    }

    @Override
    public String get(Map<String, String> carrier, String key) {
      return carrier == null ? null : carrier.get(key);
    }
  }
}
