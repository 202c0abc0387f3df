package campus.spi;

/**
 * Observability hook for publisher and processor counters.
 *
 * <p>The {@link #NOOP} instance discards everything. Subscription-scoped methods receive
 * the stream and consumer group separately so exporters can tag by both.
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  /** Events committed to the outbox. */
  void incrementPublished(String streamName, int count);

  /** Events handled successfully. */
  void incrementDelivered(String streamName, String consumerGroup);

  /** Handler failures; the event will be retried. */
  void incrementFailed(String streamName, String consumerGroup);

  /** Events acknowledged without a handler (unknown type). */
  void incrementSkipped(String streamName, String consumerGroup);

  /**
   * Records how many records the group is behind the head of the stream.
   *
   * @param lag always non-negative
   */
  void recordLag(String streamName, String consumerGroup, long lag);

  final class Noop implements MetricsExporter {
    @Override
    public void incrementPublished(String streamName, int count) {
    }

    @Override
    public void incrementDelivered(String streamName, String consumerGroup) {
    }

    @Override
    public void incrementFailed(String streamName, String consumerGroup) {
    }

    @Override
    public void incrementSkipped(String streamName, String consumerGroup) {
    }

    @Override
    public void recordLag(String streamName, String consumerGroup, long lag) {
    }
  }
}
