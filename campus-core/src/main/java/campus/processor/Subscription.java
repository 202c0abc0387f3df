package campus.processor;

import java.util.Objects;

/**
 * A consumer group reading one stream. Each subscription has its own offset.
 */
public record Subscription(String streamName, String consumerGroup) implements Comparable<Subscription> {
  public Subscription {
    Objects.requireNonNull(streamName, "streamName");
    Objects.requireNonNull(consumerGroup, "consumerGroup");
  }

  @Override
  public int compareTo(Subscription other) {
    int byStream = streamName.compareTo(other.streamName);
    return byStream != 0 ? byStream : consumerGroup.compareTo(other.consumerGroup);
  }

  @Override
  public String toString() {
    return streamName + "/" + consumerGroup;
  }
}
