package campus.spi;

import java.sql.Connection;
import java.util.Set;

/**
 * Read positions of consumer groups, one per (stream, group).
 *
 * <p>A position is the offset of the last record the group handled. Advancing is a
 * compare-and-set, which keeps concurrent pollers of one group from moving a position
 * backwards.
 */
public interface OffsetStore {

  /**
   * Creates the position at 0 unless it exists.
   *
   * @return the current position
   */
  long subscribe(Connection conn, String streamName, String consumerGroup);

  /**
   * @return the current position, or 0 if the group never subscribed
   */
  long currentOffset(Connection conn, String streamName, String consumerGroup);

  /**
   * Moves the position from {@code expected} to {@code next}.
   *
   * @return false if the stored position was not {@code expected}
   */
  boolean advance(Connection conn, String streamName, String consumerGroup, long expected, long next);

  /** Groups whose position on {@code streamName} has reached {@code offset}. */
  Set<String> consumedBy(Connection conn, String streamName, long offset);
}
