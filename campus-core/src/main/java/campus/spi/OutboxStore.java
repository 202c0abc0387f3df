package campus.spi;

import campus.model.OutboxMessage;
import campus.model.OutboxRecord;

import java.sql.Connection;
import java.util.List;

/**
 * Append-only log of published events, partitioned by stream.
 *
 * <p>All methods use the caller's connection and never commit. Offsets are assigned per
 * stream, start at 1, increase by one per record and are never reused. Appenders to the
 * same stream are serialized until their transactions end, so records become visible in
 * offset order.
 */
public interface OutboxStore {

  /**
   * Appends {@code messages} to {@code streamName} in the given order.
   *
   * @return the stored records with their assigned offsets
   */
  List<OutboxRecord> append(Connection conn, String streamName, List<OutboxMessage> messages);

  /** Returns up to {@code limit} records with offset greater than {@code afterOffset}, ascending. */
  List<OutboxRecord> readAfter(Connection conn, String streamName, long afterOffset, int limit);

  /** Highest assigned offset of the stream, or 0 when nothing was appended yet. */
  long latestOffset(Connection conn, String streamName);
}
