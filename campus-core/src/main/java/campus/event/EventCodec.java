package campus.event;

/**
 * Converts domain events to and from the payload stored in the outbox.
 *
 * @see JacksonEventCodec
 */
public interface EventCodec {

  /** Type identifier written next to the payload. */
  String typeName(DomainEvent event);

  String encode(DomainEvent event);

  /**
   * @throws UnknownEventTypeException if {@code typeName} is not in the catalog
   * @throws EventCodecException       if the payload cannot be read
   */
  DomainEvent decode(String typeName, String payload);
}
