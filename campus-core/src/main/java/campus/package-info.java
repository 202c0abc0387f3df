/**
 * Identity lifecycle aggregates with transactional event recording.
 *
 * <p>Every state change on an {@link campus.Aggregate} buffers one or more
 * {@link campus.event.DomainEvent}s in the aggregate's own {@link campus.event.Recorder}.
 * A repository writes the new state and the buffered events in a single database
 * transaction; an {@link campus.processor.EventProcessor} later delivers the events to
 * handlers at least once.
 *
 * <h2>Writing</h2>
 * <pre>{@code
 * registrations.update(id, registration -> registration.verifyCode("ABC123"));
 * }</pre>
 *
 * <h2>Consuming</h2>
 * <pre>{@code
 * HandlerRegistry registry = new HandlerRegistry(CampusEvents.registry())
 *     .register(new RegistrationStartedMailHandler(mailSender));
 *
 * try (EventProcessor processor = EventProcessor.builder()
 *     .connectionProvider(connectionProvider)
 *     .outboxStore(outboxStore)
 *     .offsetStore(offsetStore)
 *     .codec(codec)
 *     .handlerRegistry(registry)
 *     .build()) {
 *   processor.start();
 * }
 * }</pre>
 *
 * <h2>Modules</h2>
 * <ul>
 *   <li>{@code campus-core}: aggregates, events, SPI, processor (this module)</li>
 *   <li>{@code campus-jdbc}: JDBC repositories, outbox and offset stores</li>
 *   <li>{@code campus-micrometer}: Micrometer metrics exporter</li>
 *   <li>{@code campus-spring-boot-starter}: Spring Boot auto-configuration</li>
 * </ul>
 */
package campus;
