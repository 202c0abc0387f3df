package campus.outbox;

import campus.event.DomainEvent;
import campus.event.EventCodec;
import campus.model.OutboxMessage;
import campus.model.OutboxRecord;
import campus.spi.MetricsExporter;
import campus.spi.OutboxStore;
import campus.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Appends domain events to the outbox inside the caller's transaction.
 *
 * <p>Every {@link #publish} call requires an active transaction via {@link TxContext}: the
 * events commit or roll back together with the state change that produced them. Events are
 * grouped by stream, keeping their recording order within each stream.
 *
 * @see campus.spi.OutboxStore
 * @see campus.spi.Repository
 */
public final class OutboxPublisher {
    private static final Logger logger = Logger.getLogger(OutboxPublisher.class.getName());

    private final TxContext txContext;
    private final OutboxStore outboxStore;
    private final EventCodec codec;
    private final MetricsExporter metrics;

    public OutboxPublisher(TxContext txContext, OutboxStore outboxStore, EventCodec codec) {
        this(txContext, outboxStore, codec, MetricsExporter.NOOP);
    }

    /**
     * @param txContext   transaction context for connection and commit callbacks
     * @param outboxStore persistence backend for outbox records
     * @param codec       event serializer
     * @param metrics     exporter; {@code null} defaults to {@link MetricsExporter#NOOP}
     */
    public OutboxPublisher(
            TxContext txContext,
            OutboxStore outboxStore,
            EventCodec codec,
            MetricsExporter metrics
    ) {
        this.txContext = Objects.requireNonNull(txContext, "txContext");
        this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    /**
     * Publishes {@code events} within the current transaction.
     *
     * @return the stored records; empty when {@code events} is empty
     * @throws IllegalStateException if no transaction is active
     */
    public List<OutboxRecord> publish(List<? extends DomainEvent> events) {
        if (!txContext.isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            return List.of();
        }

        // Stream counter rows are locked in name order.
        Map<String, List<OutboxMessage>> byStream = new TreeMap<>();
        for (DomainEvent event : events) {
            OutboxMessage message = new OutboxMessage(
                    event.header().id(),
                    codec.typeName(event),
                    codec.encode(event),
                    event.header().timestamp());
            byStream.computeIfAbsent(event.streamName(), s -> new ArrayList<>()).add(message);
        }

        Connection conn = txContext.currentConnection();
        List<OutboxRecord> written = new ArrayList<>(events.size());
        for (Map.Entry<String, List<OutboxMessage>> entry : byStream.entrySet()) {
            written.addAll(outboxStore.append(conn, entry.getKey(), entry.getValue()));
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Appended " + written.size() + " event(s) to " + byStream.keySet());
        }

        txContext.afterCommit(() -> byStream.forEach((stream, messages) ->
                runSafely(() -> metrics.incrementPublished(stream, messages.size()))));
        return written;
    }

    private void runSafely(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException ex) {
            logger.log(Level.WARNING, "Metrics export failed after commit", ex);
        }
    }
}
