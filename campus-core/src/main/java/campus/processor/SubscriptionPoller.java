package campus.processor;

import campus.event.DomainEvent;
import campus.event.EventCodec;
import campus.event.UnknownEventTypeException;
import campus.model.OutboxRecord;
import campus.spi.ConnectionProvider;
import campus.spi.MetricsExporter;
import campus.spi.OffsetStore;
import campus.spi.OutboxStore;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads one {@link Subscription} in offset order and hands each record to its handler.
 *
 * <p>A cycle reads the stored offset, fetches up to {@code batchSize} records after it and
 * delivers them one by one, advancing the offset with a compare-and-set after each
 * acknowledged record. The first failing handler stops the batch and puts the subscription
 * into backoff; the record is delivered again once the backoff elapsed, so records of a
 * subscription are never handled out of order.
 *
 * <p>Instances are driven by {@link EventProcessor}. A single poller must not run cycles
 * concurrently; pollers of the same group in other processes are tolerated.
 */
public final class SubscriptionPoller {
    private static final Logger logger = Logger.getLogger(SubscriptionPoller.class.getName());

    static final AttributeKey<String> STREAM = AttributeKey.stringKey("messaging.destination.name");
    static final AttributeKey<String> GROUP = AttributeKey.stringKey("messaging.consumer.group.name");
    static final AttributeKey<String> EVENT_TYPE = AttributeKey.stringKey("campus.event.type");
    static final AttributeKey<Long> OFFSET = AttributeKey.longKey("campus.event.offset");

    private final Subscription subscription;
    private final Map<String, EventHandler<?>> handlers;
    private final ConnectionProvider connectionProvider;
    private final OutboxStore outboxStore;
    private final OffsetStore offsetStore;
    private final EventCodec codec;
    private final RetryPolicy retryPolicy;
    private final MetricsExporter metrics;
    private final Tracer tracer;
    private final int batchSize;

    private int failures;
    private long retryAtNanos;
    private volatile boolean stopped;

    SubscriptionPoller(
            Subscription subscription,
            Map<String, EventHandler<?>> handlers,
            ConnectionProvider connectionProvider,
            OutboxStore outboxStore,
            OffsetStore offsetStore,
            EventCodec codec,
            RetryPolicy retryPolicy,
            MetricsExporter metrics,
            Tracer tracer,
            int batchSize
    ) {
        this.subscription = Objects.requireNonNull(subscription, "subscription");
        this.handlers = Map.copyOf(handlers);
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
        this.offsetStore = Objects.requireNonNull(offsetStore, "offsetStore");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.batchSize = batchSize;
    }

    /** Creates the stored offset unless it exists. */
    void subscribe() throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            long offset = offsetStore.subscribe(conn, subscription.streamName(), subscription.consumerGroup());
            logger.fine("Subscribed " + subscription + " at offset " + offset);
        }
    }

    /**
     * Scheduler entry point: runs one cycle and logs instead of throwing, so the schedule
     * survives database outages.
     */
    void poll() {
        try {
            pollOnce();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed for " + subscription, t);
        }
    }

    /**
     * Runs one cycle.
     *
     * @return number of records acknowledged, delivered or skipped
     * @throws SQLException if the outbox or the offset could not be read
     */
    int pollOnce() throws SQLException {
        if (stopped || (failures > 0 && System.nanoTime() - retryAtNanos < 0)) {
            return 0;
        }

        long offset;
        List<OutboxRecord> batch;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            offset = offsetStore.currentOffset(conn, subscription.streamName(), subscription.consumerGroup());
            batch = outboxStore.readAfter(conn, subscription.streamName(), offset, batchSize);
        }

        int acknowledged = 0;
        for (OutboxRecord record : batch) {
            if (stopped || Thread.currentThread().isInterrupted()) {
                break;
            }
            Outcome outcome = deliver(record);
            if (outcome == Outcome.FAILED) {
                backOff();
                break;
            }
            if (!advance(offset, record.offset())) {
                break;
            }
            offset = record.offset();
            acknowledged++;
            failures = 0;
            if (outcome == Outcome.DELIVERED) {
                metrics.incrementDelivered(subscription.streamName(), subscription.consumerGroup());
            } else {
                metrics.incrementSkipped(subscription.streamName(), subscription.consumerGroup());
            }
        }

        recordLag(offset);
        return acknowledged;
    }

    private Outcome deliver(OutboxRecord record) {
        DomainEvent event;
        try {
            event = codec.decode(record.eventType(), record.payload());
        } catch (UnknownEventTypeException e) {
            logger.fine("Skipping unknown event type " + record.eventType() + " at "
                    + subscription + "@" + record.offset());
            return Outcome.SKIPPED;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to decode " + record.eventType() + " at "
                    + subscription + "@" + record.offset(), e);
            metrics.incrementFailed(subscription.streamName(), subscription.consumerGroup());
            return Outcome.FAILED;
        }

        EventHandler<?> handler = handlers.get(record.eventType());
        if (handler == null) {
            return Outcome.SKIPPED;
        }

        try {
            invoke(handler, event, record);
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Delivered " + record.eventType() + " " + record.eventId()
                        + " to " + subscription + "@" + record.offset());
            }
            return Outcome.DELIVERED;
        } catch (UnknownEventException e) {
            logger.fine("Handler of " + subscription + " skipped " + record.eventId() + ": " + e.getMessage());
            return Outcome.SKIPPED;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.log(Level.WARNING, "Handler of " + subscription + " failed for "
                    + record.eventType() + " " + record.eventId() + " at offset " + record.offset(), e);
            metrics.incrementFailed(subscription.streamName(), subscription.consumerGroup());
            return Outcome.FAILED;
        }
    }

    /**
     * Runs the handler in a consumer span. The span starts a new trace linked to the
     * producer's span; the producer's baggage is current while the handler runs.
     */
    @SuppressWarnings("unchecked")
    private void invoke(EventHandler<?> handler, DomainEvent event, OutboxRecord record) throws Exception {
        Context producer = event.tracing().extract();
        SpanContext producerSpan = Span.fromContext(producer).getSpanContext();

        SpanBuilder builder = tracer.spanBuilder(subscription.consumerGroup() + " process " + record.eventType())
                .setNoParent()
                .setSpanKind(SpanKind.CONSUMER)
                .setAttribute(STREAM, subscription.streamName())
                .setAttribute(GROUP, subscription.consumerGroup())
                .setAttribute(EVENT_TYPE, record.eventType())
                .setAttribute(OFFSET, record.offset());
        if (producerSpan.isValid()) {
            builder.addLink(producerSpan);
        }
        Span span = builder.startSpan();

        try (Scope ignored = producer.with(span).makeCurrent()) {
            ((EventHandler<DomainEvent>) handler).handle(event);
        } catch (UnknownEventException e) {
            throw e;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private boolean advance(long expected, long next) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            boolean advanced = offsetStore.advance(
                    conn, subscription.streamName(), subscription.consumerGroup(), expected, next);
            if (!advanced) {
                logger.fine("Offset of " + subscription + " moved past " + expected + "; re-reading");
            }
            return advanced;
        }
    }

    private void backOff() {
        failures++;
        long delayMs = retryPolicy.computeDelayMs(failures);
        retryAtNanos = System.nanoTime() + delayMs * 1_000_000L;
        logger.info("Subscription " + subscription + " backing off " + delayMs + " ms after "
                + failures + " consecutive failure(s)");
    }

    private void recordLag(long offset) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            long latest = outboxStore.latestOffset(conn, subscription.streamName());
            metrics.recordLag(subscription.streamName(), subscription.consumerGroup(), Math.max(0L, latest - offset));
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.FINE, "Failed to record lag for " + subscription, e);
        }
    }

    void stop() {
        stopped = true;
    }

    int consecutiveFailures() {
        return failures;
    }

    public Subscription subscription() {
        return subscription;
    }

    private enum Outcome {
        DELIVERED,
        SKIPPED,
        FAILED
    }
}
