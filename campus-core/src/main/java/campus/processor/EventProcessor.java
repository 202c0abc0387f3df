package campus.processor;

import campus.event.EventCodec;
import campus.spi.ConnectionProvider;
import campus.spi.MetricsExporter;
import campus.spi.OffsetStore;
import campus.spi.OutboxStore;
import campus.spi.PersistenceException;
import campus.util.DaemonThreadFactory;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers outbox records to the handlers of a {@link HandlerRegistry}, one
 * {@link SubscriptionPoller} per (stream, consumer group).
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventProcessor processor = EventProcessor.builder()
 *     .connectionProvider(connections)
 *     .outboxStore(outboxStore)
 *     .offsetStore(offsetStore)
 *     .codec(codec)
 *     .handlers(handlers)
 *     .build()) {
 *   processor.start();
 *   ...
 * }
 * }</pre>
 *
 * <p>Each subscription is polled with a fixed delay on a daemon thread. {@link #close()}
 * stops scheduling, lets in-flight deliveries finish within the drain timeout and then
 * interrupts the pollers; an interrupted delivery is not acknowledged.
 *
 * @see SubscriptionPoller
 */
public final class EventProcessor implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(EventProcessor.class.getName());

    private final List<SubscriptionPoller> pollers;
    private final long intervalMs;
    private final long drainTimeoutMs;

    private ScheduledExecutorService scheduler;
    private boolean subscribed;
    private volatile boolean closed;

    private EventProcessor(Builder builder) {
        Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        Objects.requireNonNull(builder.outboxStore, "outboxStore");
        Objects.requireNonNull(builder.offsetStore, "offsetStore");
        Objects.requireNonNull(builder.codec, "codec");
        Objects.requireNonNull(builder.handlers, "handlers");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.drainTimeoutMs < 0L) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }

        RetryPolicy retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(200, 60_000);
        MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        Tracer tracer = builder.tracer != null
                ? builder.tracer : GlobalOpenTelemetry.getTracer("campus.processor");

        List<SubscriptionPoller> pollers = new ArrayList<>();
        for (Subscription subscription : builder.handlers.subscriptions()) {
            pollers.add(new SubscriptionPoller(
                    subscription,
                    builder.handlers.handlersOf(subscription),
                    builder.connectionProvider,
                    builder.outboxStore,
                    builder.offsetStore,
                    builder.codec,
                    retryPolicy,
                    metrics,
                    tracer,
                    builder.batchSize));
        }
        this.pollers = List.copyOf(pollers);
        this.intervalMs = builder.intervalMs;
        this.drainTimeoutMs = builder.drainTimeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Subscribes every consumer group and starts polling. Subsequent calls are no-ops.
     *
     * @throws IllegalStateException if the processor was closed
     * @throws PersistenceException  if a subscription could not be stored
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("EventProcessor has been closed");
        }
        if (scheduler != null) {
            return;
        }
        subscribeAll();
        if (pollers.isEmpty()) {
            logger.info("No event handlers registered; processor idle");
            return;
        }
        scheduler = Executors.newScheduledThreadPool(pollers.size(), new DaemonThreadFactory("campus-processor-"));
        for (SubscriptionPoller poller : pollers) {
            scheduler.scheduleWithFixedDelay(poller::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
        logger.info("Started " + pollers.size() + " subscription poller(s), interval " + intervalMs + " ms");
    }

    /**
     * Runs one cycle of every subscription on the calling thread. Meant for tests and for
     * callers that drive polling themselves; do not combine with {@link #start()}.
     *
     * @return records acknowledged across all subscriptions
     */
    public synchronized int pollOnce() {
        if (closed) {
            return 0;
        }
        subscribeAll();
        int acknowledged = 0;
        for (SubscriptionPoller poller : pollers) {
            try {
                acknowledged += poller.pollOnce();
            } catch (SQLException e) {
                throw new PersistenceException("Poll failed for " + poller.subscription(), e);
            }
        }
        return acknowledged;
    }

    private void subscribeAll() {
        if (subscribed) {
            return;
        }
        for (SubscriptionPoller poller : pollers) {
            try {
                poller.subscribe();
            } catch (SQLException e) {
                throw new PersistenceException("Failed to subscribe " + poller.subscription(), e);
            }
        }
        subscribed = true;
    }

    public List<Subscription> subscriptions() {
        List<Subscription> result = new ArrayList<>(pollers.size());
        for (SubscriptionPoller poller : pollers) {
            result.add(poller.subscription());
        }
        return result;
    }

    /**
     * Stops polling. Waits up to the drain timeout for running deliveries, then interrupts
     * them.
     */
    @Override
    public void close() {
        ScheduledExecutorService executor;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            executor = scheduler;
            scheduler = null;
        }
        for (SubscriptionPoller poller : pollers) {
            poller.stop();
        }
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warning("Deliveries still running after " + drainTimeoutMs + " ms; interrupting");
                executor.shutdownNow();
                if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    logger.log(Level.SEVERE, "Processor threads did not terminate");
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Builder for {@link EventProcessor}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private OutboxStore outboxStore;
        private OffsetStore offsetStore;
        private EventCodec codec;
        private HandlerRegistry handlers;
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics;
        private Tracer tracer;
        private int batchSize = 100;
        private long intervalMs = 1000;
        private long drainTimeoutMs = 5000;

        private Builder() {
        }

        /**
         * Connections for reading the outbox and storing offsets. Each cycle opens its own
         * short-lived connections in auto-commit mode.
         *
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder outboxStore(OutboxStore outboxStore) {
            this.outboxStore = outboxStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder offsetStore(OffsetStore offsetStore) {
            this.offsetStore = offsetStore;
            return this;
        }

        /**
         * Decoder for stored payloads. Types it does not know are acknowledged as skipped.
         *
         * <p><b>Required.</b>
         */
        public Builder codec(EventCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Handlers to deliver to; the processor polls one subscription per registered
         * consumer group.
         *
         * <p><b>Required.</b>
         */
        public Builder handlers(HandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        /**
         * Backoff after a handler failure.
         *
         * <p>Optional. Defaults to exponential backoff from 200 ms up to 60 s.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Tracer for consumer spans.
         *
         * <p>Optional. Defaults to the {@link GlobalOpenTelemetry} tracer
         * {@code campus.processor}.
         */
        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        /**
         * Records fetched per cycle and subscription.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Delay between the end of one cycle and the start of the next.
         *
         * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Time {@link EventProcessor#close()} waits for running deliveries before
         * interrupting them.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * @throws NullPointerException     if a required component is missing
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public EventProcessor build() {
            return new EventProcessor(this);
        }
    }
}
