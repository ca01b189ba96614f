package fr.lapetina.llm.orchestrator.aggregation;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.llm.orchestrator.aggregation.handlers.AggregationMetricsHandler;
import fr.lapetina.llm.orchestrator.aggregation.handlers.DedupHandler;
import fr.lapetina.llm.orchestrator.aggregation.handlers.EmissionHandler;
import fr.lapetina.llm.orchestrator.domain.model.ModelStats;
import fr.lapetina.llm.orchestrator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Arrival-order merge of every model stream.
 *
 * PRODUCER TYPE CHOICE: MULTI
 *
 * Each provider stream is read on its own thread and publishes candidates as
 * soon as they are parsed. The ring buffer serializes them into one arrival
 * order that the dedup and emission handlers consume on a single thread each.
 *
 * HANDLER CHAIN
 *
 * dedup -> emission -> metrics. The dedup set and per-model sequences are
 * owned by one thread, so the first arrival of a key always wins and candidate
 * ids stay dense per model.
 *
 * BACKPRESSURE
 *
 * Publishing blocks on a full ring. A stream thread that cannot publish stops
 * reading, which in turn applies TCP backpressure to the provider.
 */
public final class AggregationPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AggregationPipeline.class);

    private final Disruptor<AggregationEvent> disruptor;
    private final RingBuffer<AggregationEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final long shutdownTimeoutMs;

    private AggregationPipeline(Builder builder) {
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;

        ThreadFactory threadFactory = new AggregationThreadFactory("aggregation-handler");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new AggregationEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        disruptor
                .handleEventsWith(new DedupHandler())
                .then(new EmissionHandler())
                .then(new AggregationMetricsHandler(builder.metricsRegistry));

        disruptor.setDefaultExceptionHandler(new AggregationExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("AggregationPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("AggregationPipeline started");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Publishes one parsed candidate text.
     *
     * @param model logical model name
     */
    public void publishCandidate(BatchHandle batch, String model, String text) {
        ensureRunning();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).initializeCandidate(batch, model, text);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Publishes the successful end of one model's stream.
     */
    public void publishModelComplete(BatchHandle batch, ModelStats stats) {
        publishTerminal(batch, AggregationEventType.MODEL_COMPLETE, stats);
    }

    /**
     * Publishes the terminal failure of one model.
     */
    public void publishModelFailed(BatchHandle batch, ModelStats stats) {
        publishTerminal(batch, AggregationEventType.MODEL_FAILED, stats);
    }

    private void publishTerminal(BatchHandle batch, AggregationEventType type, ModelStats stats) {
        ensureRunning();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).initializeTerminal(batch, type, stats);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("Aggregation pipeline not running");
        }
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down AggregationPipeline...");
            try {
                disruptor.shutdown(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
                log.info("AggregationPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("AggregationPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class AggregationThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        AggregationThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Logs handler failures; the failing entry is skipped.
     */
    private static class AggregationExceptionHandler implements ExceptionHandler<AggregationEvent> {

        private static final Logger log = LoggerFactory.getLogger(AggregationExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, AggregationEvent event) {
            log.error("Exception in aggregation handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during aggregation pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during aggregation pipeline shutdown", ex);
        }
    }

    /**
     * Builder for AggregationPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long shutdownTimeoutMs = 5_000;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public AggregationPipeline build() {
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new AggregationPipeline(this);
        }
    }
}
