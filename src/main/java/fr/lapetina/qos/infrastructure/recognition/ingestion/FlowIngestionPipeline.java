package fr.lapetina.qos.infrastructure.recognition.ingestion;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.qos.domain.model.Packet;
import fr.lapetina.qos.infrastructure.config.QosConfig;
import fr.lapetina.qos.infrastructure.recognition.ApplicationClassification;
import fr.lapetina.qos.infrastructure.recognition.ApplicationRecognitionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asynchronous packet ingestion in front of {@link ApplicationRecognitionService}.
 *
 * Capture threads publish into a multi-producer ring buffer; a single consumer thread
 * applies every packet to the flow table, so flow updates happen in publication order.
 * A full ring buffer is reported immediately with {@link IngestionBackpressureException}
 * instead of blocking the capture thread.
 */
public final class FlowIngestionPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FlowIngestionPipeline.class);

    private final Disruptor<PacketEvent> disruptor;
    private final RingBuffer<PacketEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private FlowIngestionPipeline(Builder builder) {
        this.disruptor = new Disruptor<>(
                new PacketEventFactory(),
                builder.ringBufferSize,
                new IngestionThreadFactory("packet-ingestion"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(new FlowUpdateHandler(builder.recognitionService));
        disruptor.setDefaultExceptionHandler(new IngestionExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("FlowIngestionPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("FlowIngestionPipeline started");
        }
    }

    /**
     * Queues a packet for flow tracking only.
     *
     * @throws IngestionBackpressureException if the pipeline is stopped or the ring buffer is full
     */
    public void publish(Packet packet) {
        claimAndPublish(packet, null);
    }

    /**
     * Queues a packet and returns its flow classification once the consumer has processed it.
     *
     * @throws IngestionBackpressureException if the pipeline is stopped or the ring buffer is full
     */
    public CompletableFuture<ApplicationClassification> submit(Packet packet) {
        CompletableFuture<ApplicationClassification> future = new CompletableFuture<>();
        claimAndPublish(packet, future);
        return future;
    }

    private void claimAndPublish(Packet packet, CompletableFuture<ApplicationClassification> future) {
        if (!running.get()) {
            throw new IngestionBackpressureException(IngestionBackpressureException.Reason.NOT_RUNNING,
                    "packet rejected");
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new IngestionBackpressureException(IngestionBackpressureException.Reason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity());
        }

        try {
            ringBuffer.get(sequence).initialize(packet, future);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains pending packets, then stops the consumer.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down FlowIngestionPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("FlowIngestionPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("FlowIngestionPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
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

    private static final class IngestionThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        IngestionThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static final class IngestionExceptionHandler implements ExceptionHandler<PacketEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, PacketEvent event) {
            log.error("Packet ingestion failed: sequence={}, event={}", sequence, event, ex);
            if (event.wantsClassification() && !event.getClassificationFuture().isDone()) {
                event.getClassificationFuture().completeExceptionally(ex);
            }
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during ingestion start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during ingestion shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 4096;
        private String waitStrategy = "blocking";
        private ApplicationRecognitionService recognitionService;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        public Builder recognitionService(ApplicationRecognitionService recognitionService) {
            this.recognitionService = recognitionService;
            return this;
        }

        public Builder fromConfig(QosConfig.IngestionConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            return this;
        }

        public FlowIngestionPipeline build() {
            if (recognitionService == null) {
                throw new IllegalStateException("ApplicationRecognitionService is required");
            }
            return new FlowIngestionPipeline(this);
        }
    }
}
