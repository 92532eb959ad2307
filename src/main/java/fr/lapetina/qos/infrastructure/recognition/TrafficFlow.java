package fr.lapetina.qos.infrastructure.recognition;

import fr.lapetina.qos.domain.model.Packet;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live state of one observed flow.
 *
 * Mutated on every packet of the flow; all access is synchronized on the instance and
 * readers work on an immutable {@link Snapshot}.
 */
public final class TrafficFlow {

    static final int MAX_HEADERS = 32;

    private final FlowKey key;
    private final String flowId;
    private final Instant startTime;
    private final int maxPayloadSamples;
    private final int payloadSampleBytes;

    private Instant lastSeen;
    private long packetCount;
    private long byteCount;
    private final List<byte[]> payloadSamples = new ArrayList<>();
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String lastApplication;

    TrafficFlow(Packet first, int maxPayloadSamples, int payloadSampleBytes) {
        this.key = FlowKey.of(first);
        this.flowId = key.flowId();
        this.startTime = first.timestamp();
        this.lastSeen = first.timestamp();
        this.maxPayloadSamples = maxPayloadSamples;
        this.payloadSampleBytes = payloadSampleBytes;
    }

    synchronized void record(Packet packet) {
        if (packet.timestamp().isAfter(lastSeen)) {
            lastSeen = packet.timestamp();
        }
        packetCount++;
        byteCount += packet.size();

        byte[] payload = packet.payload();
        if (payload.length > 0 && payloadSamples.size() < maxPayloadSamples) {
            payloadSamples.add(Arrays.copyOf(payload, Math.min(payload.length, payloadSampleBytes)));
        }
        for (Map.Entry<String, String> header : packet.headers().entrySet()) {
            if (headers.size() >= MAX_HEADERS) {
                break;
            }
            headers.putIfAbsent(header.getKey(), header.getValue());
        }
    }

    synchronized void setLastApplication(String application) {
        this.lastApplication = application;
    }

    synchronized Instant lastSeen() {
        return lastSeen;
    }

    public FlowKey getKey() {
        return key;
    }

    public String getFlowId() {
        return flowId;
    }

    public synchronized Snapshot snapshot() {
        List<String> samples = payloadSamples.stream()
                .map(bytes -> new String(bytes, StandardCharsets.ISO_8859_1))
                .toList();
        return new Snapshot(flowId, key, startTime, lastSeen, packetCount, byteCount,
                samples, Map.copyOf(headers), lastApplication);
    }

    /**
     * Immutable view of a flow at one point in time.
     */
    public record Snapshot(
            String flowId,
            FlowKey key,
            Instant startTime,
            Instant lastSeen,
            long packetCount,
            long byteCount,
            List<String> payloadSamples,
            Map<String, String> headers,
            String lastApplication
    ) {
        public double durationSeconds() {
            return Duration.between(startTime, lastSeen).toMillis() / 1000.0;
        }

        public double averagePacketSize() {
            return (double) byteCount / Math.max(packetCount, 1);
        }

        public double packetsPerSecond() {
            return packetCount / Math.max(durationSeconds(), 1.0);
        }

        public double bytesPerSecond() {
            return byteCount / Math.max(durationSeconds(), 1.0);
        }

        /**
         * Heuristic: a flow lasting more than 5 seconds with more than 10 packets has
         * seen an exchange in both directions.
         */
        public boolean bidirectional() {
            return durationSeconds() > 5.0 && packetCount > 10;
        }
    }
}
