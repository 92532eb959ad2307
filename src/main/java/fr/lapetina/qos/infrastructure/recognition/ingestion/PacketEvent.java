package fr.lapetina.qos.infrastructure.recognition.ingestion;

import fr.lapetina.qos.domain.model.Packet;
import fr.lapetina.qos.infrastructure.recognition.ApplicationClassification;

import java.util.concurrent.CompletableFuture;

/**
 * Ring buffer slot carrying one captured packet.
 *
 * Mutable and reused by the Disruptor; only touched by the publisher before
 * {@code publish} and by the single consumer afterwards.
 */
public final class PacketEvent {

    private Packet packet;
    // Null when the publisher does not wait for a classification
    private CompletableFuture<ApplicationClassification> classificationFuture;

    void initialize(Packet packet, CompletableFuture<ApplicationClassification> classificationFuture) {
        this.packet = packet;
        this.classificationFuture = classificationFuture;
    }

    void clear() {
        this.packet = null;
        this.classificationFuture = null;
    }

    public Packet getPacket() {
        return packet;
    }

    public CompletableFuture<ApplicationClassification> getClassificationFuture() {
        return classificationFuture;
    }

    public boolean wantsClassification() {
        return classificationFuture != null;
    }

    @Override
    public String toString() {
        return packet == null ? "PacketEvent{empty}"
                : "PacketEvent{" + packet.sourceIp() + ":" + packet.sourcePort()
                + " -> " + packet.destinationIp() + ":" + packet.destinationPort() + "}";
    }
}
