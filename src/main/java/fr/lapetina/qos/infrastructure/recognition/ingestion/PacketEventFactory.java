package fr.lapetina.qos.infrastructure.recognition.ingestion;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the ring buffer slots.
 */
public final class PacketEventFactory implements EventFactory<PacketEvent> {

    @Override
    public PacketEvent newInstance() {
        return new PacketEvent();
    }
}
