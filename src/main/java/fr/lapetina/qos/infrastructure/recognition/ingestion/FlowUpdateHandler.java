package fr.lapetina.qos.infrastructure.recognition.ingestion;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.qos.infrastructure.recognition.ApplicationRecognitionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole consumer of the ingestion ring buffer: folds each packet into the flow table and,
 * when the publisher asked for it, completes the classification future.
 */
public final class FlowUpdateHandler implements EventHandler<PacketEvent> {

    private static final Logger log = LoggerFactory.getLogger(FlowUpdateHandler.class);

    private final ApplicationRecognitionService recognitionService;

    public FlowUpdateHandler(ApplicationRecognitionService recognitionService) {
        this.recognitionService = recognitionService;
    }

    @Override
    public void onEvent(PacketEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.wantsClassification()) {
                event.getClassificationFuture().complete(recognitionService.classify(event.getPacket()));
            } else {
                recognitionService.observe(event.getPacket());
            }
            log.trace("Packet ingested: sequence={}, endOfBatch={}", sequence, endOfBatch);
        } finally {
            event.clear();
        }
    }
}
