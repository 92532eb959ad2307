package fr.lapetina.qos.infrastructure.recognition.ingestion;

/**
 * Thrown when a packet cannot be accepted by the ingestion pipeline.
 */
public final class IngestionBackpressureException extends RuntimeException {

    private final Reason reason;

    public IngestionBackpressureException(Reason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        RING_BUFFER_FULL("Ring buffer is full"),
        NOT_RUNNING("Ingestion pipeline is not running");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
