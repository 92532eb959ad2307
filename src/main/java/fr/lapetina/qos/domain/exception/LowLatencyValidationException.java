package fr.lapetina.qos.domain.exception;

import fr.lapetina.qos.domain.model.ErrorType;

import java.util.List;

/**
 * LLQ constraint violated: strict-priority reservation above 33% of the budget,
 * or standard guarantees exceeding what is left after the reservation.
 */
public final class LowLatencyValidationException extends ValidationException {

    public LowLatencyValidationException(String message) {
        super(ErrorType.LOW_LATENCY_VALIDATION_ERROR, message, List.of(message));
    }
}
