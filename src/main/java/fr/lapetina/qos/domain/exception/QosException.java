package fr.lapetina.qos.domain.exception;

import fr.lapetina.qos.domain.model.ErrorType;

/**
 * Base class of every QoS failure. Carries the {@link ErrorType} used for results and metrics.
 */
public class QosException extends RuntimeException {

    private final ErrorType errorType;

    public QosException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public QosException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
