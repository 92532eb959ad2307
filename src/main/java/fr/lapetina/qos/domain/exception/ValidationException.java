package fr.lapetina.qos.domain.exception;

import fr.lapetina.qos.domain.model.ErrorType;

import java.util.List;

/**
 * Thrown when a policy is malformed or violates a bandwidth invariant.
 * Always raised before any device is touched.
 */
public class ValidationException extends QosException {

    private final List<String> errors;

    public ValidationException(String message) {
        this(ErrorType.VALIDATION_ERROR, message, List.of(message));
    }

    public ValidationException(List<String> errors) {
        this(ErrorType.VALIDATION_ERROR, String.join("; ", errors), errors);
    }

    protected ValidationException(ErrorType errorType, String message, List<String> errors) {
        super(errorType, message);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
