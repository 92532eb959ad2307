package fr.lapetina.qos.domain.exception;

import fr.lapetina.qos.domain.model.ErrorType;

/**
 * Generated configuration could not be pushed to a device or controller.
 */
public final class ConfigurationExecutionException extends QosException {

    private final String target;

    public ConfigurationExecutionException(String target, String reason) {
        this(ErrorType.CONFIGURATION_EXECUTION_ERROR, target, reason, null);
    }

    public ConfigurationExecutionException(ErrorType errorType, String target, String reason, Throwable cause) {
        super(errorType, "Configuration failed on " + target + ": " + reason, cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
