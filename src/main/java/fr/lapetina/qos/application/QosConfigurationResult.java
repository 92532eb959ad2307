package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.exception.QosException;
import fr.lapetina.qos.domain.exception.ValidationException;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.domain.model.QueueConfiguration;

import java.util.List;

/**
 * Outcome of an orchestration call. Use cases return it instead of throwing.
 *
 * @param errorType          null on success
 * @param commandsGenerated  commands sent (or that would have been sent) to the device
 * @param queueConfigurations computed per-class parameters, empty when validation failed
 */
public record QosConfigurationResult(
        boolean success,
        String message,
        ErrorType errorType,
        List<String> errors,
        List<String> commandsGenerated,
        List<String> warnings,
        List<QueueConfiguration> queueConfigurations
) {
    public QosConfigurationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        commandsGenerated = commandsGenerated != null ? List.copyOf(commandsGenerated) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        queueConfigurations = queueConfigurations != null ? List.copyOf(queueConfigurations) : List.of();
    }

    public static QosConfigurationResult success(String message, List<String> commands,
                                                 List<QueueConfiguration> configurations, List<String> warnings) {
        return new QosConfigurationResult(true, message, null, List.of(), commands, warnings, configurations);
    }

    public static QosConfigurationResult failure(ErrorType errorType, String message, List<String> errors) {
        return new QosConfigurationResult(false, message, errorType, errors, List.of(), List.of(), List.of());
    }

    /**
     * Failure after commands were generated, keeping them for inspection.
     */
    public static QosConfigurationResult failure(ErrorType errorType, String message, List<String> errors,
                                                 List<String> commands, List<QueueConfiguration> configurations) {
        return new QosConfigurationResult(false, message, errorType, errors, commands, List.of(), configurations);
    }

    public static QosConfigurationResult fromException(QosException e) {
        List<String> errors = e instanceof ValidationException
                ? ((ValidationException) e).getErrors()
                : List.of(e.getMessage());
        return failure(e.getErrorType(), e.getMessage(), errors);
    }
}
