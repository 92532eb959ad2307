package fr.lapetina.qos.domain.model;

/**
 * Error taxonomy for QoS operations.
 * Provides clear categorization for error handling, results and metrics.
 */
public enum ErrorType {
    /** Malformed policy or violated bandwidth invariant */
    VALIDATION_ERROR,

    /** LLQ 33% priority reservation exceeded, or not enough bandwidth left for standard classes */
    LOW_LATENCY_VALIDATION_ERROR,

    /** Requested policy does not exist */
    POLICY_NOT_FOUND,

    /** Requested network device does not exist */
    DEVICE_NOT_FOUND,

    /** Requested interface does not exist on the device */
    INTERFACE_NOT_FOUND,

    /** Device lacks the QoS capability or vendor support required */
    UNSUPPORTED_DEVICE,

    /** Queue algorithm type known but not implemented */
    UNSUPPORTED_ALGORITHM,

    /** Device refused or failed to execute generated commands */
    CONFIGURATION_EXECUTION_ERROR,

    /** SDN controller call failed */
    CONTROLLER_ERROR,

    /** Operation did not complete within its deadline */
    TIMEOUT,

    /** Circuit breaker is open for the target device */
    CIRCUIT_OPEN,

    /** An active association already exists and reapply was not requested */
    ALREADY_APPLIED,

    /** Internal system error */
    INTERNAL_ERROR
}
