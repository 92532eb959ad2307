package fr.lapetina.qos.infrastructure.sdn;

/**
 * Transport to the SDN controller's REST API.
 *
 * The service shapes every payload; a client only moves requests and responses.
 */
@FunctionalInterface
public interface ControllerClient {

    /**
     * Sends the request and returns whatever status the controller answered.
     *
     * @throws fr.lapetina.qos.domain.exception.ConfigurationExecutionException if the controller
     *         cannot be reached or does not answer in time
     */
    ControllerResponse send(ControllerRequest request);
}
