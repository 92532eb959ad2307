package fr.lapetina.qos.infrastructure.adapter;

import fr.lapetina.qos.domain.algorithm.QueueAlgorithmType;
import fr.lapetina.qos.domain.model.Direction;
import fr.lapetina.qos.domain.model.QueueConfiguration;

import java.util.List;
import java.util.Objects;

/**
 * Everything a vendor adapter needs to render one policy on one interface.
 *
 * @param algorithm      algorithm that produced the configurations; adapters pick their layout from it
 * @param bandwidthLimit policy budget in kbps
 */
public record QosCommandRequest(
        String interfaceName,
        String policyName,
        Direction direction,
        QueueAlgorithmType algorithm,
        int bandwidthLimit,
        List<QueueConfiguration> configurations
) {
    public QosCommandRequest {
        Objects.requireNonNull(interfaceName, "Interface name is required");
        Objects.requireNonNull(policyName, "Policy name is required");
        direction = direction != null ? direction : Direction.EGRESS;
        Objects.requireNonNull(algorithm, "Algorithm is required");
        configurations = configurations != null ? List.copyOf(configurations) : List.of();
    }

    public List<String> classNames() {
        return configurations.stream().map(QueueConfiguration::className).toList();
    }
}
