package fr.lapetina.qos.domain.model;

/**
 * Scheduler parameters computed for one traffic class.
 *
 * @param bufferSize       buffer in packets
 * @param queueLimit       maximum queue depth in packets
 * @param serviceRate      guaranteed rate in kbps
 * @param weight           relative scheduling weight (quantum for FQ-CoDel)
 * @param priorityLevel    0-7
 * @param bandwidthPercent share of the policy budget, 0 for strict-priority queues
 */
public record QueueParameters(
        int bufferSize,
        int queueLimit,
        int serviceRate,
        double weight,
        int priorityLevel,
        double bandwidthPercent
) {
}
