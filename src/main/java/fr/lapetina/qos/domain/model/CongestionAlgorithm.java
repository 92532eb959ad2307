package fr.lapetina.qos.domain.model;

/**
 * Congestion avoidance behaviour of a queue.
 */
public enum CongestionAlgorithm {
    TAIL_DROP,
    RED,
    WRED,
    ECN
}
