package fr.lapetina.qos.domain.algorithm;

import java.util.Locale;
import java.util.Optional;

/**
 * Queueing disciplines known to the system. Only some of them have an implementation,
 * see {@link AlgorithmFactory}.
 */
public enum QueueAlgorithmType {
    FIFO("fifo"),
    PQ("pq"),
    CQ("cq"),
    FQ("fq"),
    WFQ("wfq"),
    CBWFQ("cbwfq"),
    LLQ("llq"),
    MDRR("mdrr"),
    FQ_CODEL("fq_codel"),
    DRR("drr");

    private final String configName;

    QueueAlgorithmType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Parses a configuration name ("fq_codel", "fq-codel", "CBWFQ").
     */
    public static Optional<QueueAlgorithmType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (QueueAlgorithmType type : values()) {
            if (type.configName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
