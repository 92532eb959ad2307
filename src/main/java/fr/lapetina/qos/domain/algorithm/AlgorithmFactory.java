package fr.lapetina.qos.domain.algorithm;

import fr.lapetina.qos.domain.exception.QosException;
import fr.lapetina.qos.domain.model.ErrorType;

import java.util.Optional;

/**
 * Maps queue algorithm types to their implementation.
 *
 * Implementations are stateless, so shared instances are returned.
 */
public final class AlgorithmFactory {

    private static final CbwfqAlgorithm CBWFQ = new CbwfqAlgorithm();
    private static final LlqAlgorithm LLQ = new LlqAlgorithm();
    private static final FqCodelAlgorithm FQ_CODEL = new FqCodelAlgorithm();
    private static final DrrAlgorithm DRR = new DrrAlgorithm();

    private AlgorithmFactory() {
        // Utility class
    }

    /**
     * Returns the implementation for a type.
     *
     * @throws QosException with {@link ErrorType#UNSUPPORTED_ALGORITHM} for types without one
     */
    public static QueueAlgorithm create(QueueAlgorithmType type) {
        return switch (type) {
            case CBWFQ -> CBWFQ;
            case LLQ -> LLQ;
            case FQ_CODEL -> FQ_CODEL;
            case DRR -> DRR;
            case FIFO, PQ, CQ, FQ, WFQ, MDRR -> throw new QosException(ErrorType.UNSUPPORTED_ALGORITHM,
                    "Queue algorithm not supported: " + type.getConfigName());
        };
    }

    /**
     * Creates an algorithm from its configuration name.
     *
     * @return the implementation, or empty if the name is unknown or not implemented
     */
    public static Optional<QueueAlgorithm> create(String name) {
        return QueueAlgorithmType.fromName(name)
                .filter(AlgorithmFactory::isSupported)
                .map(AlgorithmFactory::create);
    }

    public static boolean isSupported(QueueAlgorithmType type) {
        return switch (type) {
            case CBWFQ, LLQ, FQ_CODEL, DRR -> true;
            default -> false;
        };
    }
}
