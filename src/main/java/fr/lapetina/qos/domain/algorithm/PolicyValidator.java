package fr.lapetina.qos.domain.algorithm;

import fr.lapetina.qos.domain.exception.ValidationException;
import fr.lapetina.qos.domain.model.QosPolicy;
import fr.lapetina.qos.domain.model.TrafficClass;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural and bandwidth validation of policies.
 */
public final class PolicyValidator {

    public static final int MAX_BANDWIDTH_KBPS = 10_000_000;

    private PolicyValidator() {
        // Utility class
    }

    /**
     * Returns every problem found, empty when the policy is valid.
     */
    public static List<String> validate(QosPolicy policy) {
        List<String> errors = new ArrayList<>(structuralErrors(policy));
        if (errors.isEmpty()) {
            guaranteeError(policy).ifPresent(errors::add);
        }
        return errors;
    }

    public static void validateOrThrow(QosPolicy policy) {
        List<String> errors = validate(policy);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * Checks everything except the sum-of-guarantees invariant.
     */
    public static void validateStructureOrThrow(QosPolicy policy) {
        List<String> errors = structuralErrors(policy);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * Sum of class guarantees must not exceed the policy budget.
     */
    public static void requireGuaranteesWithinLimit(QosPolicy policy) {
        guaranteeError(policy).ifPresent(message -> {
            throw new ValidationException(message);
        });
    }

    private static Optional<String> guaranteeError(QosPolicy policy) {
        long totalMin = policy.trafficClasses().stream().mapToLong(TrafficClass::minBandwidth).sum();
        if (totalMin > policy.bandwidthLimit()) {
            return Optional.of("Sum of guaranteed bandwidth (" + totalMin
                    + " kbps) exceeds the policy bandwidth limit (" + policy.bandwidthLimit() + " kbps)");
        }
        return Optional.empty();
    }

    private static List<String> structuralErrors(QosPolicy policy) {
        List<String> errors = new ArrayList<>();
        if (policy.name().isBlank()) {
            errors.add("Policy name must not be blank");
        }
        if (policy.bandwidthLimit() <= 0 || policy.bandwidthLimit() > MAX_BANDWIDTH_KBPS) {
            errors.add("Bandwidth limit must be in (0, " + MAX_BANDWIDTH_KBPS + "] kbps: "
                    + policy.bandwidthLimit());
        }

        Set<String> names = new HashSet<>();
        for (TrafficClass tc : policy.trafficClasses()) {
            String label = "Traffic class '" + tc.name() + "'";
            if (tc.name().isBlank()) {
                errors.add("Traffic class name must not be blank");
            } else if (!names.add(tc.name())) {
                errors.add(label + " is declared twice");
            }
            if (tc.priority() < 0 || tc.priority() > TrafficClass.MAX_PRIORITY) {
                errors.add(label + ": priority must be between 0 and 7, got " + tc.priority());
            }
            if (tc.minBandwidth() < 0) {
                errors.add(label + ": minimum bandwidth must not be negative");
            }
            if (tc.maxBandwidth() < 0) {
                errors.add(label + ": maximum bandwidth must not be negative");
            } else if (tc.maxBandwidth() > 0 && tc.maxBandwidth() < tc.minBandwidth()) {
                errors.add(label + ": maximum bandwidth " + tc.maxBandwidth()
                        + " is below minimum bandwidth " + tc.minBandwidth());
            }
            if (tc.burst() < 0) {
                errors.add(label + ": burst must not be negative");
            }
        }
        return errors;
    }
}
