package fr.lapetina.qos.infrastructure.recognition;

import fr.lapetina.qos.domain.model.PortRange;
import fr.lapetina.qos.domain.model.Protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static description of how to recognise an application.
 * Patterns are compiled once, case-insensitive.
 */
public record ApplicationSignature(
        String name,
        String category,
        Set<Protocol> protocols,
        List<PortRange> ports,
        List<Pattern> payloadPatterns,
        Map<String, Pattern> headerPatterns,
        BehavioralProfile behavior,
        double confidenceThreshold
) {
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    public ApplicationSignature {
        Objects.requireNonNull(name, "Signature name is required");
        Objects.requireNonNull(category, "Signature category is required");
        protocols = protocols != null ? Set.copyOf(protocols) : Set.of();
        ports = ports != null ? List.copyOf(ports) : List.of();
        payloadPatterns = payloadPatterns != null ? List.copyOf(payloadPatterns) : List.of();
        // Keep declaration order for deterministic matching
        headerPatterns = headerPatterns != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(headerPatterns))
                : Map.of();
        behavior = behavior != null ? behavior : BehavioralProfile.NONE;
    }

    public boolean matchesPort(int port) {
        return port > 0 && ports.stream().anyMatch(range -> range.contains(port));
    }

    static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
