package fr.lapetina.qos.infrastructure.recognition;

import fr.lapetina.qos.domain.model.PortRange;
import fr.lapetina.qos.domain.model.Protocol;
import fr.lapetina.qos.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads application signatures from a YAML catalogue (file system first, then classpath).
 */
public final class SignatureLoader {

    private static final Logger log = LoggerFactory.getLogger(SignatureLoader.class);

    public static final String DEFAULT_RESOURCE = "application-signatures.yaml";

    private final Yaml yaml;
    private final double defaultThreshold;

    public SignatureLoader(double defaultThreshold) {
        this.yaml = new Yaml(new Constructor(SignatureCatalog.class, new LoaderOptions()));
        this.defaultThreshold = defaultThreshold;
    }

    public SignatureLoader() {
        this(ApplicationSignature.DEFAULT_CONFIDENCE_THRESHOLD);
    }

    public List<ApplicationSignature> load(String location) {
        Path path = Paths.get(location);
        if (Files.exists(path)) {
            try (InputStream is = Files.newInputStream(path)) {
                log.info("Loading application signatures from file: {}", path);
                return load(is);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read signatures from: " + path, e);
            }
        }

        String resource = location.startsWith("/") ? location.substring(1) : location;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Signature catalogue not found: " + location);
            }
            log.info("Loading application signatures from classpath: {}", resource);
            return load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read signatures from classpath: " + resource, e);
        }
    }

    public List<ApplicationSignature> load(InputStream inputStream) {
        SignatureCatalog catalog = yaml.load(inputStream);
        if (catalog == null || catalog.getSignatures() == null) {
            return List.of();
        }
        List<ApplicationSignature> signatures = new ArrayList<>();
        for (SignatureCatalog.SignatureDefinition definition : catalog.getSignatures()) {
            signatures.add(toSignature(definition));
        }
        log.info("Application signatures loaded: count={}", signatures.size());
        return List.copyOf(signatures);
    }

    private ApplicationSignature toSignature(SignatureCatalog.SignatureDefinition definition) {
        String name = definition.getName();
        if (name == null || definition.getCategory() == null) {
            throw new ConfigurationException("Signature requires name and category: " + name);
        }

        Set<Protocol> protocols = EnumSet.noneOf(Protocol.class);
        for (String protocol : definition.getProtocols()) {
            protocols.add(Protocol.fromName(protocol).orElseThrow(() ->
                    new ConfigurationException("Unknown protocol '" + protocol + "' in signature " + name)));
        }

        List<PortRange> ports = new ArrayList<>();
        for (String port : definition.getPorts()) {
            ports.add(parsePorts(name, port));
        }

        List<Pattern> payloadPatterns = new ArrayList<>();
        for (String regex : definition.getPayloadPatterns()) {
            payloadPatterns.add(compile(name, regex));
        }

        Map<String, Pattern> headerPatterns = new LinkedHashMap<>();
        definition.getHeaders().forEach((header, regex) -> headerPatterns.put(header, compile(name, regex)));

        double threshold = definition.getConfidenceThreshold() != null
                ? definition.getConfidenceThreshold()
                : defaultThreshold;

        return new ApplicationSignature(name, definition.getCategory(), protocols, ports,
                payloadPatterns, headerPatterns, toProfile(definition.getBehavior()), threshold);
    }

    private static BehavioralProfile toProfile(SignatureCatalog.BehaviorDefinition behavior) {
        if (behavior == null) {
            return BehavioralProfile.NONE;
        }
        return new BehavioralProfile(
                behavior.getMinPacketSize(),
                behavior.getMaxPacketSize(),
                behavior.getPacketIntervalMs(),
                behavior.isConstantBitrate(),
                behavior.isBidirectional(),
                behavior.isLowLatencyRequired(),
                behavior.getTraits()
        );
    }

    private static PortRange parsePorts(String signature, String value) {
        try {
            String trimmed = value.trim();
            int dash = trimmed.indexOf('-');
            if (dash > 0) {
                return new PortRange(Integer.parseInt(trimmed.substring(0, dash).trim()),
                        Integer.parseInt(trimmed.substring(dash + 1).trim()));
            }
            return PortRange.single(Integer.parseInt(trimmed));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid port '" + value + "' in signature " + signature, e);
        }
    }

    private static Pattern compile(String signature, String regex) {
        try {
            return ApplicationSignature.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid pattern '" + regex + "' in signature " + signature, e);
        }
    }
}
