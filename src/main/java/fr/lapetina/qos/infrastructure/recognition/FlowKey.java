package fr.lapetina.qos.infrastructure.recognition;

import fr.lapetina.qos.domain.model.Packet;
import fr.lapetina.qos.domain.model.Protocol;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 5-tuple identifying a flow.
 */
public record FlowKey(
        String sourceIp,
        int sourcePort,
        String destinationIp,
        int destinationPort,
        Protocol protocol
) {
    public static FlowKey of(Packet packet) {
        return new FlowKey(packet.sourceIp(), packet.sourcePort(),
                packet.destinationIp(), packet.destinationPort(), packet.protocol());
    }

    /**
     * Stable hexadecimal identifier derived from the 5-tuple.
     */
    public String flowId() {
        String raw = sourceIp + "_" + sourcePort + "_" + destinationIp + "_" + destinationPort
                + "_" + protocol.configName();
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
