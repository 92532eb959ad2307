package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Optional;

/**
 * Matches the source or destination address against an exact address or a CIDR block.
 *
 * <p>Only address literals are accepted; nothing here triggers a DNS lookup. A malformed
 * criterion or packet address never matches.
 */
public final class IpAddressMatchStrategy implements PacketMatchStrategy<String> {

    private final Endpoint endpoint;

    public IpAddressMatchStrategy(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public String getName() {
        return endpoint.prefix() + "-ip";
    }

    @Override
    public boolean matches(Packet packet, String criterion) {
        if (criterion == null || criterion.isBlank()) {
            return true;
        }
        String address = endpoint.ipOf(packet);
        if (address == null) {
            return false;
        }
        if (criterion.contains("/")) {
            return inCidr(address, criterion.trim());
        }
        Optional<byte[]> expected = parseLiteral(criterion.trim());
        Optional<byte[]> actual = parseLiteral(address);
        if (expected.isEmpty() || actual.isEmpty()) {
            return criterion.trim().equals(address);
        }
        return Arrays.equals(expected.get(), actual.get());
    }

    static boolean inCidr(String address, String cidr) {
        int slash = cidr.indexOf('/');
        Optional<byte[]> network = parseLiteral(cidr.substring(0, slash));
        Optional<byte[]> candidate = parseLiteral(address);
        if (network.isEmpty() || candidate.isEmpty() || network.get().length != candidate.get().length) {
            return false;
        }
        int prefixLength;
        try {
            prefixLength = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            return false;
        }
        byte[] net = network.get();
        byte[] addr = candidate.get();
        if (prefixLength < 0 || prefixLength > net.length * 8) {
            return false;
        }

        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (net[i] != addr[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (net[fullBytes] & mask) == (addr[fullBytes] & mask);
    }

    static Optional<byte[]> parseLiteral(String text) {
        if (text.indexOf(':') >= 0) {
            // IPv6 literals are parsed without name resolution
            try {
                return Optional.of(InetAddress.getByName(text).getAddress());
            } catch (UnknownHostException | SecurityException e) {
                return Optional.empty();
            }
        }
        String[] parts = text.split("\\.", -1);
        if (parts.length != 4) {
            return Optional.empty();
        }
        byte[] bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                return Optional.empty();
            }
            int value = Integer.parseInt(part);
            if (value > 255) {
                return Optional.empty();
            }
            bytes[i] = (byte) value;
        }
        return Optional.of(bytes);
    }
}
