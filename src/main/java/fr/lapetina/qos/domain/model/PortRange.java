package fr.lapetina.qos.domain.model;

/**
 * Inclusive port range. The range {@code 0-0} is a wildcard.
 */
public record PortRange(int start, int end) {

    public static final PortRange ANY = new PortRange(0, 0);

    public PortRange {
        if (start < 0 || start > 65535 || end < 0 || end > 65535) {
            throw new IllegalArgumentException("Port out of range: " + start + "-" + end);
        }
        if (end < start) {
            throw new IllegalArgumentException("Port range end before start: " + start + "-" + end);
        }
    }

    public static PortRange single(int port) {
        return new PortRange(port, port);
    }

    public boolean isWildcard() {
        return start == 0 && end == 0;
    }

    public boolean isSinglePort() {
        return start == end;
    }

    public boolean contains(int port) {
        return isWildcard() || (port >= start && port <= end);
    }
}
