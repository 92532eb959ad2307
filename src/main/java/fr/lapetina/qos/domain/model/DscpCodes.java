package fr.lapetina.qos.domain.model;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * DSCP per-hop-behaviour names and their code points.
 */
public final class DscpCodes {

    private static final Map<String, Integer> CODE_POINTS = Map.ofEntries(
            Map.entry("af11", 10), Map.entry("af12", 12), Map.entry("af13", 14),
            Map.entry("af21", 18), Map.entry("af22", 20), Map.entry("af23", 22),
            Map.entry("af31", 26), Map.entry("af32", 28), Map.entry("af33", 30),
            Map.entry("af41", 34), Map.entry("af42", 36), Map.entry("af43", 38),
            Map.entry("ef", 46),
            Map.entry("cs0", 0), Map.entry("cs1", 8), Map.entry("cs2", 16), Map.entry("cs3", 24),
            Map.entry("cs4", 32), Map.entry("cs5", 40), Map.entry("cs6", 48), Map.entry("cs7", 56)
    );

    private DscpCodes() {
        // Utility class
    }

    /**
     * Resolves a DSCP name ("EF", "af41") or a decimal value ("46").
     */
    public static OptionalInt codePoint(String dscp) {
        if (dscp == null || dscp.isBlank()) {
            return OptionalInt.empty();
        }
        String key = dscp.trim().toLowerCase(Locale.ROOT);
        Integer value = CODE_POINTS.get(key);
        if (value != null) {
            return OptionalInt.of(value);
        }
        try {
            int numeric = Integer.parseInt(key);
            return numeric >= 0 && numeric <= 63 ? OptionalInt.of(numeric) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Value of the IPv4 TOS byte for a DSCP (code point shifted by two ECN bits).
     */
    public static OptionalInt tosByte(String dscp) {
        OptionalInt codePoint = codePoint(dscp);
        return codePoint.isPresent() ? OptionalInt.of(codePoint.getAsInt() << 2) : OptionalInt.empty();
    }

    public static boolean isKnownName(String dscp) {
        return dscp != null && CODE_POINTS.containsKey(dscp.trim().toLowerCase(Locale.ROOT));
    }
}
