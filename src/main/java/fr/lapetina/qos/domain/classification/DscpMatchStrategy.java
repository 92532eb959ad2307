package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.DscpCodes;
import fr.lapetina.qos.domain.model.Packet;

import java.util.OptionalInt;

/**
 * Matches the DSCP marking, by name ("EF") or by code point ("46").
 */
public final class DscpMatchStrategy implements PacketMatchStrategy<String> {

    @Override
    public String getName() {
        return "dscp";
    }

    @Override
    public boolean matches(Packet packet, String criterion) {
        if (criterion == null || criterion.isBlank()) {
            return true;
        }
        String marking = packet.dscp();
        if (marking == null) {
            return false;
        }
        if (marking.equalsIgnoreCase(criterion.trim())) {
            return true;
        }
        OptionalInt expected = DscpCodes.codePoint(criterion);
        OptionalInt actual = DscpCodes.codePoint(marking);
        return expected.isPresent() && actual.isPresent() && expected.getAsInt() == actual.getAsInt();
    }
}
