package fr.lapetina.qos.domain.classification;

import fr.lapetina.qos.domain.model.Packet;

public final class VlanMatchStrategy implements PacketMatchStrategy<Integer> {

    @Override
    public String getName() {
        return "vlan";
    }

    @Override
    public boolean matches(Packet packet, Integer criterion) {
        if (criterion == null) {
            return true;
        }
        return criterion.equals(packet.vlan());
    }
}
