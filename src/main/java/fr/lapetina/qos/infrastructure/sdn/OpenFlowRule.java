package fr.lapetina.qos.infrastructure.sdn;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * OpenFlow rule steering one classifier's traffic into its queue and meter.
 *
 * <p>A rule built from a policy is a template with {@link #ANY_SWITCH} as switch; deployment
 * copies it per target switch with {@link #onSwitch(String)}.
 *
 * @param match   criteria keyed by field, iterated in field declaration order
 * @param flowId  identifier assigned by the controller once installed, null before
 */
public record OpenFlowRule(
        String switchId,
        int tableId,
        int priority,
        Map<MatchField, String> match,
        List<Action> actions,
        String className,
        String flowId
) {
    public static final String ANY_SWITCH = "*";

    public OpenFlowRule {
        Objects.requireNonNull(switchId, "Switch id is required");
        match = match == null || match.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(match));
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public OpenFlowRule onSwitch(String targetSwitch) {
        return new OpenFlowRule(targetSwitch, tableId, priority, match, actions, className, null);
    }

    public OpenFlowRule withFlowId(String id) {
        return new OpenFlowRule(switchId, tableId, priority, match, actions, className, id);
    }

    /**
     * Match fields with their ONOS criterion type and value key.
     */
    public enum MatchField {
        IN_PORT("IN_PORT", "port"),
        ETH_TYPE("ETH_TYPE", "ethType"),
        VLAN_VID("VLAN_VID", "vlanId"),
        IP_PROTO("IP_PROTO", "protocol"),
        IP_DSCP("IP_DSCP", "ipDscp"),
        IPV4_SRC("IPV4_SRC", "ip"),
        IPV4_DST("IPV4_DST", "ip"),
        TCP_SRC("TCP_SRC", "tcpPort"),
        TCP_DST("TCP_DST", "tcpPort"),
        UDP_SRC("UDP_SRC", "udpPort"),
        UDP_DST("UDP_DST", "udpPort");

        private final String onosType;
        private final String onosKey;

        MatchField(String onosType, String onosKey) {
            this.onosType = onosType;
            this.onosKey = onosKey;
        }

        public String onosType() {
            return onosType;
        }

        public String onosKey() {
            return onosKey;
        }
    }

    public enum ActionType {
        SET_QUEUE,
        METER,
        OUTPUT
    }

    /**
     * @param argument queue id, meter id or output port
     */
    public record Action(ActionType type, String argument) {

        public static Action queue(int queueId) {
            return new Action(ActionType.SET_QUEUE, Integer.toString(queueId));
        }

        public static Action meter(int meterId) {
            return new Action(ActionType.METER, Integer.toString(meterId));
        }

        public static Action output(String port) {
            return new Action(ActionType.OUTPUT, port);
        }
    }
}
