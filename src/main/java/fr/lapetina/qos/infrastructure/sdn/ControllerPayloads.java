package fr.lapetina.qos.infrastructure.sdn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.qos.domain.exception.ConfigurationExecutionException;
import fr.lapetina.qos.domain.exception.UnsupportedDeviceException;
import fr.lapetina.qos.domain.model.ErrorType;
import fr.lapetina.qos.infrastructure.sdn.OpenFlowRule.Action;
import fr.lapetina.qos.infrastructure.sdn.OpenFlowRule.MatchField;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request and response shapes of one controller REST API.
 *
 * <p>Payload building is separate from transport so that both can be tested on their own:
 * {@link SdnIntegrationService} asks this class for requests, sends them through a
 * {@link ControllerClient} and hands the bodies back for parsing.
 */
public abstract class ControllerPayloads {

    protected final ObjectMapper objectMapper;

    protected ControllerPayloads(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws UnsupportedDeviceException for controllers without payload shapes (Ryu, Floodlight)
     */
    public static ControllerPayloads forType(ControllerType type, ObjectMapper objectMapper) {
        return switch (type) {
            case ONOS -> new Onos(objectMapper);
            case OPENDAYLIGHT -> new OpenDaylight(objectMapper);
            case RYU, FLOODLIGHT -> throw new UnsupportedDeviceException(
                    "Controller type " + type + " is not supported for policy installation");
        };
    }

    public abstract ControllerType type();

    public abstract ControllerRequest installQueue(String switchId, SdnQueue queue);

    public abstract ControllerRequest installMeter(String switchId, SdnMeter meter);

    /**
     * @param flowKey identifier proposed by the caller; controllers that assign their own ignore it
     */
    public abstract ControllerRequest installFlow(OpenFlowRule rule, String flowKey);

    /**
     * Identifier under which the installed flow can later be deleted, or null if unknown.
     */
    public abstract String installedFlowId(ControllerResponse response, String flowKey);

    public abstract ControllerRequest removeFlow(String switchId, int tableId, String flowId);

    public abstract List<ControllerRequest> topologyRequests();

    /**
     * @param bodies response bodies, in the order of {@link #topologyRequests()}
     */
    public abstract SdnTopology parseTopology(List<String> bodies, Instant discoveredAt);

    public abstract ControllerRequest flowStatistics(String switchId);

    public abstract PolicyStatistics.SwitchStatistics parseFlowStatistics(String body);

    protected String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize controller payload", e);
        }
    }

    protected JsonNode read(String body) {
        try {
            return objectMapper.readTree(body.isEmpty() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new ConfigurationExecutionException(ErrorType.CONTROLLER_ERROR, type().name(),
                    "unreadable controller response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * ONOS REST API ({@code /onos/v1}).
     */
    static final class Onos extends ControllerPayloads {

        static final String API = "/onos/v1";

        Onos(ObjectMapper objectMapper) {
            super(objectMapper);
        }

        @Override
        public ControllerType type() {
            return ControllerType.ONOS;
        }

        /**
         * Queues are pushed as network configuration under the device's {@code qos} subject.
         */
        @Override
        public ControllerRequest installQueue(String switchId, SdnQueue queue) {
            ObjectNode root = objectMapper.createObjectNode();
            ObjectNode queueNode = root.putObject("devices").putObject(switchId).putObject("qos")
                    .putObject("queues").putObject(Integer.toString(queue.queueId()));
            queueNode.put("name", queue.name());
            queueNode.put("minRate", queue.minRateBps());
            queueNode.put("maxRate", queue.maxRateBps());
            queueNode.put("priority", queue.priority());
            queueNode.put("dscp", queue.dscp());
            return ControllerRequest.post(API + "/network/configuration", write(root));
        }

        @Override
        public ControllerRequest installMeter(String switchId, SdnMeter meter) {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("deviceId", switchId);
            root.put("unit", "KB_PER_SEC");
            root.put("burst", meter.burstKb() > 0);
            ObjectNode band = root.putArray("bands").addObject();
            band.put("type", SdnMeter.BAND_TYPE);
            // kilobits to kilobytes
            band.put("rate", Math.max(1, (meter.rateKbps() + 7) / 8));
            band.put("burstSize", (meter.burstKb() + 7) / 8);
            return ControllerRequest.post(API + "/meters/" + switchId, write(root));
        }

        @Override
        public ControllerRequest installFlow(OpenFlowRule rule, String flowKey) {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("priority", rule.priority());
            root.put("timeout", 0);
            root.put("isPermanent", true);
            root.put("deviceId", rule.switchId());
            root.put("tableId", rule.tableId());

            ArrayNode criteria = root.putObject("selector").putArray("criteria");
            for (Map.Entry<MatchField, String> entry : rule.match().entrySet()) {
                ObjectNode criterion = criteria.addObject();
                MatchField field = entry.getKey();
                criterion.put("type", field.onosType());
                switch (field) {
                    case ETH_TYPE, IPV4_SRC, IPV4_DST -> criterion.put(field.onosKey(), entry.getValue());
                    default -> criterion.put(field.onosKey(), Integer.parseInt(entry.getValue()));
                }
            }

            ArrayNode instructions = root.putObject("treatment").putArray("instructions");
            for (Action action : rule.actions()) {
                ObjectNode instruction = instructions.addObject();
                switch (action.type()) {
                    case SET_QUEUE -> {
                        instruction.put("type", "QUEUE");
                        instruction.put("queueId", Integer.parseInt(action.argument()));
                    }
                    case METER -> {
                        instruction.put("type", "METER");
                        instruction.put("meterId", action.argument());
                    }
                    case OUTPUT -> {
                        instruction.put("type", "OUTPUT");
                        instruction.put("port", action.argument());
                    }
                }
            }
            return ControllerRequest.post(API + "/flows/" + rule.switchId(), write(root));
        }

        /**
         * ONOS answers {@code 201 Created} with {@code Location: .../flows/{deviceId}/{flowId}}.
         */
        @Override
        public String installedFlowId(ControllerResponse response, String flowKey) {
            String location = response.location();
            if (location == null || location.isBlank()) {
                return null;
            }
            String trimmed = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
            return trimmed.substring(trimmed.lastIndexOf('/') + 1);
        }

        @Override
        public ControllerRequest removeFlow(String switchId, int tableId, String flowId) {
            return ControllerRequest.delete(API + "/flows/" + switchId + "/" + flowId);
        }

        @Override
        public List<ControllerRequest> topologyRequests() {
            return List.of(ControllerRequest.get(API + "/devices"), ControllerRequest.get(API + "/links"));
        }

        @Override
        public SdnTopology parseTopology(List<String> bodies, Instant discoveredAt) {
            List<String> switches = new ArrayList<>();
            for (JsonNode device : read(bodies.get(0)).path("devices")) {
                String id = device.path("id").asText(null);
                if (id != null) {
                    switches.add(id);
                }
            }
            List<SdnTopology.Link> links = new ArrayList<>();
            for (JsonNode link : read(bodies.get(1)).path("links")) {
                links.add(new SdnTopology.Link(
                        link.path("src").path("device").asText(),
                        link.path("src").path("port").asText(),
                        link.path("dst").path("device").asText(),
                        link.path("dst").path("port").asText()));
            }
            return new SdnTopology(switches, links, discoveredAt);
        }

        @Override
        public ControllerRequest flowStatistics(String switchId) {
            return ControllerRequest.get(API + "/statistics/flows/" + switchId);
        }

        @Override
        public PolicyStatistics.SwitchStatistics parseFlowStatistics(String body) {
            JsonNode flows = read(body).path("flows");
            long bytes = 0;
            long packets = 0;
            for (JsonNode flow : flows) {
                bytes += flow.path("bytes").asLong(0);
                packets += flow.path("packets").asLong(0);
            }
            return PolicyStatistics.SwitchStatistics.of(flows.size(), bytes, packets);
        }
    }

    /**
     * OpenDaylight RESTCONF API (inventory and OVSDB models).
     */
    static final class OpenDaylight extends ControllerPayloads {

        static final String CONFIG = "/restconf/config";
        static final String OPERATIONAL = "/restconf/operational";
        static final int IPV4_ETHER_TYPE = 0x800;

        OpenDaylight(ObjectMapper objectMapper) {
            super(objectMapper);
        }

        @Override
        public ControllerType type() {
            return ControllerType.OPENDAYLIGHT;
        }

        @Override
        public ControllerRequest installQueue(String switchId, SdnQueue queue) {
            String queueId = "q" + queue.queueId();
            ObjectNode root = objectMapper.createObjectNode();
            ObjectNode queueNode = root.putArray("ovsdb:queues").addObject();
            queueNode.put("queue-id", queueId);
            queueNode.put("dscp", queue.dscp());
            ArrayNode otherConfig = queueNode.putArray("queues-other-config");
            addOtherConfig(otherConfig, "min-rate", queue.minRateBps());
            addOtherConfig(otherConfig, "max-rate", queue.maxRateBps());
            addOtherConfig(otherConfig, "priority", queue.priority());
            return ControllerRequest.put(CONFIG + "/network-topology:network-topology/topology/ovsdb:1/node/"
                    + switchId + "/ovsdb:queues/" + queueId, write(root));
        }

        private static void addOtherConfig(ArrayNode otherConfig, String key, long value) {
            ObjectNode entry = otherConfig.addObject();
            entry.put("queue-other-config-key", key);
            entry.put("queue-other-config-value", Long.toString(value));
        }

        @Override
        public ControllerRequest installMeter(String switchId, SdnMeter meter) {
            ObjectNode root = objectMapper.createObjectNode();
            ObjectNode meterNode = root.putArray("meter").addObject();
            meterNode.put("meter-id", meter.meterId());
            meterNode.put("flags", meter.burstKb() > 0 ? "meter-kbps meter-burst" : "meter-kbps");
            ObjectNode band = meterNode.putObject("meter-band-headers").putArray("meter-band-header").addObject();
            band.put("band-id", 0);
            band.put("drop-rate", meter.rateKbps());
            band.put("drop-burst-size", meter.burstKb());
            band.putObject("meter-band-types").put("flags", "ofpmbt-drop");
            return ControllerRequest.put(nodePath(switchId) + "/meter/" + meter.meterId(), write(root));
        }

        @Override
        public ControllerRequest installFlow(OpenFlowRule rule, String flowKey) {
            ObjectNode root = objectMapper.createObjectNode();
            ObjectNode flow = root.putArray("flow").addObject();
            flow.put("id", flowKey);
            flow.put("priority", rule.priority());
            flow.put("table_id", rule.tableId());
            writeMatch(flow.putObject("match"), rule.match());

            ArrayNode instructions = flow.putObject("instructions").putArray("instruction");
            ObjectNode applyActions = instructions.addObject();
            applyActions.put("order", 0);
            ArrayNode actionList = applyActions.putObject("apply-actions").putArray("action");
            int order = 0;
            for (Action action : rule.actions()) {
                switch (action.type()) {
                    case SET_QUEUE -> {
                        ObjectNode node = actionList.addObject();
                        node.put("order", order++);
                        node.putObject("set-queue-action").put("queue-id", Integer.parseInt(action.argument()));
                    }
                    case OUTPUT -> {
                        ObjectNode node = actionList.addObject();
                        node.put("order", order++);
                        node.putObject("output-action").put("output-node-connector", action.argument());
                    }
                    case METER -> {
                        ObjectNode meterInstruction = instructions.addObject();
                        meterInstruction.put("order", instructions.size() - 1);
                        meterInstruction.putObject("meter").put("meter-id", Integer.parseInt(action.argument()));
                    }
                }
            }
            return ControllerRequest.put(flowPath(rule.switchId(), rule.tableId(), flowKey), write(root));
        }

        private static void writeMatch(ObjectNode match, Map<MatchField, String> criteria) {
            for (Map.Entry<MatchField, String> entry : criteria.entrySet()) {
                String value = entry.getValue();
                switch (entry.getKey()) {
                    case IN_PORT -> match.put("in-port", value);
                    case ETH_TYPE -> match.putObject("ethernet-match").putObject("ethernet-type")
                            .put("type", IPV4_ETHER_TYPE);
                    case VLAN_VID -> {
                        ObjectNode vlan = match.putObject("vlan-match").putObject("vlan-id");
                        vlan.put("vlan-id", Integer.parseInt(value));
                        vlan.put("vlan-id-present", true);
                    }
                    case IP_PROTO -> ipMatch(match).put("ip-protocol", Integer.parseInt(value));
                    case IP_DSCP -> ipMatch(match).put("ip-dscp", Integer.parseInt(value));
                    case IPV4_SRC -> match.put("ipv4-source", value);
                    case IPV4_DST -> match.put("ipv4-destination", value);
                    case TCP_SRC -> match.put("tcp-source-port", Integer.parseInt(value));
                    case TCP_DST -> match.put("tcp-destination-port", Integer.parseInt(value));
                    case UDP_SRC -> match.put("udp-source-port", Integer.parseInt(value));
                    case UDP_DST -> match.put("udp-destination-port", Integer.parseInt(value));
                }
            }
        }

        private static ObjectNode ipMatch(ObjectNode match) {
            JsonNode existing = match.get("ip-match");
            return existing != null ? (ObjectNode) existing : match.putObject("ip-match");
        }

        @Override
        public String installedFlowId(ControllerResponse response, String flowKey) {
            return flowKey;
        }

        @Override
        public ControllerRequest removeFlow(String switchId, int tableId, String flowId) {
            return ControllerRequest.delete(flowPath(switchId, tableId, flowId));
        }

        @Override
        public List<ControllerRequest> topologyRequests() {
            return List.of(ControllerRequest.get(OPERATIONAL + "/network-topology:network-topology/topology/flow:1"));
        }

        @Override
        public SdnTopology parseTopology(List<String> bodies, Instant discoveredAt) {
            List<String> switches = new ArrayList<>();
            List<SdnTopology.Link> links = new ArrayList<>();
            for (JsonNode topology : read(bodies.get(0)).path("topology")) {
                for (JsonNode node : topology.path("node")) {
                    String id = node.path("node-id").asText(null);
                    if (id != null) {
                        switches.add(id);
                    }
                }
                for (JsonNode link : topology.path("link")) {
                    links.add(new SdnTopology.Link(
                            link.path("source").path("source-node").asText(),
                            link.path("source").path("source-tp").asText(),
                            link.path("destination").path("dest-node").asText(),
                            link.path("destination").path("dest-tp").asText()));
                }
            }
            return new SdnTopology(switches, links, discoveredAt);
        }

        @Override
        public ControllerRequest flowStatistics(String switchId) {
            return ControllerRequest.get(OPERATIONAL + "/opendaylight-inventory:nodes/node/" + switchId + "/table/0");
        }

        @Override
        public PolicyStatistics.SwitchStatistics parseFlowStatistics(String body) {
            int flows = 0;
            long bytes = 0;
            long packets = 0;
            for (JsonNode table : read(body).path("flow-node-inventory:table")) {
                for (JsonNode flow : table.path("flow")) {
                    flows++;
                    JsonNode stats = flow.path("opendaylight-flow-statistics:flow-statistics");
                    bytes += stats.path("byte-count").asLong(0);
                    packets += stats.path("packet-count").asLong(0);
                }
            }
            return PolicyStatistics.SwitchStatistics.of(flows, bytes, packets);
        }

        private static String nodePath(String switchId) {
            return CONFIG + "/opendaylight-inventory:nodes/node/" + switchId;
        }

        private static String flowPath(String switchId, int tableId, String flowId) {
            return nodePath(switchId) + "/table/" + tableId + "/flow/" + flowId;
        }
    }
}
