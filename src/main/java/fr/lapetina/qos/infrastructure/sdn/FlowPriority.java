package fr.lapetina.qos.infrastructure.sdn;

/**
 * OpenFlow priority bands used for QoS rules. Higher values win at the switch.
 */
public enum FlowPriority {
    EMERGENCY(65000),
    VOICE(50000),
    VIDEO(40000),
    INTERACTIVE(30000),
    BULK(20000),
    DEFAULT(10000);

    private final int value;

    FlowPriority(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Maps a class priority (0..7) to its band: 7 voice, 6-5 video, 4-3 interactive, 2-1 bulk.
     */
    public static FlowPriority forClassPriority(int priority) {
        if (priority >= 7) {
            return VOICE;
        }
        if (priority >= 5) {
            return VIDEO;
        }
        if (priority >= 3) {
            return INTERACTIVE;
        }
        return priority >= 1 ? BULK : DEFAULT;
    }
}
