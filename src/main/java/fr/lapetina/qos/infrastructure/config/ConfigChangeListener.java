package fr.lapetina.qos.infrastructure.config;

/**
 * Callback invoked after the QoS configuration has been (re)loaded.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param oldConfig previous configuration, null on the first load
     * @param newConfig configuration now in effect
     */
    void onConfigChanged(QosConfig oldConfig, QosConfig newConfig);
}
