package fr.lapetina.qos.infrastructure.sdn;

/**
 * Single-band drop meter capping a traffic class.
 *
 * @param rateKbps  band rate in kbps
 * @param burstKb   band burst size in kb
 */
public record SdnMeter(int meterId, long rateKbps, long burstKb) {

    public static final String BAND_TYPE = "DROP";

    public SdnMeter {
        if (meterId < 1 || rateKbps <= 0) {
            throw new IllegalArgumentException("Meter needs a positive id and rate");
        }
        burstKb = Math.max(0, burstKb);
    }
}
