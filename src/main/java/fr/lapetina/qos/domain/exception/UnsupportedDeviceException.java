package fr.lapetina.qos.domain.exception;

import fr.lapetina.qos.domain.model.ErrorType;

/**
 * Device exists but lacks a required QoS capability, or its vendor has no adapter.
 */
public final class UnsupportedDeviceException extends QosException {

    public UnsupportedDeviceException(String message) {
        super(ErrorType.UNSUPPORTED_DEVICE, message);
    }
}
