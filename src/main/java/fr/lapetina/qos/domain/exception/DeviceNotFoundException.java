package fr.lapetina.qos.domain.exception;

import fr.lapetina.qos.domain.model.ErrorType;

public final class DeviceNotFoundException extends QosException {

    public DeviceNotFoundException(String deviceId) {
        super(ErrorType.DEVICE_NOT_FOUND, "Network device not found: " + deviceId);
    }
}
