package fr.lapetina.qos.domain.exception;

import fr.lapetina.qos.domain.model.ErrorType;

public final class InterfaceNotFoundException extends QosException {

    public InterfaceNotFoundException(String deviceId, String interfaceName) {
        super(ErrorType.INTERFACE_NOT_FOUND,
                "Interface not found: device=" + deviceId + ", interface=" + interfaceName);
    }
}
