package fr.lapetina.qos.domain.exception;

import fr.lapetina.qos.domain.model.ErrorType;

public final class PolicyNotFoundException extends QosException {

    public PolicyNotFoundException(String policyId) {
        super(ErrorType.POLICY_NOT_FOUND, "QoS policy not found: " + policyId);
    }
}
