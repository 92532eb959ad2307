package fr.lapetina.qos.infrastructure.sdn;

import java.util.List;

/**
 * Outcome of installing one policy on one switch.
 *
 * @param flowsAttempted flows the switch should have received, including the ones skipped after a
 *                       queue or meter failure
 * @param flowIds        controller identifiers of the installed flows
 * @param error          first failure on this switch, null if everything was installed
 */
public record SwitchDeploymentResult(
        String switchId,
        int queuesInstalled,
        int metersInstalled,
        int flowsAttempted,
        int flowsInstalled,
        List<String> flowIds,
        String error
) {
    public SwitchDeploymentResult {
        flowIds = flowIds != null ? List.copyOf(flowIds) : List.of();
    }

    public static SwitchDeploymentResult failed(String switchId, int flowsAttempted, String error) {
        return new SwitchDeploymentResult(switchId, 0, 0, flowsAttempted, 0, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null && flowsInstalled == flowsAttempted;
    }
}
