package fr.lapetina.qos.infrastructure.sdn;

import java.time.Duration;
import java.util.List;

/**
 * Result of deploying a policy over a set of switches.
 *
 * <p>Every flow install counts as an attempt, including flows skipped because their switch
 * lost its queue or meter baseline. The batch succeeds only when the success rate is
 * strictly above the threshold: with the default 0.8, four switches out of five is a failure.
 */
public record DeploymentReport(
        String policyId,
        List<SwitchDeploymentResult> switches,
        int attempts,
        int successes,
        double successRate,
        boolean success,
        Duration duration
) {
    public DeploymentReport {
        switches = List.copyOf(switches);
    }

    public static DeploymentReport of(String policyId, List<SwitchDeploymentResult> results,
                                      double successThreshold, Duration duration) {
        int attempts = 0;
        int successes = 0;
        for (SwitchDeploymentResult result : results) {
            attempts += result.flowsAttempted();
            successes += result.flowsInstalled();
        }
        double rate = attempts == 0 ? 0.0 : (double) successes / attempts;
        return new DeploymentReport(policyId, results, attempts, successes, rate, rate > successThreshold, duration);
    }

    public List<SwitchDeploymentResult> failedSwitches() {
        return switches.stream().filter(s -> !s.isSuccess()).toList();
    }
}
