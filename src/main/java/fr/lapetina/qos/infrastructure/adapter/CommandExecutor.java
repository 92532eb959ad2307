package fr.lapetina.qos.infrastructure.adapter;

import java.util.List;

/**
 * Transport that runs CLI commands on a device (SSH session, local subprocess, ...).
 *
 * Implementations live outside this library. They may block; the caller bounds every
 * call with a timeout.
 */
@FunctionalInterface
public interface CommandExecutor {

    /**
     * Runs the commands in order within one session.
     *
     * @param host management address of the device
     */
    ExecutionResult execute(String host, List<String> commands);
}
