package io.swarmcron.internal.swarm;

import java.util.List;

/**
 * Runs an external command to completion.
 */
public interface CommandRunner {

    /**
     * @param argv program followed by its arguments
     * @throws io.swarmcron.exception.ObjectClientException if the process cannot be started,
     *                                                      times out or is interrupted
     */
    CommandResult run(List<String> argv);

    record CommandResult(int exitCode, String stdout, String stderr) {

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
