package io.swarmcron.core;

import java.util.List;

/**
 * What a run object executes, as reported by the orchestrator.
 */
public record RunSpec(
        String image,
        List<String> args
) {
    public RunSpec {
        args = args == null ? List.of() : List.copyOf(args);
    }
}
