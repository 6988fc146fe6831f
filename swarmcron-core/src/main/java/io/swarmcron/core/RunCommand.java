package io.swarmcron.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A rendered "create run object" invocation.
 *
 * @param labels      labels set on the created object, in rendering order
 * @param options     create options already split into argv tokens
 * @param image       image to run
 * @param command     positional command tokens passed to the image
 * @param commandLine literal command string, also stored in the {@link LabelSchema#COMMAND} label
 */
public record RunCommand(
        Map<String, String> labels,
        List<String> options,
        String image,
        List<String> command,
        String commandLine
) {

    public RunCommand {
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        options = List.copyOf(options);
        command = List.copyOf(command);
    }

    /**
     * Full argv, starting with the create invocation itself.
     */
    public List<String> toArguments() {
        List<String> argv = new ArrayList<>(LabelSchema.CREATE_INVOCATION);
        labels.forEach((k, v) -> {
            argv.add("-l");
            argv.add(k + "=" + v);
        });
        argv.addAll(options);
        argv.add(image);
        argv.addAll(command);
        return argv;
    }
}
