package io.swarmcron.internal;

import io.swarmcron.core.JobDefinition;
import io.swarmcron.core.LabelSchema;
import io.swarmcron.core.RunCommand;
import io.swarmcron.core.RunObject;
import io.swarmcron.exception.JobValidationException;
import io.swarmcron.utils.ShellWords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders job definitions into {@code docker service create} invocations and decodes the
 * labels of existing services back into job definitions.
 *
 * <p>The rendered command is self-describing: the literal command line is stored in the
 * {@link LabelSchema#COMMAND} label, so {@link #decode(RunObject)} needs nothing but the object.
 */
public class RunCommandBuilder {
    private static final Logger log = LoggerFactory.getLogger(RunCommandBuilder.class);

    static final String RESTART_CONDITION = "--restart-condition";
    static final String NAME = "--name";
    static final String RESTART_NONE = "none";

    /**
     * Validate and render a job. Pure: nothing is created.
     *
     * @throws JobValidationException if a required field is missing or an argument is not allowed
     */
    public RunCommand render(JobDefinition job) {
        if (job == null) {
            throw new JobValidationException("job must not be null");
        }
        if (job.name().isBlank()) {
            throw new JobValidationException("job name must not be blank");
        }
        if (job.image().isBlank()) {
            throw new JobValidationException("image must not be blank for job " + job.name());
        }

        List<String> options = new ArrayList<>();
        StringBuilder commandLine = new StringBuilder(String.join(" ", LabelSchema.CREATE_INVOCATION));
        boolean restartConditionSet = false;

        for (String arg : job.args()) {
            List<String> tokens = argTokens(job.name(), arg);
            String flag = flagName(tokens.get(0));
            String value = flagValue(tokens);

            if (NAME.equals(flag)) {
                throw new JobValidationException(
                        "--name is not allowed for job " + job.name() + "; service names are managed by the scheduler");
            }
            if (RESTART_CONDITION.equals(flag)) {
                if (!RESTART_NONE.equals(value)) {
                    throw new JobValidationException(
                            "--restart-condition must be none for job " + job.name() + " but was " + value);
                }
                restartConditionSet = true;
            }

            options.addAll(tokens);
            commandLine.append(' ').append(arg.trim());
        }

        if (!restartConditionSet) {
            options.add(RESTART_CONDITION);
            options.add(RESTART_NONE);
            commandLine.append(' ').append(RESTART_CONDITION).append(' ').append(RESTART_NONE);
        }

        List<String> command;
        try {
            command = ShellWords.split(job.command());
        } catch (IllegalArgumentException ex) {
            throw new JobValidationException("Invalid command for job " + job.name() + ": " + ex.getMessage(), ex);
        }

        commandLine.append(' ').append(job.image());
        if (!job.command().isEmpty()) {
            commandLine.append(' ').append(job.command());
        }

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LabelSchema.MARKER, LabelSchema.MARKER_VALUE);
        labels.put(LabelSchema.NAME, job.name());
        labels.put(LabelSchema.SCHEDULE, job.schedule());
        labels.put(LabelSchema.COMMAND, commandLine.toString());

        return new RunCommand(labels, options, job.image(), command, commandLine.toString());
    }

    /**
     * Reverse of {@link #render(JobDefinition)}.
     *
     * <p>{@code image} comes from the object's run spec (the orchestrator may pin a digest) and
     * {@code serviceName} is the object id. Objects with missing or malformed labels yield empty.
     */
    public Optional<JobDefinition> decode(RunObject object) {
        Objects.requireNonNull(object, "object must not be null");

        Map<String, String> labels = object.labels();
        for (String key : LabelSchema.REQUIRED) {
            if (!labels.containsKey(key)) {
                log.warn("swarmcron skipping object id={} missing label={}", object.id(), key);
                return Optional.empty();
            }
        }
        if (!LabelSchema.MARKER_VALUE.equals(labels.get(LabelSchema.MARKER))) {
            return Optional.empty();
        }
        String name = labels.get(LabelSchema.NAME);
        if (name.isBlank()) {
            log.warn("swarmcron skipping object id={} with blank job name", object.id());
            return Optional.empty();
        }

        String line = labels.get(LabelSchema.COMMAND);
        List<ShellWords.Token> tokens;
        try {
            tokens = ShellWords.tokenize(line);
        } catch (IllegalArgumentException ex) {
            log.warn("swarmcron skipping object id={} with unparsable command label msg={}", object.id(), ex.getMessage());
            return Optional.empty();
        }

        int prefix = LabelSchema.CREATE_INVOCATION.size();
        if (tokens.size() <= prefix || !startsWithCreateInvocation(tokens)) {
            log.warn("swarmcron skipping object id={} with unexpected command label={}", object.id(), line);
            return Optional.empty();
        }

        List<String> args = new ArrayList<>();
        int i = prefix;
        while (i < tokens.size() && isFlag(tokens.get(i).value())) {
            ShellWords.Token flag = tokens.get(i);
            int end = flag.end();
            if (!flag.value().contains("=") && i + 1 < tokens.size() - 1) {
                end = tokens.get(i + 1).end();
                i += 2;
            } else {
                i++;
            }
            args.add(line.substring(flag.start(), end));
        }
        if (i >= tokens.size()) {
            log.warn("swarmcron skipping object id={} without image in command label={}", object.id(), line);
            return Optional.empty();
        }

        if (!args.isEmpty() && isDefaultRestartCondition(args.get(args.size() - 1))) {
            args.remove(args.size() - 1);
        }

        ShellWords.Token imageToken = tokens.get(i);
        String command = imageToken.end() < line.length() ? line.substring(imageToken.end() + 1) : "";

        String image = object.runSpec() != null && object.runSpec().image() != null && !object.runSpec().image().isBlank()
                ? object.runSpec().image()
                : imageToken.value();

        return Optional.of(new JobDefinition(
                name,
                image,
                command,
                args,
                labels.get(LabelSchema.SCHEDULE),
                object.id()
        ));
    }

    private static List<String> argTokens(String jobName, String arg) {
        if (arg == null || arg.isBlank()) {
            throw new JobValidationException("args must not contain blank values for job " + jobName);
        }
        List<String> tokens;
        try {
            tokens = ShellWords.split(arg);
        } catch (IllegalArgumentException ex) {
            throw new JobValidationException("Invalid argument for job " + jobName + ": " + ex.getMessage(), ex);
        }
        if (!isFlag(tokens.get(0))) {
            throw new JobValidationException("Argument must start with a flag for job " + jobName + ": " + arg);
        }
        return tokens;
    }

    private static boolean startsWithCreateInvocation(List<ShellWords.Token> tokens) {
        for (int i = 0; i < LabelSchema.CREATE_INVOCATION.size(); i++) {
            if (!LabelSchema.CREATE_INVOCATION.get(i).equals(tokens.get(i).value())) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDefaultRestartCondition(String arg) {
        List<String> tokens = ShellWords.split(arg);
        return RESTART_CONDITION.equals(flagName(tokens.get(0))) && RESTART_NONE.equals(flagValue(tokens));
    }

    private static boolean isFlag(String token) {
        return token.length() > 1 && token.startsWith("-");
    }

    private static String flagName(String token) {
        int eq = token.indexOf('=');
        return eq < 0 ? token : token.substring(0, eq);
    }

    private static String flagValue(List<String> tokens) {
        String first = tokens.get(0);
        int eq = first.indexOf('=');
        if (eq >= 0) {
            return first.substring(eq + 1);
        }
        return tokens.size() > 1 ? tokens.get(1) : null;
    }
}
