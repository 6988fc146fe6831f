package io.swarmcron.internal.swarm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swarmcron.ObjectClient;
import io.swarmcron.config.SwarmCronProperties;
import io.swarmcron.core.LabelFilter;
import io.swarmcron.core.LabelSchema;
import io.swarmcron.core.RunCommand;
import io.swarmcron.core.RunObject;
import io.swarmcron.core.RunSpec;
import io.swarmcron.core.RunTask;
import io.swarmcron.exception.ObjectClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ObjectClient} that drives the {@code docker} CLI against a Swarm manager.
 *
 * <p>Services are the run objects; their tasks are the executions.
 */
public class DockerCliObjectClient implements ObjectClient {
    private static final Logger log = LoggerFactory.getLogger(DockerCliObjectClient.class);

    private static final List<String> HOST_SCHEMES = List.of("unix://", "tcp://", "npipe://", "ssh://");

    private final String dockerBinary;
    private final ObjectMapper objectMapper;
    private final CommandRunner runner;

    public DockerCliObjectClient(SwarmCronProperties props, ObjectMapper objectMapper) {
        this(props, objectMapper, new ProcessCommandRunner(
                Map.of("DOCKER_HOST", validHost(props)), props.getCommandTimeout()));
    }

    public DockerCliObjectClient(SwarmCronProperties props, ObjectMapper objectMapper, CommandRunner runner) {
        Objects.requireNonNull(props, "props must not be null");
        validHost(props);
        if (props.getDockerBinary() == null || props.getDockerBinary().isBlank()) {
            throw new IllegalArgumentException("swarmcron.docker-binary must not be blank");
        }
        this.dockerBinary = props.getDockerBinary();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    @Override
    public String createRunObject(RunCommand command) {
        Objects.requireNonNull(command, "command must not be null");

        List<String> argv = new ArrayList<>(command.toArguments());
        argv.set(0, dockerBinary);
        argv.addAll(LabelSchema.CREATE_INVOCATION.size(), List.of("--detach", "--quiet"));

        String id = firstLine(execute(argv));
        if (id.isEmpty()) {
            throw new ObjectClientException("docker service create returned no service id");
        }
        log.info("swarmcron service created id={} image={}", id, command.image());
        return id;
    }

    @Override
    public List<RunObject> listObjects(LabelFilter filter) {
        List<String> ids = listIds(filter);
        if (ids.isEmpty()) {
            return List.of();
        }

        List<String> argv = docker("service", "inspect");
        argv.addAll(ids);
        List<RunObject> objects = new ArrayList<>();
        for (JsonNode node : inspect(argv)) {
            objects.add(toRunObject(node));
        }
        log.debug("swarmcron services listed filter={} count={}", filter.labels(), objects.size());
        return objects;
    }

    @Override
    public void removeObjects(LabelFilter filter) {
        List<String> ids = listIds(filter);
        if (ids.isEmpty()) {
            return;
        }
        List<String> argv = docker("service", "rm");
        argv.addAll(ids);
        CommandRunner.CommandResult result = runner.run(argv);
        if (!result.isSuccess()) {
            if (!onlyMissing(result)) {
                throw failure(argv, result);
            }
            log.debug("swarmcron services already gone filter={} msg={}", filter.labels(), result.stderr().trim());
        }
        log.info("swarmcron services removed filter={} count={}", filter.labels(), ids.size());
    }

    @Override
    public List<RunTask> listTasks(String objectId) {
        Objects.requireNonNull(objectId, "objectId must not be null");

        List<String> taskIds = lines(execute(docker("service", "ps", "--quiet", "--no-trunc", objectId)));
        if (taskIds.isEmpty()) {
            return List.of();
        }

        List<String> argv = docker("inspect", "--type", "task");
        argv.addAll(taskIds);
        List<RunTask> tasks = new ArrayList<>();
        for (JsonNode node : inspect(argv)) {
            tasks.add(new RunTask(
                    node.path("ID").asText(),
                    timestamp(node.path("CreatedAt")),
                    node.path("Status").path("State").asText("")));
        }
        return tasks;
    }

    private List<String> listIds(LabelFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        List<String> argv = docker("service", "ls", "--quiet");
        filter.labels().forEach((k, v) -> {
            argv.add("--filter");
            argv.add("label=" + k + "=" + v);
        });
        return lines(execute(argv));
    }

    private RunObject toRunObject(JsonNode node) {
        JsonNode spec = node.path("Spec");

        Map<String, String> labels = new LinkedHashMap<>();
        spec.path("Labels").fields().forEachRemaining(e -> labels.put(e.getKey(), e.getValue().asText()));

        JsonNode container = spec.path("TaskTemplate").path("ContainerSpec");
        List<String> args = new ArrayList<>();
        container.path("Args").forEach(a -> args.add(a.asText()));

        return new RunObject(
                node.path("ID").asText(),
                labels,
                new RunSpec(container.path("Image").asText(""), args),
                timestamp(node.path("CreatedAt")));
    }

    private String execute(List<String> argv) {
        CommandRunner.CommandResult result = runner.run(argv);
        if (!result.isSuccess()) {
            throw failure(argv, result);
        }
        return result.stdout();
    }

    /**
     * Run an inspect command. Objects removed since they were listed make docker exit non-zero
     * while still printing the ones that exist; those are kept and the missing ones skipped.
     */
    private JsonNode inspect(List<String> argv) {
        CommandRunner.CommandResult result = runner.run(argv);
        if (result.isSuccess()) {
            return parseArray(result.stdout());
        }
        if (!onlyMissing(result)) {
            throw failure(argv, result);
        }
        log.debug("swarmcron skipping objects removed since listing msg={}", result.stderr().trim());
        if (result.stdout().isBlank()) {
            return objectMapper.createArrayNode();
        }
        return parseArray(result.stdout());
    }

    private static boolean onlyMissing(CommandRunner.CommandResult result) {
        List<String> errors = lines(result.stderr());
        if (errors.isEmpty()) {
            return false;
        }
        for (String line : errors) {
            if (!line.toLowerCase(Locale.ROOT).contains("no such")) {
                return false;
            }
        }
        return true;
    }

    private static ObjectClientException failure(List<String> argv, CommandRunner.CommandResult result) {
        return new ObjectClientException("docker exited with status " + result.exitCode()
                + " running '" + String.join(" ", argv.subList(1, Math.min(argv.size(), 3)))
                + "': " + result.stderr().trim());
    }

    private JsonNode parseArray(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ObjectClientException("Could not parse docker inspect output: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new ObjectClientException("Unexpected docker inspect output, expected a JSON array");
        }
        return root;
    }

    private List<String> docker(String... args) {
        List<String> argv = new ArrayList<>();
        argv.add(dockerBinary);
        argv.addAll(List.of(args));
        return argv;
    }

    private static Instant timestamp(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(node.asText()).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("swarmcron unparsable docker timestamp value={}", node.asText());
            return null;
        }
    }

    private static List<String> lines(String out) {
        List<String> result = new ArrayList<>();
        for (String line : out.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static String firstLine(String out) {
        List<String> l = lines(out);
        return l.isEmpty() ? "" : l.get(0);
    }

    private static String validHost(SwarmCronProperties props) {
        String host = props.getDockerHost();
        if (host == null || HOST_SCHEMES.stream().noneMatch(host::startsWith)) {
            throw new IllegalArgumentException("Invalid docker host: " + host
                    + " (expected unix://, tcp://, npipe:// or ssh://)");
        }
        return host;
    }
}
