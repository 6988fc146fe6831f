package io.swarmcron.internal.swarm;

import io.swarmcron.exception.ObjectClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Both output streams are drained
 * concurrently so a chatty process cannot block on a full pipe. Drains run on the runner's own
 * unbounded daemon threads, never queued behind other work.
 */
public class ProcessCommandRunner implements CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final Map<String, String> environment;
    private final Duration timeout;
    private final AtomicInteger ioSeq = new AtomicInteger();
    private final ExecutorService ioPool;

    public ProcessCommandRunner(Map<String, String> environment, Duration timeout) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment must not be null"));
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.ioPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("swarmcron.process-io-" + ioSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CommandResult run(List<String> argv) {
        if (argv == null || argv.isEmpty()) {
            throw new IllegalArgumentException("argv must not be empty");
        }

        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.environment().putAll(environment);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ObjectClientException("Could not start " + argv.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), ioPool);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), ioPool);

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ObjectClientException("Command timed out after " + timeout + ": " + String.join(" ", argv));
            }
            CommandResult result = new CommandResult(process.exitValue(), stdout.get(), stderr.get());
            log.debug("swarmcron command finished exitCode={} argv={}", result.exitCode(), argv);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ObjectClientException("Interrupted while running " + argv.get(0), e);
        } catch (ExecutionException e) {
            throw new ObjectClientException("Could not read output of " + argv.get(0), e.getCause());
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
