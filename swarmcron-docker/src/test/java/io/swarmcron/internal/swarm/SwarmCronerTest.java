package io.swarmcron.internal.swarm;

import io.swarmcron.ObjectClient;
import io.swarmcron.config.SwarmCronProperties;
import io.swarmcron.core.JobDefinition;
import io.swarmcron.core.JobDetails;
import io.swarmcron.core.RescheduleResult;
import io.swarmcron.exception.JobNotFoundException;
import io.swarmcron.exception.JobQueryException;
import io.swarmcron.exception.JobRemovalException;
import io.swarmcron.exception.JobValidationException;
import io.swarmcron.exception.RunObjectCreationException;
import io.swarmcron.exception.ScheduleException;
import io.swarmcron.internal.DelayQueueTriggerEngine;
import io.swarmcron.internal.RunCommandBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class SwarmCronerTest {

    private InMemoryObjectClient objectClient;
    private RunCommandBuilder commandBuilder;
    private DelayQueueTriggerEngine engine;
    private SwarmCroner croner;

    @BeforeEach
    void setUp() {
        objectClient = new InMemoryObjectClient();
        commandBuilder = new RunCommandBuilder();
        engine = new DelayQueueTriggerEngine(4, Duration.ofSeconds(2));
        croner = newCroner(objectClient);
    }

    @AfterEach
    void tearDown() {
        croner.close();
    }

    @Test
    void oneShotJobShouldCreateExactlyOneObject() {
        JobDefinition job = job("once", "");

        croner.addJob(job);

        assertEquals(1, objectClient.createCount());
        assertTrue(croner.scheduledJobNames().isEmpty());
        assertEquals(job.withServiceName("svc-1"), croner.getJobs().get("once"));
    }

    @Test
    void invalidJobShouldNotReachTheOrchestrator() {
        ObjectClient mockClient = mock(ObjectClient.class);
        try (SwarmCroner strict = newCroner(mockClient)) {
            JobDefinition named = JobDefinition.builder().name("bad").image("alpine").arg("--name x").build();
            JobDefinition restarting = JobDefinition.builder().name("bad").image("alpine")
                    .arg("--restart-condition any").schedule("@hourly").build();

            assertThrows(JobValidationException.class, () -> strict.addJob(named));
            assertThrows(JobValidationException.class, () -> strict.addJob(restarting));
            assertThrows(JobValidationException.class, () -> strict.addJob(job("", "")));
            assertTrue(strict.scheduledJobNames().isEmpty());
        }
        verifyNoInteractions(mockClient);
    }

    @Test
    void invalidScheduleShouldFailWithoutTrigger() {
        ScheduleException ex = assertThrows(ScheduleException.class, () -> croner.addJob(job("bad", "every minute")));

        assertEquals("every minute", ex.getSchedule());
        assertTrue(croner.scheduledJobNames().isEmpty());
        assertEquals(0, objectClient.createCount());
    }

    @Test
    void scheduledJobShouldFireAndBecomeVisible() throws Exception {
        JobDefinition job = job("tick", "@every 100ms");

        croner.addJob(job);

        assertEquals(Set.of("tick"), croner.scheduledJobNames());
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> objectClient.createCount() >= 2));

        JobDefinition visible = croner.getJobs().get("tick");
        assertFalse(visible.serviceName().isEmpty());
        assertEquals(job, visible.withServiceName(""));
    }

    @Test
    void addingSameNameShouldReplaceTrigger() throws Exception {
        croner.addJob(job("tick", "@hourly"));
        croner.addJob(job("tick", "@every 100ms"));

        assertEquals(Set.of("tick"), croner.scheduledJobNames());
        assertEquals(1, engine.pendingCount());
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> objectClient.createCount() >= 1));
    }

    @Test
    void readdingAsOneShotShouldCancelExistingTrigger() throws Exception {
        croner.addJob(job("tick", "@every 100ms"));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> objectClient.createCount() >= 1));

        croner.addJob(job("tick", ""));
        Thread.sleep(150);
        int afterReadd = objectClient.createCount();
        Thread.sleep(400);

        assertTrue(croner.scheduledJobNames().isEmpty());
        assertEquals(0, engine.pendingCount());
        assertEquals(afterReadd, objectClient.createCount());
        assertEquals("", croner.getJobs().get("tick").schedule());
    }

    @Test
    void firingFailureShouldNotCancelTrigger() throws Exception {
        objectClient.failCreate = true;
        croner.addJob(job("flaky", "@every 50ms"));

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> objectClient.createAttempts() >= 2));
        objectClient.failCreate = false;

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> objectClient.createCount() >= 1));
        assertEquals(Set.of("flaky"), croner.scheduledJobNames());
    }

    @Test
    void oneShotCreateFailureShouldBeReported() {
        objectClient.failCreate = true;

        RunObjectCreationException ex = assertThrows(RunObjectCreationException.class,
                () -> croner.addJob(job("once", "")));
        assertTrue(ex.getMessage().contains("once"));
    }

    @Test
    void removeJobShouldCancelTriggerAndPurgeObjects() throws Exception {
        croner.addJob(job("tick", "@every 100ms"));
        croner.addJob(job("other", ""));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> objectClient.createCount() >= 3));

        croner.removeJob("tick");
        Thread.sleep(150);
        int afterRemoval = objectClient.createCount();
        Thread.sleep(300);

        assertEquals(afterRemoval, objectClient.createCount());
        assertTrue(croner.scheduledJobNames().isEmpty());

        // a firing already handed to a worker may land after the purge
        croner.removeJob("tick");
        assertEquals(Set.of("other"), croner.getJobs().keySet());
    }

    @Test
    void removeJobShouldBeIdempotent() {
        croner.removeJob("never-added");
        croner.addJob(job("once", ""));

        croner.removeJob("once");
        croner.removeJob("once");

        assertTrue(croner.getJobs().isEmpty());
        assertThrows(JobValidationException.class, () -> croner.removeJob(" "));
    }

    @Test
    void removeJobShouldCancelTriggerEvenWhenPurgeFails() {
        croner.addJob(job("tick", "@hourly"));
        objectClient.failRemove = true;

        JobRemovalException ex = assertThrows(JobRemovalException.class, () -> croner.removeJob("tick"));

        assertTrue(ex.getMessage().contains("tick"));
        assertTrue(croner.scheduledJobNames().isEmpty());
        assertEquals(0, engine.pendingCount());
    }

    @Test
    void getJobShouldReturnDefinitionWithExecutions() {
        croner.addJob(job("once", ""));

        JobDetails details = croner.getJob("once");

        assertEquals("svc-1", details.job().serviceName());
        assertEquals(1, details.executions().size());
        assertEquals("svc-1", details.executions().get(0).runIdentifier());
        assertEquals("complete", details.executions().get(0).status());

        JobNotFoundException ex = assertThrows(JobNotFoundException.class, () -> croner.getJob("missing"));
        assertEquals("missing", ex.getJobName());
    }

    @Test
    void rescheduleShouldRestoreTriggerPerRecurringJob() {
        for (int i = 0; i < 5; i++) {
            objectClient.createRunObject(commandBuilder.render(job("job-" + i, "@hourly")));
        }
        objectClient.createRunObject(commandBuilder.render(job("job-0", "@hourly")));
        objectClient.createRunObject(commandBuilder.render(job("once", "")));

        RescheduleResult result = croner.rescheduleJobs();

        assertEquals(5, result.rescheduled().size());
        assertEquals(List.of("once"), result.skipped());
        assertFalse(result.hasFailures());
        assertEquals(5, croner.scheduledJobNames().size());
        assertEquals(5, engine.pendingCount());

        RescheduleResult again = croner.rescheduleJobs();
        assertTrue(again.rescheduled().isEmpty());
        assertEquals(6, again.skipped().size());
        assertEquals(5, engine.pendingCount());
    }

    @Test
    void rescheduleShouldCollectPerJobFailures() {
        objectClient.createRunObject(commandBuilder.render(job("good", "@daily")));
        objectClient.createRunObject(commandBuilder.render(job("broken", "61 * * * *")));

        RescheduleResult result = croner.rescheduleJobs();

        assertEquals(List.of("good"), result.rescheduled());
        assertTrue(result.hasFailures());
        assertInstanceOf(ScheduleException.class, result.failures().get("broken"));
        assertEquals(Set.of("good"), croner.scheduledJobNames());
    }

    @Test
    void rescheduleShouldFailWhenListingFails() {
        objectClient.failList = true;

        assertThrows(JobQueryException.class, () -> croner.rescheduleJobs());
    }

    @Test
    void stopShouldCancelTriggersAndKeepObjects() {
        croner.addJob(job("a", "@hourly"));
        croner.addJob(job("b", "@hourly"));
        croner.addJob(job("c", ""));

        croner.stop();
        croner.stop();

        assertTrue(croner.scheduledJobNames().isEmpty());
        assertEquals(0, engine.pendingCount());
        assertEquals(1, objectClient.objectCount());
    }

    @Test
    void concurrentAddAndRemoveShouldLeaveOnePendingFiringPerTrigger() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                long seed = 42L + t;
                futures.add(pool.submit(() -> {
                    Random random = new Random(seed);
                    for (int i = 0; i < 200; i++) {
                        String name = "job-" + random.nextInt(5);
                        if (random.nextBoolean()) {
                            croner.addJob(job(name, "@hourly"));
                        } else {
                            croner.removeJob(name);
                        }
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(croner.scheduledJobNames().size(), engine.pendingCount());
        for (String name : croner.scheduledJobNames()) {
            croner.removeJob(name);
        }
        assertEquals(0, engine.pendingCount());
    }

    private SwarmCroner newCroner(ObjectClient client) {
        return new SwarmCroner(
                new SwarmCronProperties(),
                client,
                commandBuilder,
                new LabelJobRegistry(client, commandBuilder),
                new LabelExecutionAggregator(client),
                engine);
    }

    private static JobDefinition job(String name, String schedule) {
        return JobDefinition.builder()
                .name(name)
                .image("alpine")
                .command("echo \"Hello Cron!\"")
                .schedule(schedule)
                .build();
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}
