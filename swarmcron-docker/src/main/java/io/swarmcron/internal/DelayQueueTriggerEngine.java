package io.swarmcron.internal;

import io.swarmcron.TriggerEngine;
import io.swarmcron.TriggerHandle;
import io.swarmcron.utils.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process trigger engine.
 *
 * <p>Pending firings wait in a {@link DelayQueue}. A single dispatcher thread takes each due firing,
 * queues the trigger's next firing and hands the callback to a fixed worker pool, so a slow
 * callback never holds back other triggers. Threads are daemons and start with the first trigger.
 */
public class DelayQueueTriggerEngine implements TriggerEngine {
    private static final Logger log = LoggerFactory.getLogger(DelayQueueTriggerEngine.class);

    private final int maxConcurrency;
    private final Duration shutdownTimeout;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final DelayQueue<DelayedFiring> queue = new DelayQueue<>();
    private final AtomicInteger workerSeq = new AtomicInteger();

    private ExecutorService workerPool;
    private Thread dispatcherThread;

    private static final class DelayedFiring implements Delayed {
        private final Trigger trigger;
        private final Instant runAt;

        private DelayedFiring(Trigger trigger, Instant runAt) {
            this.trigger = trigger;
            this.runAt = runAt;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(Instant.now(), runAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DelayedFiring o) {
                return this.runAt.compareTo(o.runAt);
            }
            long d1 = this.getDelay(TimeUnit.MILLISECONDS);
            long d2 = other.getDelay(TimeUnit.MILLISECONDS);
            return Long.compare(d1, d2);
        }
    }

    private final class Trigger implements TriggerHandle {
        private final String key;
        private final Schedule schedule;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile DelayedFiring pending;

        private Trigger(String key, Schedule schedule, Runnable task) {
            this.key = key;
            this.schedule = schedule;
            this.task = task;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            DelayedFiring p = pending;
            if (p != null) {
                queue.remove(p);
            }
            log.debug("swarmcron trigger cancelled key={}", key);
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }

    public DelayQueueTriggerEngine(int maxConcurrency, Duration shutdownTimeout) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be a positive number");
        }
        this.maxConcurrency = maxConcurrency;
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
    }

    @Override
    public TriggerHandle schedule(String key, Schedule schedule, Runnable task) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(task, "task must not be null");

        Instant first = schedule.next(Instant.now());
        if (first == null) {
            throw new IllegalArgumentException("Schedule produced no next execution time: " + schedule.expression());
        }

        ensureStarted();
        Trigger trigger = new Trigger(key, schedule, task);
        enqueue(trigger, first);
        log.debug("swarmcron trigger registered key={} schedule={} firstRunAt={}", key, schedule.expression(), first);
        return trigger;
    }

    /**
     * Cancel every pending trigger and stop engine threads. The engine restarts on the next
     * {@link #schedule(String, Schedule, Runnable)} call.
     */
    @Override
    public synchronized void shutdown() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("swarmcron trigger engine stopping...");

        List<DelayedFiring> pendingFirings = new ArrayList<>(queue);
        for (DelayedFiring f : pendingFirings) {
            f.trigger.cancel();
        }
        queue.clear();

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }
        log.info("swarmcron trigger engine stopped.");
    }

    /**
     * Number of firings waiting in the queue.
     */
    public int pendingCount() {
        return queue.size();
    }

    private synchronized void ensureStarted() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        workerPool = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r);
            t.setName("swarmcron.worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("swarmcron.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        log.info("swarmcron trigger engine started with maxConcurrency={}", maxConcurrency);
    }

    private void enqueue(Trigger trigger, Instant runAt) {
        DelayedFiring firing = new DelayedFiring(trigger, runAt);
        trigger.pending = firing;
        queue.offer(firing);
        if (trigger.isCancelled()) {
            queue.remove(firing);
        }
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                DelayedFiring firing = queue.take();
                Trigger trigger = firing.trigger;
                if (trigger.isCancelled()) {
                    continue;
                }

                Instant next = trigger.schedule.next(laterOf(firing.runAt, Instant.now()));
                if (next != null) {
                    enqueue(trigger, next);
                } else {
                    log.info("swarmcron trigger has no further firings key={}", trigger.key);
                }

                log.debug("swarmcron trigger fired key={} runAt={} nextRunAt={}", trigger.key, firing.runAt, next);
                submitToWorker(trigger);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("swarmcron dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void submitToWorker(Trigger trigger) {
        ExecutorService pool = workerPool;
        if (pool == null || pool.isShutdown()) {
            return;
        }
        pool.submit(() -> {
            try {
                trigger.task.run();
            } catch (Exception e) {
                log.error("swarmcron trigger callback failed key={} msg={}", trigger.key, e.getMessage(), e);
            }
        });
    }

    private static Instant laterOf(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
