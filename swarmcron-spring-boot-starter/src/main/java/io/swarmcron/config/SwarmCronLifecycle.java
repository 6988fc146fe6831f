package io.swarmcron.config;

import io.swarmcron.Croner;
import io.swarmcron.core.RescheduleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 *
 * <p>On start, jobs found in the swarm get their triggers back. A failed reschedule is logged and
 * does not prevent the application from starting.
 */
public class SwarmCronLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SwarmCronLifecycle.class);

    private final Croner croner;
    private final boolean rescheduleOnStartup;
    private volatile boolean running = false;

    public SwarmCronLifecycle(Croner croner, boolean rescheduleOnStartup) {
        this.croner = croner;
        this.rescheduleOnStartup = rescheduleOnStartup;
    }

    @Override
    public void start() {
        if (rescheduleOnStartup) {
            try {
                RescheduleResult result = croner.rescheduleJobs();
                result.failures().forEach((name, e) ->
                        log.error("swarmcron job not rescheduled on startup name={} msg={}", name, e.getMessage()));
            } catch (RuntimeException e) {
                log.error("swarmcron could not reschedule jobs on startup msg={}", e.getMessage(), e);
            }
        }
        running = true;
    }

    @Override
    public void stop() {
        croner.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
