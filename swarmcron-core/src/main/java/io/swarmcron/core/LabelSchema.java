package io.swarmcron.core;

import java.util.List;
import java.util.Set;

/**
 * Label keys written on every run object. These keys are shared with existing deployments and
 * must not change.
 *
 * <ul>
 *   <li>{@code com.df.cron=true}: marks objects owned by the scheduler</li>
 *   <li>{@code com.df.cron.name}: owning job name</li>
 *   <li>{@code com.df.cron.schedule}: job schedule ("" for one-shot jobs)</li>
 *   <li>{@code com.df.cron.command}: literal create invocation</li>
 * </ul>
 */
public final class LabelSchema {

    public static final String MARKER = "com.df.cron";
    public static final String MARKER_VALUE = "true";
    public static final String NAME = "com.df.cron.name";
    public static final String SCHEDULE = "com.df.cron.schedule";
    public static final String COMMAND = "com.df.cron.command";

    /**
     * Keys an object must carry to be decoded back into a job.
     */
    public static final Set<String> REQUIRED = Set.of(MARKER, NAME, SCHEDULE, COMMAND);

    public static final List<String> CREATE_INVOCATION = List.of("docker", "service", "create");

    private LabelSchema() {
    }
}
