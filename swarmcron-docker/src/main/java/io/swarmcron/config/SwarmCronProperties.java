package io.swarmcron.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the scheduler and its Docker client.
 */
@ConfigurationProperties(prefix = "swarmcron")
public class SwarmCronProperties {
    private boolean enabled = true;
    private String dockerHost = "unix:///var/run/docker.sock";
    private String dockerBinary = "docker";
    private Duration commandTimeout = Duration.ofSeconds(30); // per docker CLI call
    private int maxConcurrency = 10; // trigger callbacks running at once
    private String timezone; // null = system default
    private boolean rescheduleOnStartup = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDockerHost() {
        return dockerHost;
    }

    public void setDockerHost(String dockerHost) {
        this.dockerHost = dockerHost;
    }

    public String getDockerBinary() {
        return dockerBinary;
    }

    public void setDockerBinary(String dockerBinary) {
        this.dockerBinary = dockerBinary;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isRescheduleOnStartup() {
        return rescheduleOnStartup;
    }

    public void setRescheduleOnStartup(boolean rescheduleOnStartup) {
        this.rescheduleOnStartup = rescheduleOnStartup;
    }

    /**
     * Zone used to evaluate cron schedules.
     */
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timezone);
    }
}
