package io.swarmcron.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * User-facing job definition.
 *
 * <p>Null strings and a blank command are normalised to {@code ""} and null args to an empty
 * list, so two definitions describing the same job are always {@code equals}.
 */
public record JobDefinition(

        // identity
        String name,

        // what to run
        String image,
        String command,
        List<String> args,

        // when to run; "" means run once
        String schedule,

        // id of the most recent run object, "" until one is known
        String serviceName
) {

    public JobDefinition {
        name = nullToEmpty(name);
        image = nullToEmpty(image);
        command = command == null || command.isBlank() ? "" : command;
        // null entries are kept so rendering can reject them as validation errors
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        schedule = nullToEmpty(schedule);
        serviceName = nullToEmpty(serviceName);
    }

    public boolean isRecurring() {
        return !schedule.isBlank();
    }

    public JobDefinition withServiceName(String serviceName) {
        return new JobDefinition(name, image, command, args, schedule, serviceName);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String image;
        private String command;
        private final List<String> args = new ArrayList<>();
        private String schedule;
        private String serviceName;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder args(List<String> args) {
            this.args.clear();
            if (args != null) {
                this.args.addAll(args);
            }
            return this;
        }

        /**
         * Add a single flag, e.g. {@code "--env A=1"}.
         */
        public Builder arg(String arg) {
            this.args.add(arg);
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(name, image, command, args, schedule, serviceName);
        }
    }
}
