package io.swarmcron.utils;

import org.quartz.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * A parsed schedule: computes the next firing strictly after a given instant.
 */
public interface Schedule {

    /**
     * @return next firing after {@code after}, or {@code null} when the schedule never fires again
     */
    Instant next(Instant after);

    /**
     * The expression this schedule was parsed from.
     */
    String expression();

    /**
     * Calendar schedule backed by Quartz {@link CronExpression}s. A crontab line restricting both
     * day-of-month and day-of-week fires when either day matches, which Quartz cannot express in a
     * single expression; such a schedule holds one expression per day field and fires at the
     * earliest of them.
     */
    final class CronSchedule implements Schedule {
        private final String expression;
        private final List<CronExpression> crons;

        CronSchedule(String expression, List<CronExpression> crons) {
            this.expression = Objects.requireNonNull(expression, "expression must not be null");
            this.crons = List.copyOf(crons);
            if (this.crons.isEmpty()) {
                throw new IllegalArgumentException("crons must not be empty");
            }
        }

        @Override
        public synchronized Instant next(Instant after) {
            Date from = Date.from(after);
            Instant earliest = null;
            for (CronExpression cron : crons) {
                Date nextDate = cron.getNextValidTimeAfter(from);
                if (nextDate != null && (earliest == null || nextDate.toInstant().isBefore(earliest))) {
                    earliest = nextDate.toInstant();
                }
            }
            return earliest;
        }

        @Override
        public String expression() {
            return expression;
        }

        @Override
        public String toString() {
            StringBuilder quartz = new StringBuilder();
            for (CronExpression cron : crons) {
                if (quartz.length() > 0) {
                    quartz.append(" | ");
                }
                quartz.append(cron.getCronExpression());
            }
            return "CronSchedule[" + expression + " -> " + quartz + "]";
        }
    }

    /**
     * Fixed delay between firings ({@code @every 5m}).
     */
    record ConstantDelaySchedule(String expression, Duration delay) implements Schedule {
        public ConstantDelaySchedule {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isZero() || delay.isNegative()) {
                throw new IllegalArgumentException("delay must be a positive duration");
            }
        }

        @Override
        public Instant next(Instant after) {
            return after.plus(delay);
        }
    }
}
