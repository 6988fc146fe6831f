package io.swarmcron.utils;

import org.quartz.CronExpression;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses schedule specs into {@link Schedule}s.
 * <p>
 * Supported formats, matching the schedules already stored in existing service labels:
 * <ul>
 *   <li>Descriptors: "@yearly", "@annually", "@monthly", "@weekly", "@daily", "@midnight", "@hourly"</li>
 *   <li>Constant delay: "@every 1h30m", "@every 500ms"</li>
 *   <li>6-field cron "sec min hour dom month dow" ("0 30 2 * * *")</li>
 *   <li>5-field cron "sec min hour dom month", day-of-week implied as "*" ("0 3 * * *" fires hourly at :03)</li>
 *   <li>An optional "TZ=&lt;zone&gt; " prefix overriding the evaluation zone</li>
 * </ul>
 * <p>
 * Day-of-week counts Sunday as 0 (7 is accepted too) and is translated to Quartz numbering.
 * When both day-of-month and day-of-week are restricted, the schedule fires when either matches.
 */
public final class ScheduleParser {

    private static final String EVERY_PREFIX = "@every ";
    private static final String TZ_PREFIX = "TZ=";

    private static final Map<String, String> DESCRIPTORS = Map.of(
            "@yearly", "0 0 0 1 1 ?",
            "@annually", "0 0 0 1 1 ?",
            "@monthly", "0 0 0 1 * ?",
            "@weekly", "0 0 0 ? * SUN",
            "@daily", "0 0 0 * * ?",
            "@midnight", "0 0 0 * * ?",
            "@hourly", "0 0 * * * ?"
    );

    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)(.*)$");

    private ScheduleParser() {
    }

    /**
     * Parse a schedule spec evaluated in {@code zone}, unless the spec carries its own "TZ=" prefix.
     *
     * @param spec schedule spec; must not be blank
     * @param zone time zone for cron evaluation; null means system default
     * @throws IllegalArgumentException if the spec is malformed or never fires
     */
    public static Schedule parse(String spec, ZoneId zone) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        if (s.startsWith(TZ_PREFIX)) {
            int space = s.indexOf(' ');
            if (space < 0) {
                throw new IllegalArgumentException("Missing schedule after time zone: " + spec);
            }
            zone = zoneOf(s.substring(TZ_PREFIX.length(), space));
            s = s.substring(space + 1).trim();
        }

        if (s.startsWith(EVERY_PREFIX)) {
            Duration delay = parseGoDuration(s.substring(EVERY_PREFIX.length()).trim());
            return new Schedule.ConstantDelaySchedule(spec, delay);
        }

        List<String> quartz = s.startsWith("@") ? List.of(descriptor(s)) : normalizeCron(s);
        List<CronExpression> crons = new ArrayList<>();
        for (String q : quartz) {
            crons.add(compile(q, zone));
        }
        Schedule.CronSchedule schedule = new Schedule.CronSchedule(spec, crons);
        if (schedule.next(Instant.now()) == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + spec);
        }
        return schedule;
    }

    /**
     * Convenience overload: uses the system default timezone.
     */
    public static Schedule parse(String spec) {
        return parse(spec, null);
    }

    private static ZoneId zoneOf(String id) {
        try {
            return ZoneId.of(id);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Unknown time zone: " + id, ex);
        }
    }

    private static String descriptor(String s) {
        String quartz = DESCRIPTORS.get(s.toLowerCase(Locale.ROOT));
        if (quartz == null) {
            throw new IllegalArgumentException("Unsupported descriptor: " + s);
        }
        return quartz;
    }

    private static CronExpression compile(String quartz, ZoneId zone) {
        if (!CronExpression.isValidExpression(quartz)) {
            throw new IllegalArgumentException("Invalid cron expression: " + quartz);
        }
        CronExpression exp;
        try {
            exp = new CronExpression(quartz);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + quartz, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault()));
        return exp;
    }

    /**
     * Normalize crontab expressions to Quartz syntax:
     * - Accepts 6-field cron with seconds.
     * - Accepts 5-field cron (seconds first, no day-of-week) by appending day-of-week "*".
     * Returns two expressions when both day fields are restricted.
     */
    public static List<String> normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], "*");
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new IllegalArgumentException("Expected 5 or 6 cron fields but found " + parts.length + ": " + spec);
    }

    private static List<String> toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dow = toQuartzDayOfWeek(dayOfWeek);
        String prefix = String.join(" ", sec, min, hour);

        boolean anyDom = isWildcard(dayOfMonth);
        boolean anyDow = isWildcard(dow);

        if (anyDom && anyDow) {
            return List.of(String.join(" ", prefix, "*", month, "?"));
        }
        if (anyDow) {
            return List.of(String.join(" ", prefix, dayOfMonth, month, "?"));
        }
        if (anyDom) {
            return List.of(String.join(" ", prefix, "?", month, dow));
        }
        return List.of(
                String.join(" ", prefix, dayOfMonth, month, "?"),
                String.join(" ", prefix, "?", month, dow));
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    // crontab counts Sunday as 0 (or 7), Quartz as 1
    private static String toQuartzDayOfWeek(String field) {
        if (isWildcard(field)) {
            return field;
        }
        StringBuilder out = new StringBuilder();
        for (String item : field.split(",", -1)) {
            if (out.length() > 0) {
                out.append(',');
            }
            String base = item;
            String step = null;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                base = item.substring(0, slash);
                step = item.substring(slash);
            }
            int dash = base.indexOf('-');
            if (dash >= 0) {
                out.append(shiftDay(base.substring(0, dash))).append('-').append(shiftDay(base.substring(dash + 1)));
            } else {
                out.append(shiftDay(base));
            }
            if (step != null) {
                out.append(step);
            }
        }
        return out.toString();
    }

    private static String shiftDay(String token) {
        Matcher m = LEADING_NUMBER.matcher(token);
        if (!m.matches()) {
            return token;
        }
        int day = Integer.parseInt(m.group(1));
        if (day > 7) {
            throw new IllegalArgumentException("day-of-week out of range: " + token);
        }
        return (day % 7 + 1) + m.group(2);
    }

    /**
     * Parse a Go-style duration such as "1h30m", "90s", "1.5h" or "250ms".
     */
    public static Duration parseGoDuration(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("duration must not be empty");
        }
        String s = input.trim();

        Matcher m = DURATION_PART.matcher(s);
        int pos = 0;
        BigDecimal nanos = BigDecimal.ZERO;
        while (pos < s.length()) {
            if (!m.find(pos) || m.start() != pos) {
                throw new IllegalArgumentException("Invalid duration: " + input);
            }
            BigDecimal value = new BigDecimal(m.group(1));
            nanos = nanos.add(value.multiply(BigDecimal.valueOf(unitNanos(m.group(2)))));
            pos = m.end();
        }

        long total;
        try {
            total = nanos.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Duration out of range: " + input);
        }
        if (total <= 0) {
            throw new IllegalArgumentException("Duration must be positive: " + input);
        }
        return Duration.ofNanos(total);
    }

    private static long unitNanos(String unit) {
        return switch (unit) {
            case "ns" -> 1L;
            case "us", "µs" -> 1_000L;
            case "ms" -> 1_000_000L;
            case "s" -> 1_000_000_000L;
            case "m" -> 60_000_000_000L;
            case "h" -> 3_600_000_000_000L;
            default -> throw new IllegalArgumentException("Unsupported duration unit: " + unit);
        };
    }
}
