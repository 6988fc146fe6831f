package io.swarmcron.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScheduleParserTest {

    @Test
    void everyShouldBecomeConstantDelay() {
        Schedule schedule = ScheduleParser.parse("@every 1m30s", ZoneOffset.UTC);

        assertInstanceOf(Schedule.ConstantDelaySchedule.class, schedule);
        Instant from = Instant.parse("2026-01-01T00:00:00Z");
        assertEquals(Instant.parse("2026-01-01T00:01:30Z"), schedule.next(from));
    }

    @Test
    void goDurationShouldSupportFractionsAndSubSecondUnits() {
        assertEquals(Duration.ofMinutes(90), ScheduleParser.parseGoDuration("1.5h"));
        assertEquals(Duration.ofMillis(250), ScheduleParser.parseGoDuration("250ms"));
        assertEquals(Duration.ofSeconds(3661), ScheduleParser.parseGoDuration("1h1m1s"));
    }

    @Test
    void goDurationShouldRejectGarbageAndZero() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parseGoDuration("5 minutes"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parseGoDuration("0s"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parseGoDuration("10"));
    }

    @Test
    void fiveFieldCronShouldStartWithSecondsAndImplyAnyDayOfWeek() {
        Schedule schedule = ScheduleParser.parse("0 3 * * *", ZoneOffset.UTC);

        assertEquals(Instant.parse("2026-01-01T00:03:00Z"), schedule.next(Instant.parse("2026-01-01T00:01:00Z")));
        assertEquals(Instant.parse("2026-01-01T01:03:00Z"), schedule.next(Instant.parse("2026-01-01T00:04:00Z")));
        assertEquals(List.of("0 3 * * * ?"), ScheduleParser.normalizeCron("0 3 * * *"));
    }

    @Test
    void sixFieldCronShouldKeepSeconds() {
        Schedule schedule = ScheduleParser.parse("30 0 12 * * *", ZoneOffset.UTC);

        Instant next = schedule.next(Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T12:00:30Z"), next);
    }

    @Test
    void dayOfWeekShouldFollowCrontabNumbering() {
        assertEquals(List.of("0 0 9 ? * 2-6"), ScheduleParser.normalizeCron("0 0 9 * * 1-5"));
        assertEquals(List.of("0 0 9 ? * 1,1"), ScheduleParser.normalizeCron("0 0 9 * * 0,7"));

        // 2026-01-03 is a Saturday
        Schedule weekdays = ScheduleParser.parse("0 0 9 * * 1-5", ZoneOffset.UTC);
        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), weekdays.next(Instant.parse("2026-01-03T00:00:00Z")));
    }

    @Test
    void restrictedDayOfMonthAndDayOfWeekShouldFireOnEither() {
        Schedule schedule = ScheduleParser.parse("0 0 0 1 * MON", ZoneOffset.UTC);

        assertEquals(List.of("0 0 0 1 * ?", "0 0 0 ? * MON"), ScheduleParser.normalizeCron("0 0 0 1 * MON"));
        // Friday 2026-01-02: the next Monday comes first
        assertEquals(Instant.parse("2026-01-05T00:00:00Z"), schedule.next(Instant.parse("2026-01-02T00:00:00Z")));
        // Tuesday 2026-01-27: the 1st (a Sunday) comes before Monday the 2nd
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), schedule.next(Instant.parse("2026-01-27T00:00:00Z")));
    }

    @Test
    void timeZonePrefixShouldOverrideZone() {
        Schedule cron = ScheduleParser.parse("TZ=Asia/Tokyo 0 0 9 * * *", ZoneOffset.UTC);
        Schedule daily = ScheduleParser.parse("TZ=Asia/Tokyo @daily", ZoneOffset.UTC);

        assertEquals("TZ=Asia/Tokyo 0 0 9 * * *", cron.expression());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), cron.next(Instant.parse("2025-12-31T12:00:00Z")));
        assertEquals(Instant.parse("2026-01-01T15:00:00Z"), daily.next(Instant.parse("2026-01-01T12:00:00Z")));
        assertInstanceOf(Schedule.ConstantDelaySchedule.class, ScheduleParser.parse("TZ=UTC @every 1m"));

        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parse("TZ=Mars/Base 0 0 0 * * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parse("TZ=UTC"));
    }

    @Test
    void descriptorsShouldBeSupported() {
        Instant from = Instant.parse("2026-03-10T10:15:00Z");

        assertEquals(Instant.parse("2027-01-01T00:00:00Z"), ScheduleParser.parse("@yearly", ZoneOffset.UTC).next(from));
        assertEquals(Instant.parse("2026-04-01T00:00:00Z"), ScheduleParser.parse("@monthly", ZoneOffset.UTC).next(from));
        assertEquals(Instant.parse("2026-03-15T00:00:00Z"), ScheduleParser.parse("@weekly", ZoneOffset.UTC).next(from));
        assertEquals(Instant.parse("2026-03-11T00:00:00Z"), ScheduleParser.parse("@daily", ZoneOffset.UTC).next(from));
        assertEquals(Instant.parse("2026-03-10T11:00:00Z"), ScheduleParser.parse("@hourly", ZoneOffset.UTC).next(from));
    }

    @Test
    void malformedSpecsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parse("not a cron"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parse("@fortnightly"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parse("61 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parse("0 0 0 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parse("0 0 9 * * 8"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parse("  "));
    }
}
