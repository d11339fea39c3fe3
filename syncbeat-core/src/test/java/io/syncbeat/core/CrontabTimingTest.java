package io.syncbeat.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrontabTimingTest {

    @Test
    void weekdayPatternShouldMatchOnlyMondayToFriday() {
        CrontabTiming timing = CrontabTiming.of("0", "9", "1-5", "*", "*", ZoneOffset.UTC);

        assertTrue(timing.isDue(null, Instant.parse("2026-01-05T09:00:00Z")));   // Monday
        assertTrue(timing.isDue(null, Instant.parse("2026-01-05T09:00:59Z")));
        assertFalse(timing.isDue(null, Instant.parse("2026-01-05T09:01:00Z")));
        assertFalse(timing.isDue(null, Instant.parse("2026-01-03T09:00:00Z")));  // Saturday
        assertFalse(timing.isDue(null, Instant.parse("2026-01-04T09:00:00Z")));  // Sunday
    }

    @Test
    void sundayMayBeWrittenAsZeroOrSeven() {
        Instant sunday = Instant.parse("2026-01-04T12:30:00Z");

        assertTrue(CrontabTiming.of("30", "12", "0", "*", "*", ZoneOffset.UTC).isDue(null, sunday));
        assertTrue(CrontabTiming.of("30", "12", "7", "*", "*", ZoneOffset.UTC).isDue(null, sunday));
        assertTrue(CrontabTiming.of("30", "12", "sun", "*", "*", ZoneOffset.UTC).isDue(null, sunday));
    }

    @Test
    void dayOfMonthAndDayOfWeekMustBothMatch() {
        CrontabTiming fridayThe13th = CrontabTiming.of("0", "0", "5", "13", "*", ZoneOffset.UTC);

        assertTrue(fridayThe13th.isDue(null, Instant.parse("2026-02-13T00:00:00Z")));
        assertFalse(fridayThe13th.isDue(null, Instant.parse("2026-01-13T00:00:00Z"))); // Tuesday
        assertFalse(fridayThe13th.isDue(null, Instant.parse("2026-01-16T00:00:00Z"))); // Friday 16th
    }

    @Test
    void shouldFireOncePerMatchingMinute() {
        CrontabTiming everyMinute = CrontabTiming.of("*", "*", "*", "*", "*", ZoneOffset.UTC);
        Instant firstRun = Instant.parse("2026-01-05T10:15:05Z");

        assertTrue(everyMinute.isDue(null, firstRun));
        assertFalse(everyMinute.isDue(firstRun, Instant.parse("2026-01-05T10:15:45Z")));
        assertTrue(everyMinute.isDue(firstRun, Instant.parse("2026-01-05T10:16:00Z")));
    }

    @Test
    void shouldEvaluateInConfiguredZone() {
        CrontabTiming nineInBerlin = CrontabTiming.of("0", "9", "*", "*", "*", ZoneId.of("Europe/Berlin"));

        assertTrue(nineInBerlin.isDue(null, Instant.parse("2026-01-05T08:00:00Z")));
        assertFalse(nineInBerlin.isDue(null, Instant.parse("2026-01-05T09:00:00Z")));
    }

    @Test
    void invalidFieldShouldFailToCompile() {
        assertThrows(JobSpecParseException.class,
                () -> CrontabTiming.of("75", "*", "*", "*", "*", ZoneOffset.UTC));
        assertThrows(JobSpecParseException.class,
                () -> CrontabTiming.of("0", "0", "*", "*", "13", ZoneOffset.UTC));
    }

    @Test
    void patternsThatCannotBeEvaluatedShouldFailToCompile() {
        assertThrows(JobSpecParseException.class, () -> CrontabTiming.of("L", "*", "*", "*", "*", ZoneOffset.UTC));
        assertThrows(JobSpecParseException.class, () -> CrontabTiming.of(",", "*", "*", "*", "*", ZoneOffset.UTC));
        assertThrows(JobSpecParseException.class, () -> CrontabTiming.of("0", "0", "*", "15W", "*", ZoneOffset.UTC));
        assertThrows(JobSpecParseException.class, () -> CrontabTiming.of("0", "0", "1#2", "*", "*", ZoneOffset.UTC));
    }
}
