package io.syncbeat.utils;

import io.syncbeat.core.JobSpecParseException;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CrontabPatternsTest {

    @Test
    void toQuartzCronShouldPrependSecondsAndDefaultToAny() {
        assertEquals("0 */5 * * * ?", CrontabPatterns.toQuartzCron("*/5", null, " ", "*", "?"));
    }

    @Test
    void normalizeDayOfWeekShouldShiftCrontabNumbering() {
        assertEquals("1", CrontabPatterns.normalizeDayOfWeek("0"));
        assertEquals("1", CrontabPatterns.normalizeDayOfWeek("7"));
        assertEquals("2-6", CrontabPatterns.normalizeDayOfWeek("1-5"));
        assertEquals("1,7", CrontabPatterns.normalizeDayOfWeek("0,6"));
    }

    @Test
    void normalizeDayOfWeekShouldKeepStepsNamesAndWildcards() {
        assertEquals("*/2", CrontabPatterns.normalizeDayOfWeek("*/2"));
        assertEquals("2-6/2", CrontabPatterns.normalizeDayOfWeek("1-5/2"));
        assertEquals("mon-fri", CrontabPatterns.normalizeDayOfWeek("mon-fri"));
        assertEquals("*", CrontabPatterns.normalizeDayOfWeek(null));
    }

    @Test
    void normalizeDayOfWeekShouldRejectOutOfRangeDays() {
        assertThrows(JobSpecParseException.class, () -> CrontabPatterns.normalizeDayOfWeek("8"));
    }

    @Test
    void compileShouldRejectInvalidPatterns() {
        assertThrows(JobSpecParseException.class,
                () -> CrontabPatterns.compile(CrontabPatterns.toQuartzCron("61", "*", "*", "*", "?"), ZoneOffset.UTC));
        assertThrows(JobSpecParseException.class,
                () -> CrontabPatterns.toQuartzCron("0 5", "*", "*", "*", "?"));
    }

    @Test
    void compileShouldAcceptValidPattern() {
        assertNotNull(CrontabPatterns.compile(CrontabPatterns.toQuartzCron("0", "2", "*", "1-6", "?"), ZoneOffset.UTC));
    }

    @Test
    void quartzOnlySyntaxShouldBeRejected() {
        for (String field : new String[]{"L", ",", "1,", "15W", "1#2", "?", "5L", "-5"}) {
            assertThrows(JobSpecParseException.class,
                    () -> CrontabPatterns.toQuartzCron(field, "*", "*", "*", "?"), field);
        }
        assertThrows(JobSpecParseException.class, () -> CrontabPatterns.normalizeDayOfWeek("L"));
    }

    @Test
    void namesRangesAndStepsShouldStillBeAccepted() {
        assertEquals("0 0-30/10 * ? jul-aug *", CrontabPatterns.toQuartzCron("0-30/10", "*", "?", "jul-aug", "*"));
        assertEquals("mon-fri", CrontabPatterns.normalizeDayOfWeek("mon-fri"));
    }
}
