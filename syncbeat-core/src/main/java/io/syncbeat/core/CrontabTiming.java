package io.syncbeat.core;

import io.syncbeat.utils.CrontabPatterns;
import org.quartz.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;

/**
 * Five-field crontab matcher (minute, hour, day-of-month, month, day-of-week) at minute resolution.
 *
 * <p>All five fields must match. Quartz cannot express a day-of-month and a day-of-week restriction
 * in one expression, so the pattern is held as two expressions that share minute/hour/month.
 * An entry fires at most once per matching minute.
 */
public final class CrontabTiming implements Timing {

    private final String pattern;
    private final CronExpression byDayOfMonth;
    private final CronExpression byDayOfWeek;

    private CrontabTiming(String pattern, CronExpression byDayOfMonth, CronExpression byDayOfWeek) {
        this.pattern = pattern;
        this.byDayOfMonth = byDayOfMonth;
        this.byDayOfWeek = byDayOfWeek;
    }

    /**
     * @throws JobSpecParseException when any field is not a valid crontab pattern
     */
    public static CrontabTiming of(String minute, String hour, String dayOfWeek, String dayOfMonth,
                                   String monthOfYear, ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        String dow = CrontabPatterns.normalizeDayOfWeek(dayOfWeek);

        CronExpression domExpression = CrontabPatterns.compile(
                CrontabPatterns.toQuartzCron(minute, hour, dayOfMonth, monthOfYear, CrontabPatterns.NO_DAY), zone);
        CronExpression dowExpression = CrontabPatterns.compile(
                CrontabPatterns.toQuartzCron(minute, hour, CrontabPatterns.NO_DAY, monthOfYear, dow), zone);

        String pattern = String.join(" ", minute, hour, dayOfMonth, monthOfYear, dayOfWeek);
        verifyEvaluable(pattern, domExpression, dowExpression);
        return new CrontabTiming(pattern, domExpression, dowExpression);
    }

    // Quartz accepts some expressions at compile time that later fail on every evaluation
    private static void verifyEvaluable(String pattern, CronExpression... expressions) {
        Date epoch = new Date(0);
        try {
            for (CronExpression expression : expressions) {
                expression.isSatisfiedBy(epoch);
                expression.getNextValidTimeAfter(epoch);
            }
        } catch (RuntimeException e) {
            throw new JobSpecParseException(null, "Invalid crontab pattern: '" + pattern + "'", e);
        }
    }

    @Override
    public boolean isDue(Instant lastRunAt, Instant now) {
        Instant minute = now.truncatedTo(ChronoUnit.MINUTES);
        if (lastRunAt != null && !lastRunAt.truncatedTo(ChronoUnit.MINUTES).isBefore(minute)) {
            return false;
        }
        Date at = Date.from(minute);
        return byDayOfMonth.isSatisfiedBy(at) && byDayOfWeek.isSatisfiedBy(at);
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "CrontabTiming[" + pattern + "]";
    }
}
