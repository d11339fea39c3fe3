package io.syncbeat.utils;

import io.syncbeat.core.JobSpecParseException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.ZoneId;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates five-field crontab patterns into Quartz {@link CronExpression}s.
 * <p>
 * Supported field syntax is whatever Quartz accepts per field: {@code *}, lists ({@code 1,15}),
 * ranges ({@code 9-17}), steps ({@code *}{@code /5}, {@code 0-30/10}) and month/day names.
 * <p>
 * Day-of-week numbering follows crontab ({@code 0} or {@code 7} = Sunday, {@code 1} = Monday) and
 * is rewritten to Quartz numbering ({@code 1} = Sunday).
 */
public final class CrontabPatterns {

    // a day number, not the increment after '/'
    private static final Pattern DAY_NUMBER = Pattern.compile("(?<![/\\d])\\d+");

    // a list/range/step operand: wildcard, number or three-letter month/day name
    private static final Pattern OPERAND = Pattern.compile("\\*|\\d+|[A-Za-z]{3}");

    public static final String NO_DAY = "?";

    private CrontabPatterns() {
    }

    /**
     * Builds a Quartz expression firing at second 0 of every matching minute.
     */
    public static String toQuartzCron(String minute, String hour, String dayOfMonth, String month, String dayOfWeek) {
        return String.join(" ", "0", field(minute), field(hour), dayField(dayOfMonth), field(month), dayField(dayOfWeek));
    }

    // "?" is the Quartz "no restriction" placeholder for the day field not being matched
    private static String dayField(String value) {
        return NO_DAY.equals(value) ? NO_DAY : field(value);
    }

    /**
     * Rewrites crontab day-of-week numbers to Quartz numbers. Names and {@code *} pass through.
     */
    public static String normalizeDayOfWeek(String dayOfWeek) {
        String s = field(dayOfWeek);
        Matcher m = DAY_NUMBER.matcher(s);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            int day;
            try {
                day = Integer.parseInt(m.group());
            } catch (NumberFormatException ex) {
                throw new JobSpecParseException(null, "day_of_week out of range: " + dayOfWeek);
            }
            if (day > 7) {
                throw new JobSpecParseException(null, "day_of_week out of range: " + dayOfWeek);
            }
            m.appendReplacement(out, Integer.toString(day % 7 + 1));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Compiles a Quartz expression for {@code zone}.
     *
     * @throws JobSpecParseException when Quartz rejects the expression
     */
    public static CronExpression compile(String quartzCron, ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        if (!CronExpression.isValidExpression(quartzCron)) {
            throw new JobSpecParseException(null, "Invalid crontab pattern: " + quartzCron);
        }
        try {
            CronExpression exp = new CronExpression(quartzCron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new JobSpecParseException(null, "Invalid crontab pattern: " + quartzCron, ex);
        }
    }

    private static String field(String value) {
        if (value == null || value.isBlank()) {
            return "*";
        }
        String s = value.trim();
        if (s.contains(" ")) {
            throw new JobSpecParseException(null, "crontab field must not contain whitespace: '" + value + "'");
        }
        // Quartz extensions (L, W, #, ?) and empty list items are not crontab syntax
        for (String operand : s.split("[,/-]", -1)) {
            if (!OPERAND.matcher(operand).matches()) {
                throw new JobSpecParseException(null, "Invalid crontab field: '" + value + "'");
            }
        }
        return s;
    }
}
