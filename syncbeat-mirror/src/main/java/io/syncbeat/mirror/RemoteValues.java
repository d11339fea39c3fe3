package io.syncbeat.mirror;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Converters for raw remote field values. The remote sends {@code false} for every empty field,
 * whatever its type, so each converter maps {@code false} to {@code null}.
 */
public final class RemoteValues {

    private static final DateTimeFormatter REMOTE_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            s -> LocalDateTime.parse(s, REMOTE_DATE_TIME).toInstant(ZoneOffset.UTC),
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private RemoteValues() {
    }

    public static Object optional(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return null;
        }
        return value;
    }

    public static String text(Object value) {
        Object v = optional(value);
        return v == null ? null : v.toString();
    }

    public static String textOr(Object value, String fallback) {
        String v = text(value);
        return v == null ? fallback : v;
    }

    public static Double number(Object value) {
        Object v = optional(value);
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof String s) {
            try {
                return Double.valueOf(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Integral identifier, or {@code null} when absent or not a whole number.
     */
    public static Long identifier(Object value) {
        Object v = optional(value);
        if (v instanceof Integer || v instanceof Long || v instanceof Short) {
            return ((Number) v).longValue();
        }
        if (v instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return n.longValue();
        }
        return null;
    }

    public static Reference reference(Object value) {
        if (!(value instanceof List<?> pair) || pair.isEmpty()) {
            return Reference.NONE;
        }
        Long id = identifier(pair.get(0));
        if (id == null) {
            return Reference.NONE;
        }
        String label = pair.size() > 1 ? text(pair.get(1)) : null;
        return new Reference(id, label);
    }

    /**
     * Parses remote timestamps. The remote writes UTC as {@code yyyy-MM-dd HH:mm:ss}; ISO date-times
     * and plain dates (start of day, UTC) are accepted as well.
     */
    public static Instant timestamp(Object value) {
        String s = text(value);
        if (s == null || s.isBlank()) {
            return null;
        }
        String trimmed = s.trim();
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            Instant parsed = tryParse(parser, trimmed);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Instant tryParse(Function<String, Instant> parser, String value) {
        try {
            return parser.apply(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static Long remoteId(Map<String, Object> record) {
        return record == null ? null : identifier(record.get("id"));
    }
}
