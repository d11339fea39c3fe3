package io.syncbeat.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncbeat.core.JobSpec;
import io.syncbeat.core.JobSpecParseException;
import io.syncbeat.core.TimingKind;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON wire format of a schedule store entry.
 *
 * <pre>
 * {
 *   "task": "sync_contacts",
 *   "schedule_type": "interval",      // or "crontab"
 *   "interval_seconds": 300,          // interval only
 *   "minute": "*&#47;5", "hour": "*", "day_of_week": "*", "day_of_month": "*", "month_of_year": "*",
 *   "args": [], "kwargs": {}, "options": {}
 * }
 * </pre>
 *
 * The job name is the store key and is not part of the document.
 */
public final class JobSpecCodec {

    private static final TypeReference<List<Object>> LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JobSpecCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @throws JobSpecParseException when the document is not JSON, has no task or carries an invalid interval
     */
    public JobSpec parse(String name, String serialized) {
        if (serialized == null || serialized.isBlank()) {
            throw new JobSpecParseException(name, "empty job spec");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(serialized);
        } catch (JsonProcessingException e) {
            throw new JobSpecParseException(name, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new JobSpecParseException(name, "job spec must be a JSON object");
        }

        String task = text(root.get("task"));
        if (task == null) {
            throw new JobSpecParseException(name, "missing 'task'");
        }

        try {
            return new JobSpec(
                    name,
                    task,
                    TimingKind.fromWireName(text(root.get("schedule_type"))),
                    text(root.get("minute")),
                    text(root.get("hour")),
                    text(root.get("day_of_week")),
                    text(root.get("day_of_month")),
                    text(root.get("month_of_year")),
                    intervalSeconds(name, root.get("interval_seconds")),
                    convert(name, root.get("args"), LIST),
                    convert(name, root.get("kwargs"), MAP),
                    convert(name, root.get("options"), MAP)
            );
        } catch (IllegalArgumentException e) {
            throw new JobSpecParseException(name, e.getMessage(), e);
        }
    }

    public String write(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");

        ObjectNode node = objectMapper.createObjectNode();
        node.put("task", spec.task());
        node.put("schedule_type", spec.timingKind().wireName());
        if (spec.timingKind() == TimingKind.CRONTAB) {
            node.put("minute", spec.minute());
            node.put("hour", spec.hour());
            node.put("day_of_week", spec.dayOfWeek());
            node.put("day_of_month", spec.dayOfMonth());
            node.put("month_of_year", spec.monthOfYear());
        } else {
            node.put("interval_seconds", spec.intervalSeconds());
        }
        node.set("args", objectMapper.valueToTree(spec.args()));
        node.set("kwargs", objectMapper.valueToTree(spec.kwargs()));
        node.set("options", objectMapper.valueToTree(spec.options()));

        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize job spec " + spec.name(), e);
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isContainerNode()) {
            return node.toString();
        }
        String s = node.asText();
        return s.isBlank() ? null : s.trim();
    }

    private static long intervalSeconds(String name, JsonNode node) {
        if (node == null || node.isNull()) {
            return JobSpec.DEFAULT_INTERVAL_SECONDS;
        }
        double seconds;
        if (node.isNumber()) {
            seconds = node.asDouble();
        } else if (node.isTextual()) {
            try {
                seconds = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new JobSpecParseException(name, "interval_seconds is not a number: " + node.asText());
            }
        } else {
            throw new JobSpecParseException(name, "interval_seconds is not a number: " + node);
        }
        long rounded = (long) Math.ceil(seconds);
        if (rounded <= 0) {
            throw new JobSpecParseException(name, "interval_seconds must be positive: " + node.asText());
        }
        return rounded;
    }

    private <T> T convert(String name, JsonNode node, TypeReference<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new JobSpecParseException(name, "invalid payload field: " + e.getMessage(), e);
        }
    }
}
