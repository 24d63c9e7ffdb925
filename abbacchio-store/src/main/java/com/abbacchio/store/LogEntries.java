package com.abbacchio.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns publication payloads into {@link LogEntry}s.
 *
 * <p>
 * The gateway publishes either {@code {"type":"log","data":{…}}} or
 * {@code {"type":"batch","data":[…]}}; a bare log object is accepted too.
 * Each record is normalised: level defaults to 30 (info), the message comes
 * from {@code msg} or {@code message}, the namespace from {@code namespace}
 * or {@code name}, and every other field lands in {@code data}.
 */
@Slf4j
public final class LogEntries {

    public static final int DEFAULT_LEVEL = 30;
    public static final String ENCRYPTED_MESSAGE = "[Encrypted]";

    private static final Map<Integer, String> LEVEL_LABELS = Map.of(
            10, "trace",
            20, "debug",
            30, "info",
            40, "warn",
            50, "error",
            60, "fatal");

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "id", "level", "levelLabel", "time", "msg", "message", "namespace", "name", "channel",
            "data", "encrypted", "encryptedData");

    private LogEntries() {
    }

    public static String labelFor(int level) {
        return LEVEL_LABELS.getOrDefault(level, "info");
    }

    public static List<LogEntry> fromPublication(String channel, JsonNode payload) {
        return fromPublication(channel, payload, System.currentTimeMillis());
    }

    /**
     * @param channel channel used for records that do not name one
     * @param now     time assigned to records without a usable timestamp
     */
    public static List<LogEntry> fromPublication(String channel, JsonNode payload, long now) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return List.of();
        }
        String type = payload.path("type").asText("");
        JsonNode body = payload.get("data");
        if ("batch".equals(type) && body != null && body.isArray()) {
            List<LogEntry> entries = new ArrayList<>(body.size());
            for (JsonNode record : body) {
                entries.add(normalize(record, channel, now));
            }
            return entries;
        }
        if ("log".equals(type) && body != null) {
            return List.of(normalize(body, channel, now));
        }
        return List.of(normalize(payload, channel, now));
    }

    /**
     * Normalise one record. Non-object records become an info entry whose
     * message is the record's text.
     */
    public static LogEntry normalize(JsonNode record, String defaultChannel, long now) {
        if (record == null || !record.isObject()) {
            String text = record == null || record.isNull() ? "" : record.isTextual() ? record.asText() : record.toString();
            return LogEntry.builder()
                    .id(newId())
                    .level(DEFAULT_LEVEL)
                    .levelLabel(labelFor(DEFAULT_LEVEL))
                    .time(now)
                    .msg(text)
                    .channel(defaultChannel)
                    .data(JsonNodeFactory.instance.objectNode())
                    .build();
        }

        String channel = textOr(record, "channel", defaultChannel);
        String id = textOr(record, "id", null);
        if (id == null || id.isEmpty()) {
            id = newId();
        }

        if (isEncrypted(record)) {
            String ciphertext = record.get("encrypted").isTextual()
                    ? record.get("encrypted").asText()
                    : textOr(record, "encryptedData", null);
            return LogEntry.builder()
                    .id(id)
                    .level(DEFAULT_LEVEL)
                    .levelLabel(labelFor(DEFAULT_LEVEL))
                    .time(timeOf(record, now))
                    .msg(ENCRYPTED_MESSAGE)
                    .channel(channel)
                    .data(JsonNodeFactory.instance.objectNode())
                    .encrypted(true)
                    .encryptedData(ciphertext)
                    .build();
        }

        int level = record.path("level").isNumber() ? record.get("level").asInt() : DEFAULT_LEVEL;
        String msg = textOr(record, "msg", null);
        if (msg == null || msg.isEmpty()) {
            msg = textOr(record, "message", "");
        }
        String namespace = textOr(record, "namespace", null);
        if (namespace == null || namespace.isEmpty()) {
            namespace = textOr(record, "name", null);
        }

        return LogEntry.builder()
                .id(id)
                .level(level)
                .levelLabel(labelFor(level))
                .time(timeOf(record, now))
                .msg(msg)
                .namespace(namespace)
                .channel(channel)
                .data(extraFields(record))
                .build();
    }

    // ==================== Helpers ====================

    private static boolean isEncrypted(JsonNode record) {
        JsonNode encrypted = record.get("encrypted");
        if (encrypted == null) {
            return false;
        }
        return encrypted.isTextual() || (encrypted.asBoolean(false) && record.path("encryptedData").isTextual());
    }

    /** Already-normalised records carry their extras under "data"; raw ones inline. */
    private static ObjectNode extraFields(JsonNode record) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        JsonNode nested = record.get("data");
        if (nested != null && nested.isObject()) {
            data.setAll((ObjectNode) nested);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                data.set(field.getKey(), field.getValue());
            }
        }
        if (nested != null && !nested.isObject() && !nested.isNull()) {
            data.set("data", nested);
        }
        return data;
    }

    private static long timeOf(JsonNode record, long now) {
        JsonNode time = record.get("time");
        if (time == null || time.isNull()) {
            return now;
        }
        if (time.isNumber()) {
            long value = time.asLong();
            return value > 0 ? value : now;
        }
        if (time.isTextual()) {
            try {
                return Instant.parse(time.asText()).toEpochMilli();
            } catch (DateTimeParseException e) {
                log.debug("Unparseable log time '{}', using receive time", time.asText());
            }
        }
        return now;
    }

    private static String textOr(JsonNode record, String field, String fallback) {
        JsonNode value = record.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return fallback;
        }
        return value.asText();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
