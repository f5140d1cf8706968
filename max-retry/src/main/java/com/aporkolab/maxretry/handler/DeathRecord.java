package com.aporkolab.maxretry.handler;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.rabbitmq.client.LongString;

/**
 * One entry of the broker-maintained {@code x-death} header.
 * 
 * The broker appends (or updates) an entry every time a message is dead-lettered,
 * naming the queue it died on. Entries are parsed defensively: anything that is not
 * a field table, or has no usable {@code queue}, is dropped rather than failing the delivery.
 *
 * @param queue       queue the message was dead-lettered from
 * @param count       broker-maintained death count for this entry, 0 when absent or unreadable
 * @param reason      {@code rejected}, {@code expired}, {@code maxlen} or {@code delivery_limit}; may be null
 * @param exchange    exchange the message was published to before it died; may be null
 * @param routingKeys routing keys the message was published with
 */
public record DeathRecord(String queue, long count, String reason, String exchange, List<String> routingKeys) {

    public static final String X_DEATH_HEADER = "x-death";

    public DeathRecord {
        Objects.requireNonNull(queue, "queue");
        count = Math.max(count, 0);
        routingKeys = routingKeys == null ? List.of() : List.copyOf(routingKeys);
    }

    /**
     * Parse the {@code x-death} history out of message headers.
     * Returns an empty list when headers or the history are absent.
     */
    public static List<DeathRecord> fromHeaders(Map<String, Object> headers) {
        if (headers == null) {
            return List.of();
        }
        Object history = headers.get(X_DEATH_HEADER);
        if (!(history instanceof List)) {
            return List.of();
        }

        List<?> entries = (List<?>) history;
        List<DeathRecord> records = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            from(entry).ifPresent(records::add);
        }
        return Collections.unmodifiableList(records);
    }

    /**
     * Parse a single {@code x-death} entry.
     */
    public static Optional<DeathRecord> from(Object entry) {
        if (!(entry instanceof Map)) {
            return Optional.empty();
        }
        Map<?, ?> fields = (Map<?, ?>) entry;

        String queue = asString(fields.get("queue"));
        if (queue == null || queue.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new DeathRecord(
                queue,
                asCount(fields.get("count")),
                asString(fields.get("reason")),
                asString(fields.get("exchange")),
                asStrings(fields.get("routing-keys"))
        ));
    }

    public boolean diedOn(String queueName) {
        return queue.equals(queueName);
    }

    private static String asString(Object value) {
        if (value instanceof String || value instanceof LongString) {
            return value.toString();
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return null;
    }

    private static long asCount(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static List<String> asStrings(Object value) {
        if (!(value instanceof List)) {
            return List.of();
        }
        List<String> strings = new ArrayList<>();
        for (Object element : (List<?>) value) {
            String string = asString(element);
            if (string != null) {
                strings.add(string);
            }
        }
        return strings;
    }
}
