package io.a2a.protocol.util;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.a2a.protocol.model.A2AValidationException;
import org.jspecify.annotations.Nullable;

/**
 * Shared helpers for the projection discipline of the model.
 * <p>
 * A projection is the plain {@code Map<String, Object>} form of an entity: canonical camelCase keys,
 * absent fields omitted. Every entity converts to and from its projection through {@link #OBJECT_MAPPER},
 * so key normalization (snake_case aliases) and omission rules live in one place: the Jackson
 * annotations on the records.
 */
public final class Utils {

    /**
     * The mapper used for every projection and JSON conversion.
     */
    public static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /**
     * Type reference for projections.
     */
    public static final TypeReference<Map<String, Object>> PROJECTION_TYPE = new TypeReference<>() {};

    private Utils() {
    }

    /**
     * Converts an entity to its projection.
     *
     * @param value the entity
     * @return a mutable map holding the canonical projection
     */
    public static Map<String, Object> toProjection(Object value) {
        Assert.checkNotNullParam("value", value);
        return OBJECT_MAPPER.convertValue(value, PROJECTION_TYPE);
    }

    /**
     * Builds an entity from a projection, accepting camelCase or snake_case keys.
     *
     * @param projection the projection
     * @param type the entity type
     * @param <T> the entity type
     * @return the entity
     * @throws A2AValidationException if the projection violates an invariant of the entity
     */
    public static <T> T fromProjection(@Nullable Map<String, ?> projection, Class<T> type) {
        Assert.checkNotNullParam("projection", projection);
        try {
            return OBJECT_MAPPER.convertValue(projection, type);
        } catch (IllegalArgumentException e) {
            throw asValidationException(type, e);
        }
    }

    /**
     * Accepts either an already built instance of {@code type} or its raw projection.
     *
     * @param value an instance of {@code type} or a {@link Map} projection
     * @param type the expected type
     * @param <T> the expected type
     * @return the instance
     * @throws A2AValidationException if the value is neither
     */
    @SuppressWarnings("unchecked")
    public static <T> T normalize(@Nullable Object value, Class<T> type) {
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        if (value instanceof Map<?, ?> map) {
            return fromProjection((Map<String, ?>) map, type);
        }
        throw new A2AValidationException("Expected " + type.getSimpleName() + " or its projection but got "
                + (value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Normalizes every element of a list through {@link #normalize(Object, Class)}, keeping order.
     *
     * @param values the elements, instances or projections
     * @param type the element type
     * @param <T> the element type
     * @return an unmodifiable list of instances
     */
    public static <T> List<T> normalizeAll(List<?> values, Class<T> type) {
        Assert.checkNotNullParam("values", values);
        List<T> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(normalize(value, type));
        }
        return Collections.unmodifiableList(normalized);
    }

    /**
     * Unmodifiable, order-preserving deep copy of a list, or {@code null}. Nested maps and lists are copied
     * the same way, so the result shares no mutable state with the argument.
     *
     * @param list the list
     * @param <T> element type
     * @return the copy
     */
    @SuppressWarnings("unchecked")
    public static <T> @Nullable List<T> copyOfNullable(@Nullable List<T> list) {
        return list == null ? null : (List<T>) deepCopy(list);
    }

    /**
     * Unmodifiable, order-preserving deep copy of a map, or {@code null}. Null values are kept; nested maps
     * and lists are copied the same way.
     *
     * @param map the map
     * @param <V> value type
     * @return the copy
     */
    @SuppressWarnings("unchecked")
    public static <V> @Nullable Map<String, V> copyOfNullable(@Nullable Map<String, V> map) {
        return map == null ? null : (Map<String, V>) deepCopy(map);
    }

    private static @Nullable Object deepCopy(@Nullable Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, @Nullable Object> copy = new LinkedHashMap<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<@Nullable Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(deepCopy(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Current time of the clock as an ISO-8601 UTC timestamp with second precision.
     *
     * @param clock the time source
     * @return for example {@code 2025-01-15T10:30:00Z}
     */
    public static String currentTimestamp(Clock clock) {
        return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
    }

    /**
     * Checks that the value parses as an ISO-8601 date-time.
     *
     * @param name the parameter name
     * @param timestamp the value
     * @return the value
     * @throws A2AValidationException if it does not parse
     */
    public static String checkTimestamp(String name, String timestamp) {
        try {
            DateTimeFormatter.ISO_DATE_TIME.parse(timestamp);
        } catch (DateTimeParseException e) {
            throw new A2AValidationException("Parameter '" + name + "' is not an ISO-8601 timestamp: " + timestamp, e);
        }
        return timestamp;
    }

    /**
     * Recovers the validation failure raised while mapping, or wraps any other mapping failure.
     * Jackson wraps exceptions thrown by constructors and custom deserializers, so the cause chain is searched
     * for the original {@link A2AValidationException}.
     *
     * @param type the type being mapped
     * @param failure the failure
     * @return the validation exception to throw
     */
    public static A2AValidationException asValidationException(Class<?> type, Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof A2AValidationException validationException) {
                return validationException;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return new A2AValidationException("Invalid " + type.getSimpleName() + ": " + describe(failure), failure);
    }

    private static String describe(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof JsonProcessingException jsonProcessingException) {
                return jsonProcessingException.getOriginalMessage();
            }
            current = current.getCause();
        }
        return String.valueOf(failure.getMessage());
    }
}
