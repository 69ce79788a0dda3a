package io.a2a.protocol.util;

import io.a2a.protocol.model.A2AValidationException;
import org.jspecify.annotations.Nullable;

/**
 * Parameter checks used by the compact constructors of the model records.
 */
public final class Assert {

    private Assert() {
    }

    /**
     * Checks that the given parameter is not {@code null}.
     *
     * @param name the parameter name, used in the failure message
     * @param value the value to check
     * @param <T> the value type
     * @return the value, never {@code null}
     * @throws A2AValidationException if the value is {@code null}
     */
    public static <T> T checkNotNullParam(String name, @Nullable T value) {
        if (value == null) {
            throw new A2AValidationException("Parameter '" + name + "' may not be null");
        }
        return value;
    }

    /**
     * Checks that the given string parameter is neither {@code null} nor blank.
     *
     * @param name the parameter name, used in the failure message
     * @param value the value to check
     * @return the value
     * @throws A2AValidationException if the value is {@code null} or blank
     */
    public static String checkNotBlankParam(String name, @Nullable String value) {
        checkNotNullParam(name, value);
        if (value.isBlank()) {
            throw new A2AValidationException("Parameter '" + name + "' may not be blank");
        }
        return value;
    }
}
