package io.a2a.protocol.model;

import org.jspecify.annotations.Nullable;

/**
 * Raised when a part projection carries a missing or unrecognized {@code type} discriminator.
 */
public class UnknownPartTypeException extends A2AValidationException {

    private final @Nullable String type;

    public UnknownPartTypeException(@Nullable String type) {
        super(type == null
                ? "Part is missing the 'type' discriminator"
                : "Unknown part type: " + type + ". Must be one of: " + Part.Type.names());
        this.type = type;
    }

    /**
     * @return the rejected discriminator, or {@code null} when it was missing
     */
    public @Nullable String getType() {
        return type;
    }
}
