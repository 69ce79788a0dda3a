package io.a2a.protocol.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * One communication turn between a client ({@link Role#USER}) and an agent ({@link Role#AGENT}).
 * <p>
 * A message carries an ordered, non-empty list of {@link Part}s. Use {@link #text(Role, String)} for the
 * common single text part case, or {@link #builder()} for anything richer:
 * <pre>{@code
 * Message question = Message.text(Message.Role.USER, "What is the capital of France?");
 *
 * Message answer = Message.builder()
 *     .role(Message.Role.AGENT)
 *     .parts(List.of(new TextPart("Paris"), Map.of("type", "data", "data", Map.of("confidence", 0.98))))
 *     .build();
 * }</pre>
 *
 * @param role who sent the message
 * @param parts the content, in order
 * @param metadata optional metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(@JsonProperty("role") Role role,
                      @JsonProperty("parts") List<Part> parts,
                      @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {

    @JsonCreator
    public Message {
        Assert.checkNotNullParam("role", role);
        Assert.checkNotNullParam("parts", parts);
        if (parts.isEmpty()) {
            throw new A2AValidationException("Message parts may not be empty");
        }
        parts = Part.normalizeAll(parts);
        metadata = Utils.copyOfNullable(metadata);
    }

    public Message(Role role, List<Part> parts) {
        this(role, parts, null);
    }

    /**
     * Builds a message holding a single {@link TextPart}.
     *
     * @param role the sender
     * @param text the text
     * @return the message
     */
    public static Message text(Role role, String text) {
        return text(role, text, null);
    }

    public static Message text(Role role, String text, @Nullable Map<String, Object> metadata) {
        return new Message(role, List.of(new TextPart(text)), metadata);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static Message fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, Message.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Message message) {
        return new Builder(message);
    }

    /**
     * The sender of a message.
     */
    public enum Role {
        USER("user"),
        AGENT("agent");

        private final String role;

        Role(String role) {
            this.role = role;
        }

        @JsonValue
        public String asString() {
            return role;
        }

        /**
         * @param role the wire value
         * @return the matching role
         * @throws A2AValidationException for anything other than {@code user} or {@code agent}
         */
        @JsonCreator
        public static Role fromString(@Nullable String role) {
            for (Role value : values()) {
                if (value.role.equals(role)) {
                    return value;
                }
            }
            throw new A2AValidationException("Invalid role: " + role + ". Must be one of: "
                    + Arrays.stream(values()).map(Role::asString).collect(Collectors.joining(", ")));
        }

        @Override
        public String toString() {
            return role;
        }
    }

    public static class Builder {

        private @Nullable Role role;
        private List<Object> parts = new ArrayList<>();
        private @Nullable Map<String, Object> metadata;

        private Builder() {
        }

        private Builder(Message message) {
            role = message.role;
            parts = new ArrayList<>(message.parts);
            metadata = message.metadata;
        }

        public Builder role(Role role) {
            this.role = role;
            return this;
        }

        /**
         * @param parts {@link Part} instances or part projections, mixed freely
         * @return this builder
         */
        public Builder parts(List<?> parts) {
            this.parts = new ArrayList<>(Assert.checkNotNullParam("parts", parts));
            return this;
        }

        public Builder parts(Part... parts) {
            return parts(Arrays.asList(parts));
        }

        public Builder addPart(Object part) {
            parts.add(part);
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Message build() {
            return new Message(Assert.checkNotNullParam("role", role), Part.normalizeAll(parts), metadata);
        }
    }
}
