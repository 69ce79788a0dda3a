package io.a2a.protocol.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Represents a plain text content part within a {@link Message} or {@link Artifact}.
 * <p>
 * Example usage:
 * <pre>{@code
 * TextPart greeting = new TextPart("Hello, how can I help you?");
 * TextPart withMetadata = new TextPart("Bonjour!", Map.of("language", "fr"));
 * }</pre>
 *
 * @param text the text content, required (may be empty)
 * @param metadata optional metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type", "text", "metadata"})
@JsonDeserialize(using = JsonDeserializer.None.class)
public record TextPart(@JsonProperty("text") String text,
                       @JsonProperty("metadata") @Nullable Map<String, Object> metadata) implements Part {

    public static final String TEXT = "text";

    @JsonCreator
    public TextPart {
        Assert.checkNotNullParam("text", text);
        metadata = Utils.copyOfNullable(metadata);
    }

    public TextPart(String text) {
        this(text, null);
    }

    @Override
    @JsonProperty("type")
    public Type type() {
        return Type.TEXT;
    }

    /**
     * @param projection {@code {"type": "text", "text": ..., "metadata"?: ...}}
     * @return the part
     */
    public static TextPart fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, TextPart.class);
    }
}
