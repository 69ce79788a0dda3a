package io.a2a.protocol.model;

import java.util.List;
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
 * Represents a structured data content part within a {@link Message} or {@link Artifact}.
 * <p>
 * DataPart carries machine readable content such as form values or analysis results. The data is a JSON
 * object ({@link Map}) or a JSON array ({@link List}); nested values may be maps, lists and scalars.
 * <pre>{@code
 * DataPart result = new DataPart(Map.of("status", "success", "count", 42));
 * DataPart rows = new DataPart(List.of(Map.of("id", 1), Map.of("id", 2)));
 * }</pre>
 *
 * @param data the structured content, required
 * @param metadata optional metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type", "data", "metadata"})
@JsonDeserialize(using = JsonDeserializer.None.class)
public record DataPart(@JsonProperty("data") Object data,
                       @JsonProperty("metadata") @Nullable Map<String, Object> metadata) implements Part {

    public static final String DATA = "data";

    @JsonCreator
    @SuppressWarnings("unchecked")
    public DataPart {
        Assert.checkNotNullParam("data", data);
        if (data instanceof Map<?, ?> map) {
            data = Utils.copyOfNullable((Map<String, Object>) map);
        } else if (data instanceof List<?> list) {
            data = Utils.copyOfNullable(list);
        } else {
            throw new A2AValidationException("DataPart data must be a JSON object or array but got "
                    + data.getClass().getName());
        }
        metadata = Utils.copyOfNullable(metadata);
    }

    public DataPart(Map<String, Object> data) {
        this(data, null);
    }

    public DataPart(List<?> data) {
        this(data, null);
    }

    @Override
    @JsonProperty("type")
    public Type type() {
        return Type.DATA;
    }

    public static DataPart fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, DataPart.class);
    }
}
