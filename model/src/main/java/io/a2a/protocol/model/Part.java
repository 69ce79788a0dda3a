package io.a2a.protocol.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A typed content unit within a {@link Message} or an {@link Artifact}.
 * <p>
 * A part is one of:
 * <ul>
 *   <li>{@link TextPart} - plain text content</li>
 *   <li>{@link FilePart} - file content, as base64 bytes or a URI reference</li>
 *   <li>{@link DataPart} - structured JSON data</li>
 * </ul>
 * <p>
 * The projection of a part carries a {@code type} discriminator ({@code "text"}, {@code "file"} or
 * {@code "data"}) that {@link #fromProjection(Map)} uses to pick the concrete variant. Parts are immutable.
 *
 * @see Message
 * @see Artifact
 */
@JsonDeserialize(using = PartDeserializer.class)
public sealed interface Part permits TextPart, FilePart, DataPart {

    /**
     * The discriminator values of the part variants.
     */
    enum Type {
        TEXT(TextPart.TEXT, TextPart.class),
        FILE(FilePart.FILE, FilePart.class),
        DATA(DataPart.DATA, DataPart.class);

        private final String type;
        private final Class<? extends Part> partClass;

        Type(String type, Class<? extends Part> partClass) {
            this.type = type;
            this.partClass = partClass;
        }

        @JsonValue
        public String asString() {
            return type;
        }

        Class<? extends Part> partClass() {
            return partClass;
        }

        /**
         * @param type the discriminator value
         * @return the matching type
         * @throws UnknownPartTypeException if the value is missing or unknown
         */
        public static Type fromString(@Nullable String type) {
            for (Type value : values()) {
                if (value.type.equals(type)) {
                    return value;
                }
            }
            throw new UnknownPartTypeException(type);
        }

        static String names() {
            return Arrays.stream(values()).map(Type::asString).collect(Collectors.joining(", "));
        }
    }

    /**
     * @return the discriminator of this part
     */
    Type type();

    /**
     * @return optional metadata, or {@code null}
     */
    @Nullable Map<String, Object> metadata();

    /**
     * @return {@code {type, ...fields, metadata?}}
     */
    default Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    /**
     * Builds the part variant named by the {@code type} discriminator of the projection.
     *
     * @param projection the projection
     * @return the part
     * @throws UnknownPartTypeException if the discriminator is missing or unknown
     * @throws A2AValidationException if the variant's own fields are invalid
     */
    static Part fromProjection(Map<String, ?> projection) {
        Assert.checkNotNullParam("projection", projection);
        Object type = projection.get("type");
        Type partType = Type.fromString(type instanceof String s ? s : null);
        return Utils.fromProjection(projection, partType.partClass());
    }

    /**
     * Normalizes a list whose elements are either parts or part projections.
     *
     * @param parts the elements
     * @return an unmodifiable list of parts, in the same order
     */
    static List<Part> normalizeAll(List<?> parts) {
        return Utils.normalizeAll(parts, Part.class);
    }
}
