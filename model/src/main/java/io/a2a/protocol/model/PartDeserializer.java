package io.a2a.protocol.model;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

/**
 * Dispatches a part projection to its concrete variant using the {@code type} discriminator.
 * <p>
 * The variants opt out of this deserializer, so the delegation below binds them with their own creators.
 */
class PartDeserializer extends StdDeserializer<Part> {

    public PartDeserializer() {
        super(Part.class);
    }

    @Override
    public Part deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        if (node == null || !node.isObject()) {
            throw new A2AValidationException("Part must be a JSON object");
        }
        JsonNode type = node.get("type");
        Part.Type partType = Part.Type.fromString(type != null && type.isTextual() ? type.asText() : null);
        return context.readTreeAsValue(node, partType.partClass());
    }
}
