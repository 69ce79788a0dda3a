package io.a2a.protocol.model;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

class StreamingEventKindDeserializer extends StdDeserializer<StreamingEventKind> {

    public StreamingEventKindDeserializer() {
        super(StreamingEventKind.class);
    }

    @Override
    public StreamingEventKind deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        if (node == null || !node.isObject()) {
            throw new A2AValidationException("Streaming event must be a JSON object");
        }
        return context.readTreeAsValue(node, StreamingEventKind.eventClass(node.has("status"), node.has("artifact")));
    }
}
