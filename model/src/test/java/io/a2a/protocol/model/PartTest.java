package io.a2a.protocol.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class PartTest {

    @Test
    void testTextPartProjection() {
        TextPart part = new TextPart("hello");

        assertEquals(Map.of("type", "text", "text", "hello"), part.toProjection());
    }

    @Test
    void testTextPartProjectionKeepsMetadata() {
        TextPart part = new TextPart("hello", Map.of("lang", "en"));

        Map<String, Object> projection = part.toProjection();

        assertEquals(Map.of("lang", "en"), projection.get("metadata"));
    }

    @Test
    void testFromProjectionDispatchesOnType() {
        Part text = Part.fromProjection(Map.of("type", "text", "text", "hi"));
        Part file = Part.fromProjection(Map.of("type", "file", "file", Map.of("uri", "https://example.com/a.png")));
        Part data = Part.fromProjection(Map.of("type", "data", "data", Map.of("answer", 42)));

        assertEquals(new TextPart("hi"), text);
        assertInstanceOf(FilePart.class, file);
        assertEquals("https://example.com/a.png", ((FilePart) file).file().uri());
        assertInstanceOf(DataPart.class, data);
        assertEquals(Map.of("answer", 42), ((DataPart) data).data());
    }

    @Test
    void testUnknownTypeIsRejected() {
        UnknownPartTypeException e = assertThrows(UnknownPartTypeException.class,
                () -> Part.fromProjection(Map.of("type", "video", "url", "x")));

        assertEquals("video", e.getType());
        assertEquals("Unknown part type: video. Must be one of: text, file, data", e.getMessage());
    }

    @Test
    void testMissingTypeIsRejected() {
        UnknownPartTypeException e = assertThrows(UnknownPartTypeException.class,
                () -> Part.fromProjection(Map.of("text", "hi")));

        assertNull(e.getType());
    }

    @Test
    void testTextPartRequiresText() {
        assertThrows(A2AValidationException.class, () -> Part.fromProjection(Map.of("type", "text")));
    }

    @Test
    void testDataPartAcceptsArray() {
        DataPart part = new DataPart(List.of(1, 2, 3));

        assertEquals(Map.of("type", "data", "data", List.of(1, 2, 3)), part.toProjection());
    }

    @Test
    void testDataPartRejectsScalar() {
        assertThrows(A2AValidationException.class, () -> new DataPart("not structured", null));
        assertThrows(A2AValidationException.class,
                () -> Part.fromProjection(Map.of("type", "data", "data", 7)));
    }

    @Test
    void testFilePartProjectionUsesCamelCase() {
        FilePart part = new FilePart(FileContent.ofBytes("a.txt", "text/plain", "aGVsbG8="));

        Map<String, Object> projection = part.toProjection();

        assertEquals("file", projection.get("type"));
        assertEquals(Map.of("name", "a.txt", "mimeType", "text/plain", "bytes", "aGVsbG8="), projection.get("file"));
    }

    @Test
    void testNormalizeAllAcceptsInstancesAndProjections() {
        List<Part> parts = Part.normalizeAll(List.of(new TextPart("a"), Map.of("type", "text", "text", "b")));

        assertEquals(List.of(new TextPart("a"), new TextPart("b")), parts);
    }

    @Test
    void testMetadataIsCopied() {
        Map<String, Object> metadata = new java.util.HashMap<>();
        metadata.put("k", "v");
        TextPart part = new TextPart("x", metadata);

        metadata.put("other", "value");

        assertFalse(part.metadata().containsKey("other"));
        assertTrue(part.metadata().containsKey("k"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDataPartIsDeeplyImmutable() {
        Map<String, Object> inner = new HashMap<>(Map.of("k", "v1"));
        List<Object> rows = new ArrayList<>(List.of("r1"));
        DataPart part = new DataPart(Map.of("inner", inner, "rows", rows),
                new HashMap<>(Map.of("trace", new ArrayList<>(List.of("a")))));
        Map<String, Object> before = part.toProjection();

        inner.put("k", "MUTATED");
        rows.add("r2");
        assertThrows(UnsupportedOperationException.class,
                () -> ((Map<String, Object>) ((Map<String, Object>) part.data()).get("inner")).put("x", 1));
        assertThrows(UnsupportedOperationException.class,
                () -> ((List<Object>) part.metadata().get("trace")).add("b"));

        assertEquals(before, part.toProjection());
        assertEquals(Map.of("inner", Map.of("k", "v1"), "rows", List.of("r1")), part.data());
    }
}
