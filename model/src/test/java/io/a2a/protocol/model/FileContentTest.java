package io.a2a.protocol.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

class FileContentTest {

    @Test
    void testBytesOrUriIsRequired() {
        A2AValidationException e = assertThrows(A2AValidationException.class,
                () -> new FileContent("a.txt", null, null, null));

        assertEquals("FileContent must provide exactly one of bytes or uri", e.getMessage());
    }

    @Test
    void testBytesAndUriAreExclusive() {
        assertThrows(A2AValidationException.class,
                () -> new FileContent(null, null, "aGk=", "https://example.com/a"));
        assertThrows(A2AValidationException.class,
                () -> FileContent.fromProjection(Map.of("bytes", "aGk=", "uri", "https://example.com/a")));
    }

    @Test
    void testSnakeCaseMimeTypeIsAccepted() {
        FileContent content = FileContent.fromProjection(Map.of("mime_type", "image/png", "uri", "file:///a.png"));

        assertEquals("image/png", content.mimeType());
        assertEquals(Map.of("mimeType", "image/png", "uri", "file:///a.png"), content.toProjection());
    }

    @Test
    void testFactories() {
        FileContent bytes = FileContent.ofBytes(null, null, "aGk=");
        FileContent uri = FileContent.ofUri("a", "text/plain", "https://example.com/a");

        assertNull(bytes.uri());
        assertEquals(Map.of("bytes", "aGk="), bytes.toProjection());
        assertNull(uri.bytes());
        assertEquals("https://example.com/a", uri.uri());
    }
}
