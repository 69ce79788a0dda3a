package io.a2a.protocol.server.util;

import java.util.List;
import java.util.Map;

import io.a2a.protocol.model.Artifact;
import io.a2a.protocol.model.DataPart;
import io.a2a.protocol.model.Part;
import io.a2a.protocol.model.TextPart;
import org.jspecify.annotations.Nullable;

/**
 * Shortcuts for the artifacts agents produce most often.
 */
public final class ArtifactUtils {

    private ArtifactUtils() {
    }

    public static Artifact newArtifact(List<Part> parts, @Nullable String name, @Nullable String description) {
        return Artifact.builder()
                .parts(parts)
                .name(name)
                .description(description)
                .build();
    }

    public static Artifact newArtifact(List<Part> parts, @Nullable String name) {
        return newArtifact(parts, name, null);
    }

    public static Artifact newTextArtifact(@Nullable String name, String text, @Nullable String description) {
        return newArtifact(List.of(new TextPart(text)), name, description);
    }

    public static Artifact newTextArtifact(@Nullable String name, String text) {
        return newTextArtifact(name, text, null);
    }

    public static Artifact newDataArtifact(@Nullable String name, Map<String, Object> data,
                                           @Nullable String description) {
        return newArtifact(List.of(new DataPart(data)), name, description);
    }

    public static Artifact newDataArtifact(@Nullable String name, Map<String, Object> data) {
        return newDataArtifact(name, data, null);
    }

    /**
     * Builds one chunk of an artifact streamed at a given index.
     *
     * @param index the index shared by every chunk of the artifact
     * @param text the text of this chunk
     * @param append whether the chunk extends the previous ones
     * @param lastChunk whether this is the final chunk
     * @return the chunk
     */
    public static Artifact newTextChunk(int index, String text, boolean append, boolean lastChunk) {
        return Artifact.builder()
                .parts(new TextPart(text))
                .index(index)
                .append(append)
                .lastChunk(lastChunk)
                .build();
    }
}
