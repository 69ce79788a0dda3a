package io.a2a.protocol.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * An output produced by an agent while working on a {@link Task}.
 * <p>
 * Large outputs may be streamed as chunks sharing an {@code index}: {@code append} marks a chunk that
 * extends the artifact already received at that index, {@code lastChunk} marks the final one. These flags are
 * declarative; they are carried as given and not checked for coherence.
 *
 * @param parts the content, in order
 * @param name optional name
 * @param description optional description
 * @param index position of the artifact within the task, defaults to 0
 * @param append whether this chunk appends to a previous one
 * @param lastChunk whether this is the final chunk, accepted as {@code last_chunk} on input
 * @param metadata optional metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Artifact(@JsonProperty("parts") List<Part> parts,
                       @JsonProperty("name") @Nullable String name,
                       @JsonProperty("description") @Nullable String description,
                       @JsonProperty("index") int index,
                       @JsonProperty("append") @Nullable Boolean append,
                       @JsonProperty("lastChunk") @JsonAlias("last_chunk") @Nullable Boolean lastChunk,
                       @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {

    @JsonCreator
    public Artifact {
        Assert.checkNotNullParam("parts", parts);
        parts = Part.normalizeAll(parts);
        metadata = Utils.copyOfNullable(metadata);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static Artifact fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, Artifact.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Artifact artifact) {
        return new Builder(artifact);
    }

    public static class Builder {

        private List<Object> parts = new ArrayList<>();
        private @Nullable String name;
        private @Nullable String description;
        private int index;
        private @Nullable Boolean append;
        private @Nullable Boolean lastChunk;
        private @Nullable Map<String, Object> metadata;

        private Builder() {
        }

        private Builder(Artifact existingArtifact) {
            parts = new ArrayList<>(existingArtifact.parts);
            name = existingArtifact.name;
            description = existingArtifact.description;
            index = existingArtifact.index;
            append = existingArtifact.append;
            lastChunk = existingArtifact.lastChunk;
            metadata = existingArtifact.metadata;
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

        public Builder name(@Nullable String name) {
            this.name = name;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder append(@Nullable Boolean append) {
            this.append = append;
            return this;
        }

        public Builder lastChunk(@Nullable Boolean lastChunk) {
            this.lastChunk = lastChunk;
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Artifact build() {
            return new Artifact(Part.normalizeAll(parts), name, description, index, append, lastChunk, metadata);
        }
    }
}
