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
 * Represents a file content part within a {@link Message} or {@link Artifact}.
 * <p>
 * The file is carried either inline as base64 encoded bytes or by reference through a URI, see
 * {@link FileContent}.
 * <pre>{@code
 * FilePart inline = new FilePart(FileContent.ofBytes("diagram.png", "image/png", "iVBORw0KGgo..."));
 * FilePart remote = new FilePart(FileContent.ofUri("photo.png", "image/png", "https://example.com/photo.png"));
 * }</pre>
 *
 * @param file the file content, required
 * @param metadata optional metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type", "file", "metadata"})
@JsonDeserialize(using = JsonDeserializer.None.class)
public record FilePart(@JsonProperty("file") FileContent file,
                       @JsonProperty("metadata") @Nullable Map<String, Object> metadata) implements Part {

    public static final String FILE = "file";

    @JsonCreator
    public FilePart {
        Assert.checkNotNullParam("file", file);
        metadata = Utils.copyOfNullable(metadata);
    }

    public FilePart(FileContent file) {
        this(file, null);
    }

    @Override
    @JsonProperty("type")
    public Type type() {
        return Type.FILE;
    }

    public static FilePart fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, FilePart.class);
    }
}
