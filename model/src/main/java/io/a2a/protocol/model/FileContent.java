package io.a2a.protocol.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * The content of a file carried by a {@link FilePart}: either inline base64 encoded bytes or a URI
 * reference, never both and never neither.
 *
 * @param name optional file name
 * @param mimeType optional MIME type, accepted as {@code mime_type} on input
 * @param bytes base64 encoded content
 * @param uri location of the content
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileContent(@JsonProperty("name") @Nullable String name,
                          @JsonProperty("mimeType") @JsonAlias("mime_type") @Nullable String mimeType,
                          @JsonProperty("bytes") @Nullable String bytes,
                          @JsonProperty("uri") @Nullable String uri) {

    @JsonCreator
    public FileContent {
        if ((bytes == null) == (uri == null)) {
            throw new A2AValidationException("FileContent must provide exactly one of bytes or uri");
        }
    }

    public static FileContent ofBytes(@Nullable String name, @Nullable String mimeType, String bytes) {
        return new FileContent(name, mimeType, bytes, null);
    }

    public static FileContent ofUri(@Nullable String name, @Nullable String mimeType, String uri) {
        return new FileContent(name, mimeType, null, uri);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static FileContent fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, FileContent.class);
    }
}
