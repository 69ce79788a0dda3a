package io.a2a.protocol.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * The organization that operates an agent.
 *
 * @param organization the organization name
 * @param url optional website of the organization
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentProvider(@JsonProperty("organization") String organization,
                            @JsonProperty("url") @Nullable String url) {

    @JsonCreator
    public AgentProvider {
        Assert.checkNotNullParam("organization", organization);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static AgentProvider fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, AgentProvider.class);
    }
}
