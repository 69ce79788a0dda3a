package io.a2a.protocol.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Authentication requirements, used both by an {@link AgentCard} and by a {@link PushNotificationConfig}.
 * Schemes are carried as opaque names ({@code "Bearer"}, {@code "Basic"}, ...); nothing is enforced here.
 *
 * @param schemes the supported authentication schemes
 * @param credentials optional credentials
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentAuthentication(@JsonProperty("schemes") List<String> schemes,
                                  @JsonProperty("credentials") @Nullable String credentials) {

    @JsonCreator
    public AgentAuthentication {
        schemes = Utils.copyOfNullable(Assert.checkNotNullParam("schemes", schemes));
    }

    public AgentAuthentication(List<String> schemes) {
        this(schemes, null);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static AgentAuthentication fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, AgentAuthentication.class);
    }
}
