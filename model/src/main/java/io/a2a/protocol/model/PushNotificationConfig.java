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
 * Where and how an agent should push task updates to a client.
 * <p>
 * This is configuration only; delivering notifications is left to the integrator.
 *
 * @param url the callback URL
 * @param token optional token the client uses to validate notifications
 * @param authentication optional authentication the agent must use when calling {@code url}
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PushNotificationConfig(@JsonProperty("url") String url,
                                     @JsonProperty("token") @Nullable String token,
                                     @JsonProperty("authentication") @Nullable AgentAuthentication authentication) {

    @JsonCreator
    public PushNotificationConfig {
        Assert.checkNotNullParam("url", url);
    }

    public PushNotificationConfig(String url) {
        this(url, null, null);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static PushNotificationConfig fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, PushNotificationConfig.class);
    }
}
