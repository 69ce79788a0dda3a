package io.a2a.protocol.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.a2a.protocol.util.Utils;

/**
 * The optional protocol features an agent supports. Flags omitted from a projection are {@code false}.
 * <p>
 * The server consults {@link #streaming()} before serving {@code tasks/sendSubscribe} and
 * {@code tasks/resubscribe}, and {@link #pushNotifications()} before serving the push notification methods.
 *
 * @param streaming whether the agent streams task updates
 * @param pushNotifications whether the agent can push task updates to a client supplied URL, accepted as
 *                          {@code push_notifications} on input
 * @param stateTransitionHistory whether the agent keeps the history of status transitions, accepted as
 *                               {@code state_transition_history} on input
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentCapabilities(@JsonProperty("streaming") boolean streaming,
                                @JsonProperty("pushNotifications") @JsonAlias("push_notifications")
                                boolean pushNotifications,
                                @JsonProperty("stateTransitionHistory") @JsonAlias("state_transition_history")
                                boolean stateTransitionHistory) {

    @JsonCreator
    public AgentCapabilities {
    }

    public AgentCapabilities() {
        this(false, false, false);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static AgentCapabilities fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, AgentCapabilities.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private boolean streaming;
        private boolean pushNotifications;
        private boolean stateTransitionHistory;

        private Builder() {
        }

        public Builder streaming(boolean streaming) {
            this.streaming = streaming;
            return this;
        }

        public Builder pushNotifications(boolean pushNotifications) {
            this.pushNotifications = pushNotifications;
            return this;
        }

        public Builder stateTransitionHistory(boolean stateTransitionHistory) {
            this.stateTransitionHistory = stateTransitionHistory;
            return this;
        }

        public AgentCapabilities build() {
            return new AgentCapabilities(streaming, pushNotifications, stateTransitionHistory);
        }
    }
}
