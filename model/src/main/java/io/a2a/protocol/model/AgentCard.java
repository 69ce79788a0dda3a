package io.a2a.protocol.model;

import java.util.ArrayList;
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
 * The self-description an agent publishes: identity, endpoint, capabilities and skills.
 * <p>
 * Clients read the card to discover what an agent can do; the server reads the {@link AgentCapabilities} of
 * the card it serves to decide which optional methods it accepts.
 * <pre>{@code
 * AgentCard card = AgentCard.builder()
 *     .name("Weather Agent")
 *     .url("https://weather.example.com/a2a")
 *     .version("1.0.0")
 *     .capabilities(AgentCapabilities.builder().streaming(true).build())
 *     .skills(List.of(Map.of("id", "forecast", "name", "Forecast")))
 *     .build();
 * }</pre>
 *
 * @param name the agent name
 * @param url the endpoint serving the protocol
 * @param version the agent version
 * @param capabilities the optional features supported
 * @param skills the advertised skills, possibly empty
 * @param description optional description
 * @param provider optional operator of the agent
 * @param documentationUrl optional documentation location, accepted as {@code documentation_url}
 * @param authentication optional authentication requirements
 * @param defaultInputModes input modes accepted by default, {@code ["text"]} when omitted
 * @param defaultOutputModes output modes produced by default, {@code ["text"]} when omitted
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentCard(@JsonProperty("name") String name,
                        @JsonProperty("url") String url,
                        @JsonProperty("version") String version,
                        @JsonProperty("capabilities") AgentCapabilities capabilities,
                        @JsonProperty("skills") List<AgentSkill> skills,
                        @JsonProperty("description") @Nullable String description,
                        @JsonProperty("provider") @Nullable AgentProvider provider,
                        @JsonProperty("documentationUrl") @JsonAlias("documentation_url") @Nullable String documentationUrl,
                        @JsonProperty("authentication") @Nullable AgentAuthentication authentication,
                        @JsonProperty("defaultInputModes") @JsonAlias("default_input_modes") List<String> defaultInputModes,
                        @JsonProperty("defaultOutputModes") @JsonAlias("default_output_modes") List<String> defaultOutputModes) {

    public static final List<String> DEFAULT_MODES = List.of("text");

    @JsonCreator
    public AgentCard {
        Assert.checkNotNullParam("name", name);
        Assert.checkNotNullParam("url", url);
        Assert.checkNotNullParam("version", version);
        Assert.checkNotNullParam("capabilities", capabilities);
        skills = Utils.normalizeAll(Assert.checkNotNullParam("skills", skills), AgentSkill.class);
        defaultInputModes = defaultInputModes == null ? DEFAULT_MODES : Utils.copyOfNullable(defaultInputModes);
        defaultOutputModes = defaultOutputModes == null ? DEFAULT_MODES : Utils.copyOfNullable(defaultOutputModes);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static AgentCard fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, AgentCard.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(AgentCard card) {
        return new Builder(card);
    }

    public static class Builder {

        private @Nullable String name;
        private @Nullable String url;
        private @Nullable String version;
        private @Nullable AgentCapabilities capabilities;
        private List<?> skills = new ArrayList<>();
        private @Nullable String description;
        private @Nullable AgentProvider provider;
        private @Nullable String documentationUrl;
        private @Nullable AgentAuthentication authentication;
        private @Nullable List<String> defaultInputModes;
        private @Nullable List<String> defaultOutputModes;

        private Builder() {
        }

        private Builder(AgentCard card) {
            name = card.name;
            url = card.url;
            version = card.version;
            capabilities = card.capabilities;
            skills = card.skills;
            description = card.description;
            provider = card.provider;
            documentationUrl = card.documentationUrl;
            authentication = card.authentication;
            defaultInputModes = card.defaultInputModes;
            defaultOutputModes = card.defaultOutputModes;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /**
         * @param capabilities {@link AgentCapabilities} or its projection
         * @return this builder
         */
        public Builder capabilities(Object capabilities) {
            this.capabilities = Utils.normalize(capabilities, AgentCapabilities.class);
            return this;
        }

        /**
         * @param skills {@link AgentSkill} instances or skill projections
         * @return this builder
         */
        public Builder skills(List<?> skills) {
            this.skills = Assert.checkNotNullParam("skills", skills);
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        /**
         * @param provider {@link AgentProvider}, its projection, or {@code null}
         * @return this builder
         */
        public Builder provider(@Nullable Object provider) {
            this.provider = provider == null ? null : Utils.normalize(provider, AgentProvider.class);
            return this;
        }

        public Builder documentationUrl(@Nullable String documentationUrl) {
            this.documentationUrl = documentationUrl;
            return this;
        }

        /**
         * @param authentication {@link AgentAuthentication}, its projection, or {@code null}
         * @return this builder
         */
        public Builder authentication(@Nullable Object authentication) {
            this.authentication = authentication == null
                    ? null
                    : Utils.normalize(authentication, AgentAuthentication.class);
            return this;
        }

        public Builder defaultInputModes(@Nullable List<String> defaultInputModes) {
            this.defaultInputModes = defaultInputModes;
            return this;
        }

        public Builder defaultOutputModes(@Nullable List<String> defaultOutputModes) {
            this.defaultOutputModes = defaultOutputModes;
            return this;
        }

        public AgentCard build() {
            return new AgentCard(
                    Assert.checkNotNullParam("name", name),
                    Assert.checkNotNullParam("url", url),
                    Assert.checkNotNullParam("version", version),
                    Assert.checkNotNullParam("capabilities", capabilities),
                    Utils.normalizeAll(skills, AgentSkill.class),
                    description,
                    provider,
                    documentationUrl,
                    authentication,
                    defaultInputModes,
                    defaultOutputModes);
        }
    }
}
