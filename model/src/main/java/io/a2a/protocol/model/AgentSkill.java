package io.a2a.protocol.model;

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
 * A capability an agent advertises on its {@link AgentCard}.
 *
 * @param id unique skill identifier
 * @param name human readable name
 * @param description optional description
 * @param tags optional keywords
 * @param examples optional example prompts
 * @param inputModes optional input modes overriding the card defaults, accepted as {@code input_modes}
 * @param outputModes optional output modes overriding the card defaults, accepted as {@code output_modes}
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSkill(@JsonProperty("id") String id,
                         @JsonProperty("name") String name,
                         @JsonProperty("description") @Nullable String description,
                         @JsonProperty("tags") @Nullable List<String> tags,
                         @JsonProperty("examples") @Nullable List<String> examples,
                         @JsonProperty("inputModes") @JsonAlias("input_modes") @Nullable List<String> inputModes,
                         @JsonProperty("outputModes") @JsonAlias("output_modes") @Nullable List<String> outputModes) {

    @JsonCreator
    public AgentSkill {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("name", name);
        tags = Utils.copyOfNullable(tags);
        examples = Utils.copyOfNullable(examples);
        inputModes = Utils.copyOfNullable(inputModes);
        outputModes = Utils.copyOfNullable(outputModes);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static AgentSkill fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, AgentSkill.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private @Nullable String id;
        private @Nullable String name;
        private @Nullable String description;
        private @Nullable List<String> tags;
        private @Nullable List<String> examples;
        private @Nullable List<String> inputModes;
        private @Nullable List<String> outputModes;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder tags(@Nullable List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder examples(@Nullable List<String> examples) {
            this.examples = examples;
            return this;
        }

        public Builder inputModes(@Nullable List<String> inputModes) {
            this.inputModes = inputModes;
            return this;
        }

        public Builder outputModes(@Nullable List<String> outputModes) {
            this.outputModes = outputModes;
            return this;
        }

        public AgentSkill build() {
            return new AgentSkill(Assert.checkNotNullParam("id", id), Assert.checkNotNullParam("name", name),
                    description, tags, examples, inputModes, outputModes);
        }
    }
}
