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
 * A unit of work exchanged between a client and an agent.
 * <p>
 * Tasks are immutable snapshots. Progress (a new status, an extra artifact) is expressed by building a new
 * task from the previous one with {@link #builder(Task)}; the previous snapshot is never changed:
 * <pre>{@code
 * Task working = Task.builder(submitted)
 *     .status(new TaskStatus(TaskState.WORKING, null, clock))
 *     .build();
 * }</pre>
 *
 * @param id the task identifier
 * @param status the current status
 * @param sessionId optional session grouping related tasks, accepted as {@code session_id} on input
 * @param artifacts the outputs produced so far; absent and empty are distinct and both preserved
 * @param metadata optional metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Task(@JsonProperty("id") String id,
                   @JsonProperty("status") TaskStatus status,
                   @JsonProperty("sessionId") @JsonAlias("session_id") @Nullable String sessionId,
                   @JsonProperty("artifacts") @Nullable List<Artifact> artifacts,
                   @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {

    @JsonCreator
    public Task {
        Assert.checkNotBlankParam("id", id);
        Assert.checkNotNullParam("status", status);
        artifacts = artifacts == null ? null : Utils.normalizeAll(artifacts, Artifact.class);
        metadata = Utils.copyOfNullable(metadata);
    }

    /**
     * @return the state of the current status
     */
    public TaskState state() {
        return status.state();
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static Task fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, Task.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param task the snapshot to start from
     * @return a builder holding every field of {@code task}
     */
    public static Builder builder(Task task) {
        return new Builder(task);
    }

    public static class Builder {

        private @Nullable String id;
        private @Nullable TaskStatus status;
        private @Nullable String sessionId;
        private @Nullable List<Object> artifacts;
        private @Nullable Map<String, Object> metadata;

        private Builder() {
        }

        private Builder(Task task) {
            id = task.id;
            status = task.status;
            sessionId = task.sessionId;
            artifacts = task.artifacts == null ? null : new ArrayList<>(task.artifacts);
            metadata = task.metadata;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * @param status a {@link TaskStatus} or its projection
         * @return this builder
         */
        public Builder status(Object status) {
            this.status = Utils.normalize(status, TaskStatus.class);
            return this;
        }

        public Builder sessionId(@Nullable String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        /**
         * @param artifacts {@link Artifact} instances or artifact projections, or {@code null} for none
         * @return this builder
         */
        public Builder artifacts(@Nullable List<?> artifacts) {
            this.artifacts = artifacts == null ? null : new ArrayList<>(artifacts);
            return this;
        }

        public Builder addArtifact(Object artifact) {
            if (artifacts == null) {
                artifacts = new ArrayList<>();
            }
            artifacts.add(artifact);
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Task build() {
            return new Task(Assert.checkNotNullParam("id", id), Assert.checkNotNullParam("status", status),
                    sessionId, artifacts == null ? null : Utils.normalizeAll(artifacts, Artifact.class), metadata);
        }
    }
}
