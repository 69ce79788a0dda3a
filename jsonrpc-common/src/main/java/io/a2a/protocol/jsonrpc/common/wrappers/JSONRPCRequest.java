package io.a2a.protocol.jsonrpc.common.wrappers;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.a2a.protocol.model.A2AValidationException;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 request.
 * <p>
 * {@code params} is kept in its projected form: a JSON object ({@link Map}) or array ({@link List}). Any other
 * value handed to the constructor, typically a parameters record such as
 * {@link io.a2a.protocol.model.TaskSendParams}, is projected first. A request without an {@code id} is a
 * notification: it is executed but never answered.
 *
 * <pre>{@code
 * {"jsonrpc":"2.0","id":1,"method":"tasks/get","params":{"taskId":"t-1"}}
 * }</pre>
 *
 * @param jsonrpc always {@value #JSONRPC_VERSION}
 * @param method the method name, see {@link A2AMethods}
 * @param params optional parameters, an object or an array
 * @param id optional string or number correlating the response
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"jsonrpc", "id", "method", "params"})
public record JSONRPCRequest(@JsonProperty("jsonrpc") String jsonrpc,
                             @JsonProperty("method") String method,
                             @JsonProperty("params") @Nullable Object params,
                             @JsonProperty("id") @Nullable Object id) {

    public static final String JSONRPC_VERSION = "2.0";

    @JsonCreator
    public JSONRPCRequest {
        if (!JSONRPC_VERSION.equals(jsonrpc)) {
            throw new A2AValidationException("Parameter 'jsonrpc' must be \"" + JSONRPC_VERSION + "\" but was " + jsonrpc);
        }
        Assert.checkNotBlankParam("method", method);
        params = projectParams(params);
        checkId(id);
    }

    public JSONRPCRequest(String method, @Nullable Object params, @Nullable Object id) {
        this(JSONRPC_VERSION, method, params, id);
    }

    /**
     * @return {@code true} when the request carries no id and expects no response
     */
    @JsonIgnore
    public boolean isNotification() {
        return id == null;
    }

    /**
     * Binds the parameters to a parameters type.
     *
     * @param type for example {@link io.a2a.protocol.model.TaskIdParams}
     * @param <T> the parameters type
     * @return the bound parameters
     * @throws A2AValidationException if the parameters are absent, not an object, or invalid for {@code type}
     */
    @SuppressWarnings("unchecked")
    public <T> T getParams(Class<T> type) {
        if (!(params instanceof Map<?, ?> map)) {
            throw new A2AValidationException("Method " + method + " requires an object of parameters");
        }
        return Utils.fromProjection((Map<String, ?>) map, type);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static JSONRPCRequest fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, JSONRPCRequest.class);
    }

    static void checkId(@Nullable Object id) {
        if (id != null && !(id instanceof String) && !(id instanceof Number)) {
            throw new A2AValidationException("Parameter 'id' must be a string or a number but was "
                    + id.getClass().getSimpleName());
        }
    }

    private static @Nullable Object projectParams(@Nullable Object params) {
        if (params == null) {
            return null;
        }
        if (params instanceof Map<?, ?> map) {
            return Utils.copyOfNullable(castMap(map));
        }
        if (params instanceof List<?> list) {
            return Utils.copyOfNullable(list);
        }
        if (params instanceof CharSequence || params instanceof Number || params instanceof Boolean) {
            throw new A2AValidationException("Parameter 'params' must be an object or an array");
        }
        return Utils.toProjection(params);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }
}
