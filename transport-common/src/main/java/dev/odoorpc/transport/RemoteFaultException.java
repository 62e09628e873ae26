package dev.odoorpc.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * A well-formed response envelope carrying an {@code error} member. The server message is the
 * exception message; the nested {@code data} object, when present, names the server-side
 * exception class so callers can tell an access error from a validation error:
 *
 * <pre>
 * {"message": "Odoo Server Error", "code": 200,
 *  "data": {"name": "odoo.exceptions.AccessDenied", "message": "Access Denied", "debug": "Traceback ..."}}
 * </pre>
 */
public class RemoteFaultException extends RpcException {

    private static final long serialVersionUID = 1L;

    private final Integer code;
    private final String remoteName;
    private final String remoteMessage;
    private final String debug;
    private final transient JsonNode data;

    public RemoteFaultException(String message, Integer code, JsonNode data) {
        super(message);
        this.code = code;
        this.data = data == null ? MissingNode.getInstance() : data;
        this.remoteName = textOrNull(this.data.get("name"));
        this.remoteMessage = textOrNull(this.data.get("message"));
        this.debug = textOrNull(this.data.get("debug"));
    }

    /**
     * Build the exception from the {@code error} member of a response envelope.
     * @param error the error object, never {@code null}
     * @return the matching exception
     */
    public static RemoteFaultException fromError(JsonNode error) {
        JsonNode code = error.get("code");
        return new RemoteFaultException(
            error.path("message").asText(""),
            code != null && code.canConvertToInt() ? code.intValue() : null,
            error.get("data"));
    }

    /**
     * @return the JSON-RPC error code, or {@code null} when the server sent none
     */
    public Integer getCode() {
        return code;
    }

    /**
     * @return the fully qualified name of the server-side exception, e.g.
     * {@code odoo.exceptions.AccessDenied}, or {@code null}
     */
    public String getRemoteName() {
        return remoteName;
    }

    /**
     * @return the message of the server-side exception, or {@code null}
     */
    public String getRemoteMessage() {
        return remoteMessage;
    }

    /**
     * @return the server traceback, or {@code null}
     */
    public String getDebug() {
        return debug;
    }

    /**
     * @return the raw {@code data} member; a missing node when the server sent none
     */
    public JsonNode getData() {
        return data;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }
}
