package dev.odoorpc.transport;

/**
 * The server answered, but the body is not a well-formed JSON-RPC response envelope.
 */
public class RpcProtocolException extends RpcException {

    private static final long serialVersionUID = 1L;

    public RpcProtocolException(String message) {
        super(message);
    }

    public RpcProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
