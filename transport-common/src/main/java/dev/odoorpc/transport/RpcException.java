package dev.odoorpc.transport;

import java.io.IOException;

/**
 * Base type of every failure raised while talking to the server: the transport could not
 * complete the exchange, the server answered with something that is not a JSON-RPC envelope, or
 * the server reported a fault.
 */
public abstract class RpcException extends IOException {

    private static final long serialVersionUID = 1L;

    protected RpcException(String message) {
        super(message);
    }

    protected RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
