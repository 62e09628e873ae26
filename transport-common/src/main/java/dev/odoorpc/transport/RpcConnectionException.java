package dev.odoorpc.transport;

/**
 * The HTTP exchange did not complete: connection refused, TLS handshake failure, timeout or any
 * other socket level error. The underlying failure is available as the cause.
 */
public class RpcConnectionException extends RpcException {

    private static final long serialVersionUID = 1L;

    public RpcConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
