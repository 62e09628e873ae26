package dev.odoorpc.client;

/**
 * Invalid connector settings (port, timeout, protocol name). Raised while configuring, before any
 * request is sent.
 */
public class ConnectorConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConnectorConfigurationException(String message) {
        super(message);
    }

    public ConnectorConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
