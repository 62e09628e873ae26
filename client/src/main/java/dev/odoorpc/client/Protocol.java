package dev.odoorpc.client;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Protocols a {@link Connector} can speak, by the names used in configuration files.
 */
public enum Protocol {

    JSONRPC("jsonrpc", false),
    JSONRPC_SSL("jsonrpc+ssl", true);

    private final String protocolName;
    private final boolean ssl;

    Protocol(String protocolName, boolean ssl) {
        this.protocolName = protocolName;
        this.ssl = ssl;
    }

    public String protocolName() {
        return protocolName;
    }

    public boolean isSsl() {
        return ssl;
    }

    public String scheme() {
        return ssl ? "https" : "http";
    }

    public static Protocol fromName(String name) {
        for (Protocol protocol : values()) {
            if (protocol.protocolName.equalsIgnoreCase(name)) {
                return protocol;
            }
        }
        String supported = Arrays.stream(values()).map(Protocol::protocolName).collect(Collectors.joining(", "));
        throw new ConnectorConfigurationException("The protocol '" + name + "' is not supported. Use one of: " + supported);
    }
}
